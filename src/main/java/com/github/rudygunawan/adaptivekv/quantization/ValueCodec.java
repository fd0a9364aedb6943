package com.github.rudygunawan.adaptivekv.quantization;

import com.github.rudygunawan.adaptivekv.model.Value;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tagged binary format for quantized values.
 *
 * <p>Every node starts with a one-byte tag, so a byte array decodes without any outside
 * information. Lengths and counts are unsigned LEB128 varints, signed integers are zig-zag
 * varints, and map keys are always UTF-8.
 *
 * <pre>
 *   0  null              1  false             2  true
 *   3  utf8 string       [len][bytes]
 *   4  nibble string     [original byte len][packed bytes]
 *   5  int8 number       [1 signed byte]
 *   6  float32 number    [4 bytes, big-endian]
 *   7  centi number      [zig-zag varint of round(v * 100)]
 *   8  nibble number     [1 byte, low 4 bits]
 *   9  list              [count][items...]
 *  10  map               [count]([key len][key utf8][value])...
 * </pre>
 */
final class ValueCodec {
    private static final int TAG_NULL = 0;
    private static final int TAG_FALSE = 1;
    private static final int TAG_TRUE = 2;
    private static final int TAG_UTF8_STRING = 3;
    private static final int TAG_NIBBLE_STRING = 4;
    private static final int TAG_INT8_NUMBER = 5;
    private static final int TAG_FLOAT32_NUMBER = 6;
    private static final int TAG_CENTI_NUMBER = 7;
    private static final int TAG_NIBBLE_NUMBER = 8;
    private static final int TAG_LIST = 9;
    private static final int TAG_MAP = 10;

    // round(v * 100) must fit in a long
    private static final double MAX_CENTI_MAGNITUDE = 9.0e16;

    private ValueCodec() {
    }

    static byte[] encode(Value value, QuantizationType type) {
        if (type == QuantizationType.NONE) {
            throw new IllegalArgumentException("NONE values are stored raw, not encoded");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(out, value, type);
        return out.toByteArray();
    }

    static Value decode(byte[] bytes) {
        ByteBuffer in = ByteBuffer.wrap(bytes);
        try {
            Value value = read(in);
            if (in.hasRemaining()) {
                throw new QuantizationException(in.remaining() + " trailing bytes after encoded value");
            }
            return value;
        } catch (BufferUnderflowException e) {
            throw new QuantizationException("encoded value is truncated", e);
        }
    }

    private static void write(ByteArrayOutputStream out, Value value, QuantizationType type) {
        switch (value.kind()) {
            case NULL -> out.write(TAG_NULL);
            case BOOLEAN -> out.write(((Value.BooleanValue) value).getValue() ? TAG_TRUE : TAG_FALSE);
            case STRING -> writeString(out, ((Value.StringValue) value).getValue(), type);
            case NUMBER -> writeNumber(out, ((Value.NumberValue) value).getValue(), type);
            case LIST -> {
                List<Value> items = ((Value.ListValue) value).getItems();
                out.write(TAG_LIST);
                writeVarint(out, items.size());
                for (Value item : items) {
                    write(out, item, type);
                }
            }
            case MAP -> {
                Map<String, Value> fields = ((Value.MapValue) value).getFields();
                out.write(TAG_MAP);
                writeVarint(out, fields.size());
                for (Map.Entry<String, Value> field : fields.entrySet()) {
                    writeUtf8(out, field.getKey());
                    write(out, field.getValue(), type);
                }
            }
        }
    }

    private static void writeString(ByteArrayOutputStream out, String s, QuantizationType type) {
        if (type != QuantizationType.INT4) {
            out.write(TAG_UTF8_STRING);
            writeUtf8(out, s);
            return;
        }
        // Two high nibbles per byte; low nibbles are dropped
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        out.write(TAG_NIBBLE_STRING);
        writeVarint(out, bytes.length);
        for (int i = 0; i < bytes.length; i += 2) {
            int high = (bytes[i] & 0xFF) >> 4;
            int low = i + 1 < bytes.length ? (bytes[i + 1] & 0xFF) >> 4 : 0;
            out.write((high << 4) | low);
        }
    }

    private static void writeNumber(ByteArrayOutputStream out, double v, QuantizationType type) {
        switch (type) {
            case INT8 -> {
                if (v == Math.rint(v) && v >= Byte.MIN_VALUE && v <= Byte.MAX_VALUE
                        && !(v == 0.0 && Double.doubleToRawLongBits(v) != 0L)) {
                    out.write(TAG_INT8_NUMBER);
                    out.write((byte) v);
                } else {
                    int bits = Float.floatToIntBits((float) v);
                    out.write(TAG_FLOAT32_NUMBER);
                    out.write(bits >>> 24);
                    out.write(bits >>> 16);
                    out.write(bits >>> 8);
                    out.write(bits);
                }
            }
            case FP8 -> {
                if (!Double.isFinite(v)) {
                    throw new QuantizationException("cannot quantize non-finite number " + v + " to FP8");
                }
                if (Math.abs(v) >= MAX_CENTI_MAGNITUDE) {
                    throw new QuantizationException("number " + v + " is out of FP8 range");
                }
                out.write(TAG_CENTI_NUMBER);
                writeZigZag(out, Math.round(v * 100));
            }
            case INT4 -> {
                if (!Double.isFinite(v)) {
                    throw new QuantizationException("cannot quantize non-finite number " + v + " to INT4");
                }
                out.write(TAG_NIBBLE_NUMBER);
                out.write((int) (Math.round(v) & 0xF));
            }
            default -> throw new IllegalArgumentException("unsupported quantization type: " + type);
        }
    }

    private static Value read(ByteBuffer in) {
        int tag = in.get() & 0xFF;
        switch (tag) {
            case TAG_NULL:
                return Value.nullValue();
            case TAG_FALSE:
                return Value.of(false);
            case TAG_TRUE:
                return Value.of(true);
            case TAG_UTF8_STRING:
                return Value.of(readUtf8(in));
            case TAG_NIBBLE_STRING: {
                int length = readLength(in);
                byte[] bytes = new byte[length];
                for (int i = 0; i < length; i += 2) {
                    int packed = in.get() & 0xFF;
                    bytes[i] = (byte) ((packed >> 4) << 4);
                    if (i + 1 < length) {
                        bytes[i + 1] = (byte) ((packed & 0xF) << 4);
                    }
                }
                return Value.of(new String(bytes, StandardCharsets.UTF_8));
            }
            case TAG_INT8_NUMBER:
                return Value.of((double) in.get());
            case TAG_FLOAT32_NUMBER:
                return Value.of((double) in.getFloat());
            case TAG_CENTI_NUMBER:
                return Value.of(readZigZag(in) / 100.0);
            case TAG_NIBBLE_NUMBER:
                return Value.of((double) (in.get() & 0xF));
            case TAG_LIST: {
                int count = readLength(in);
                List<Value> items = new ArrayList<>(Math.min(count, in.remaining()));
                for (int i = 0; i < count; i++) {
                    items.add(read(in));
                }
                return Value.list(items);
            }
            case TAG_MAP: {
                int count = readLength(in);
                Map<String, Value> fields = new LinkedHashMap<>();
                for (int i = 0; i < count; i++) {
                    String key = readUtf8(in);
                    fields.put(key, read(in));
                }
                return Value.map(fields);
            }
            default:
                throw new QuantizationException("unknown tag " + tag + " at offset " + (in.position() - 1));
        }
    }

    private static void writeUtf8(ByteArrayOutputStream out, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        writeVarint(out, bytes.length);
        out.write(bytes, 0, bytes.length);
    }

    private static String readUtf8(ByteBuffer in) {
        int length = readLength(in);
        byte[] bytes = new byte[length];
        in.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static void writeVarint(ByteArrayOutputStream out, long value) {
        while ((value & ~0x7FL) != 0) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) value);
    }

    private static long readVarint(ByteBuffer in) {
        long result = 0;
        for (int shift = 0; shift < 64; shift += 7) {
            int b = in.get() & 0xFF;
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new QuantizationException("malformed varint");
    }

    private static int readLength(ByteBuffer in) {
        long length = readVarint(in);
        if (length < 0 || length > in.remaining() * 2L + 1) {
            throw new QuantizationException("invalid length " + length);
        }
        return (int) length;
    }

    private static void writeZigZag(ByteArrayOutputStream out, long value) {
        writeVarint(out, (value << 1) ^ (value >> 63));
    }

    private static long readZigZag(ByteBuffer in) {
        long raw = readVarint(in);
        return (raw >>> 1) ^ -(raw & 1);
    }
}
