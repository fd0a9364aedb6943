package com.github.rudygunawan.adaptivekv.quantization;

import com.github.rudygunawan.adaptivekv.model.Value;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Encodes values into a compact tagged byte form and decodes them back.
 *
 * <p>Quantization never fails from the caller's point of view: if a value cannot be encoded with
 * the requested type, the failure is logged at WARNING, counted in {@link #errorCount()}, and a
 * result of type {@link QuantizationType#NONE} is returned so the caller keeps the raw value.
 *
 * <p>Usage example:
 * <pre>{@code
 * QuantizationEngine engine = new QuantizationEngine();
 * QuantizedValue q = engine.quantize(Value.of(3.14159), QuantizationType.FP8);
 * Value restored = engine.dequantize(q);   // 3.14
 * }</pre>
 */
public class QuantizationEngine {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptivekv.Quantization");

    private final AtomicLong errorCount = new AtomicLong(0);

    /**
     * Encodes {@code value} with {@code type}.
     *
     * @param value the value to encode
     * @param type the encoding to apply
     * @return the encoded value, or an unquantized result if {@code type} is {@code NONE} or
     *         encoding failed
     */
    public QuantizedValue quantize(Value value, QuantizationType type) {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(type, "type cannot be null");

        if (type == QuantizationType.NONE) {
            return new QuantizedValue(null, QuantizationMetadata.unquantized());
        }

        long originalSize = value.estimatedSize();
        try {
            byte[] encoded = ValueCodec.encode(value, type);
            return new QuantizedValue(encoded, new QuantizationMetadata(type, originalSize, encoded.length, null));
        } catch (QuantizationException e) {
            errorCount.incrementAndGet();
            LOGGER.log(Level.WARNING, "Quantization to " + type + " failed, storing value unquantized: "
                    + e.getMessage());
            return new QuantizedValue(null, QuantizationMetadata.failed(e.getMessage()));
        }
    }

    /**
     * Decodes a value produced by {@link #quantize}.
     *
     * @param quantized an encoded value
     * @return the decoded value, exact or approximate depending on the encoding
     * @throws IllegalArgumentException if {@code quantized} holds no encoded bytes
     * @throws QuantizationException if the encoded bytes are corrupt
     */
    public Value dequantize(QuantizedValue quantized) {
        Objects.requireNonNull(quantized, "quantized cannot be null");
        if (!quantized.isQuantized()) {
            throw new IllegalArgumentException("value was not quantized");
        }
        return ValueCodec.decode(quantized.encodedBytes());
    }

    /**
     * Returns the number of quantization attempts that fell back to unquantized storage.
     */
    public long errorCount() {
        return errorCount.get();
    }
}
