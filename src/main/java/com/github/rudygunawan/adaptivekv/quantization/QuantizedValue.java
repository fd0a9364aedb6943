package com.github.rudygunawan.adaptivekv.quantization;

import java.util.Arrays;
import java.util.Objects;

/**
 * The encoded form of a {@link com.github.rudygunawan.adaptivekv.model.Value} together with the
 * metadata needed to decode it.
 */
public class QuantizedValue {
    private final byte[] encoded;
    private final QuantizationMetadata metadata;

    QuantizedValue(byte[] encoded, QuantizationMetadata metadata) {
        this.encoded = encoded;
        this.metadata = Objects.requireNonNull(metadata);
    }

    /**
     * Returns {@code true} if the value was encoded, {@code false} if quantization was skipped
     * or failed and the caller should keep the raw value.
     */
    public boolean isQuantized() {
        return encoded != null;
    }

    /**
     * Returns a copy of the encoded bytes.
     *
     * @throws IllegalStateException if the value was not quantized
     */
    public byte[] getEncoded() {
        if (encoded == null) {
            throw new IllegalStateException("value was not quantized");
        }
        return Arrays.copyOf(encoded, encoded.length);
    }

    byte[] encodedBytes() {
        return encoded;
    }

    /**
     * Returns the number of encoded bytes, or 0 if the value was not quantized.
     */
    public int size() {
        return encoded == null ? 0 : encoded.length;
    }

    public QuantizationMetadata getMetadata() {
        return metadata;
    }
}
