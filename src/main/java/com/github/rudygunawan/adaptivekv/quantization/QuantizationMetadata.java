package com.github.rudygunawan.adaptivekv.quantization;

import java.util.Objects;

/**
 * Describes how a stored value was encoded. Instances of this class are immutable.
 *
 * <p>A metadata object of type {@link QuantizationType#NONE} with a non-null {@link #getError()}
 * means quantization was attempted and failed, and the value was kept unquantized.
 */
public class QuantizationMetadata {
    private static final QuantizationMetadata UNQUANTIZED = new QuantizationMetadata(QuantizationType.NONE, 0, 0, null);

    private final QuantizationType type;
    private final long originalSize;
    private final long compressedSize;
    private final String error;

    QuantizationMetadata(QuantizationType type, long originalSize, long compressedSize, String error) {
        this.type = Objects.requireNonNull(type);
        this.originalSize = originalSize;
        this.compressedSize = compressedSize;
        this.error = error;
    }

    /**
     * Returns metadata for a value stored without quantization.
     */
    public static QuantizationMetadata unquantized() {
        return UNQUANTIZED;
    }

    static QuantizationMetadata failed(String error) {
        return new QuantizationMetadata(QuantizationType.NONE, 0, 0, error);
    }

    public QuantizationType getType() {
        return type;
    }

    /**
     * Returns the estimated size of the value before encoding, in bytes.
     */
    public long getOriginalSize() {
        return originalSize;
    }

    /**
     * Returns the size of the encoded bytes.
     */
    public long getCompressedSize() {
        return compressedSize;
    }

    /**
     * Returns {@code originalSize / compressedSize}, or {@code 1.0} for unquantized values.
     */
    public double getRatio() {
        if (type == QuantizationType.NONE || compressedSize == 0) {
            return 1.0;
        }
        return (double) originalSize / compressedSize;
    }

    /**
     * Returns the failure message if quantization failed, otherwise {@code null}.
     */
    public String getError() {
        return error;
    }

    public boolean isFailed() {
        return error != null;
    }

    @Override
    public String toString() {
        return "QuantizationMetadata{"
                + "type=" + type
                + ", originalSize=" + originalSize
                + ", compressedSize=" + compressedSize
                + ", ratio=" + String.format("%.2f", getRatio())
                + (error != null ? ", error=" + error : "")
                + '}';
    }
}
