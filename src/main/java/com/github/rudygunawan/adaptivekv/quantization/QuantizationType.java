package com.github.rudygunawan.adaptivekv.quantization;

/**
 * Encoding applied to a cached value to reduce its memory footprint.
 *
 * <ul>
 *   <li>{@link #NONE} - stored as is
 *   <li>{@link #INT8} - strings as UTF-8 bytes (exact), small integers as one byte (exact),
 *       other numbers as 32-bit floats (lossy)
 *   <li>{@link #FP8} - numbers rounded to two decimal places (lossy)
 *   <li>{@link #INT4} - strings reduced to packed 4-bit nibbles, numbers truncated to 4 bits
 *       (lossy, best effort)
 * </ul>
 *
 * @since 0.1.0
 */
public enum QuantizationType {
    NONE,
    INT8,
    FP8,
    INT4;

    /**
     * Returns {@code true} if values encoded with this type decode back to an equal value.
     * Only {@link #NONE} guarantees this for every value; {@link #INT8} does for strings,
     * booleans, null and integers in the signed byte range.
     */
    public boolean isLossless() {
        return this == NONE;
    }
}
