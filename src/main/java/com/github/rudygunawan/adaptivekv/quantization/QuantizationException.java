package com.github.rudygunawan.adaptivekv.quantization;

/**
 * Thrown when a value cannot be encoded or decoded with a given {@link QuantizationType}.
 *
 * <p>{@link QuantizationEngine#quantize} never lets this escape; it falls back to storing the
 * value unquantized.
 */
public class QuantizationException extends RuntimeException {

    public QuantizationException(String message) {
        super(message);
    }

    public QuantizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
