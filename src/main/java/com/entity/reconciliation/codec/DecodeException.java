package com.entity.reconciliation.codec;

/**
 * Thrown when an envelope cannot be turned back into a registered model: malformed input,
 * a discriminator nobody registered, or a payload that does not fit the concrete type.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
