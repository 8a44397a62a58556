package com.entity.reconciliation.registry;

/**
 * Raised at startup when two different types claim the same discriminator,
 * alias or label spelling.
 */
public class RegistrationException extends RuntimeException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
