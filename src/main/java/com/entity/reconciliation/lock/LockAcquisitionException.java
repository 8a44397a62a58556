package com.entity.reconciliation.lock;

/**
 * The per-entity lock for {@link #getKey()} was not acquired, so the entity was neither
 * read nor written.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String key;

    public LockAcquisitionException(String key, String message) {
        super(message);
        this.key = key;
    }

    public LockAcquisitionException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
