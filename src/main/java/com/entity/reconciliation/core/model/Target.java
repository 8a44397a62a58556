package com.entity.reconciliation.core.model;

/**
 * Something a capability can act on.
 */
public interface Target extends GraphModel {

    String getStatus();

    /**
     * Copy of this target, of the same concrete type, with a different status.
     */
    Target withStatus(String status);

    String group();

    String identifier();

    /**
     * Prefix match on the status, so {@code isStatus("A")} holds for {@code "AH"}.
     */
    default boolean isStatus(String prefix) {
        String status = getStatus();
        return status != null && status.startsWith(prefix);
    }

    boolean isClass(String prefix);

    boolean isPrivate();
}
