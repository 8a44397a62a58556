package com.entity.reconciliation.registry;

import java.util.List;

/**
 * Any type that can be registered under a discriminator, defaulted and normalized
 * through an ordered list of {@link Hook}s.
 */
public interface Model {

    /**
     * Human readable description of the model, used for schema and diagnostics.
     */
    String getDescription();

    /**
     * Fills blank fields (timestamps, status, TTL) with their defaults.
     * Must only touch fields that are still unset so that re-running it is a no-op.
     */
    default void defaulted() {
    }

    /**
     * Ordered normalization steps. The last hook usually derives the key.
     */
    default List<Hook<?>> getHooks() {
        return List.of();
    }
}
