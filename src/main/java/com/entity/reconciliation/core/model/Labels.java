package com.entity.reconciliation.core.model;

/**
 * Graph labels that are not tied to a single entity class.
 */
public final class Labels {

    /** Attached to nodes that are cleaned up by TTL. */
    public static final String TTL = "TTL";
    /** Attached to seed-sourced nodes. */
    public static final String SEED = "Seed";

    private Labels() {
    }
}
