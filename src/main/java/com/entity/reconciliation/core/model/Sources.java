package com.entity.reconciliation.core.model;

/**
 * Provenance values for the {@code source} field.
 */
public final class Sources {

    /** Discovered by a capability. */
    public static final String SELF = "self";
    /** Supplied by the customer as a starting point for discovery. */
    public static final String SEED = "seed";
    /** Owned by a connected account integration. */
    public static final String ACCOUNT = "account";
    /** Provided explicitly, the default for risks. */
    public static final String PROVIDED = "provided";

    private Sources() {
    }

    /**
     * Permanent sources never expire through TTL.
     */
    public static boolean isPermanent(String source) {
        return SEED.equals(source) || ACCOUNT.equals(source);
    }
}
