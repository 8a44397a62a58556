package com.entity.reconciliation.core.model;

/**
 * Status codes shared by assets and other targets. Statuses are matched by prefix, so
 * {@code "AH"} is also {@link #ACTIVE}.
 */
public final class Statuses {

    public static final String ACTIVE = "A";
    public static final String ACTIVE_LOW = "AL";
    public static final String ACTIVE_PASSIVE = "AP";
    public static final String ACTIVE_HIGH = "AH";
    public static final String PENDING = "P";
    public static final String FROZEN = "F";
    public static final String FROZEN_REJECTED = "FR";
    public static final String DELETED = "D";

    private Statuses() {
    }
}
