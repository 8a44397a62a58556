package com.entity.reconciliation.merge;

/**
 * How an incoming observation is folded into the stored entity.
 */
public enum ReconciliationMode {
    /**
     * Authoritative update, for example an explicit API call. Explicit fields overwrite.
     */
    MERGE,

    /**
     * Passive re-observation by a capability. Collections are unioned and status only
     * moves forward.
     */
    VISIT
}
