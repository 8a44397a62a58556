package com.entity.reconciliation.core.model;

/**
 * Accessors for the packed {@code [state][severity][substate]} risk status code,
 * for example {@code "TH"} (triage, high) or {@code "DHF"} (deleted, high, false positive).
 */
public final class RiskStatus {

    public static final String TRIAGE_INFO = "TI";
    public static final String TRIAGE_LOW = "TL";
    public static final String TRIAGE_MEDIUM = "TM";
    public static final String TRIAGE_HIGH = "TH";
    public static final String TRIAGE_CRITICAL = "TC";
    public static final String OPEN_EXPOSURE = "OE";
    public static final String OPEN_INFO = "OI";
    public static final String OPEN_LOW = "OL";
    public static final String OPEN_MEDIUM = "OM";
    public static final String OPEN_HIGH = "OH";
    public static final String OPEN_CRITICAL = "OC";
    public static final String REMEDIATED_LOW = "RL";
    public static final String REMEDIATED_MEDIUM = "RM";
    public static final String REMEDIATED_HIGH = "RH";
    public static final String REMEDIATED_CRITICAL = "RC";

    /** Deleted substate: false positive. */
    public static final char FALSE_POSITIVE = 'F';
    /** Deleted substate: out of scope. */
    public static final char OUT_OF_SCOPE = 'S';
    /** Deleted substate: other. */
    public static final char OTHER = 'O';
    /** Deleted substate: duplicate. */
    public static final char DUPLICATE = 'D';

    private RiskStatus() {
    }

    public static String state(String status) {
        return status == null || status.isEmpty() ? "" : status.substring(0, 1);
    }

    public static String severity(String status) {
        return status == null || status.length() < 2 ? "" : status.substring(1, 2);
    }

    public static String substate(String status) {
        return status == null || status.length() < 3 ? "" : status.substring(2, 3);
    }

    /**
     * Replaces the state character, keeping severity and substate.
     */
    public static String withState(String status, RiskState state) {
        if (status == null || status.isEmpty()) {
            return state.code();
        }
        return state.code() + status.substring(1);
    }

    /**
     * Replaces the severity character, keeping state and substate. A status without a
     * severity is returned unchanged.
     */
    public static String withSeverity(String status, RiskSeverity severity) {
        if (status == null || status.length() < 2) {
            return status;
        }
        return status.charAt(0) + String.valueOf(severity.getCode()) + status.substring(2);
    }

    /**
     * Priority derived from the severity character.
     */
    public static int priority(String status) {
        String severity = severity(status);
        if (severity.isEmpty()) {
            return RiskSeverity.UNSPECIFIED_PRIORITY;
        }
        return RiskSeverity.fromCode(severity.charAt(0))
                .map(RiskSeverity::getPriority)
                .orElse(RiskSeverity.UNSPECIFIED_PRIORITY);
    }
}
