package com.entity.reconciliation.core.model;

import java.util.Optional;

/**
 * Second character of a risk status, with the priority it sorts by.
 * Lower priority means more urgent.
 */
public enum RiskSeverity {
    CRITICAL('C', 0),
    HIGH('H', 10),
    MEDIUM('M', 20),
    LOW('L', 30),
    INFO('I', 40),
    EXPOSURE('E', 50);

    /**
     * Priority of a status without a severity character.
     */
    public static final int UNSPECIFIED_PRIORITY = 60;

    private final char code;
    private final int priority;

    RiskSeverity(char code, int priority) {
        this.code = code;
        this.priority = priority;
    }

    public char getCode() {
        return code;
    }

    public int getPriority() {
        return priority;
    }

    public static Optional<RiskSeverity> fromCode(char code) {
        for (RiskSeverity severity : values()) {
            if (severity.code == code) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
