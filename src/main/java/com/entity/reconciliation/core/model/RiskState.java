package com.entity.reconciliation.core.model;

import java.util.Optional;

/**
 * First character of a risk status.
 */
public enum RiskState {
    /**
     * Awaiting review. The only state in which a risk expires passively.
     */
    TRIAGE('T'),

    /**
     * Confirmed and unresolved.
     */
    OPEN('O'),

    /**
     * Accepted by the owner and ignored.
     */
    IGNORED('I'),

    /**
     * Fixed. Re-observing the risk reopens it.
     */
    REMEDIATED('R'),

    /**
     * Closed as false positive, out of scope, duplicate or other.
     */
    DELETED('D');

    private final char code;

    RiskState(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    public String code() {
        return String.valueOf(code);
    }

    public static Optional<RiskState> fromCode(char code) {
        for (RiskState state : values()) {
            if (state.code == code) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
