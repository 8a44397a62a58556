package com.entity.reconciliation.rules;

import java.util.List;

/**
 * Built-in rules for free-text identity components such as risk names.
 */
public final class IdentifierNormalizationRules {

    private IdentifierNormalizationRules() {
    }

    public static List<NormalizationRule> defaults() {
        return List.of(
                NormalizationRule.of("strip-control-characters", "\\p{Cntrl}", "", 5),
                NormalizationRule.of("trim", "^\\s+|\\s+$", "", 10),
                NormalizationRule.of("strip-key-separator", "#", "", 20, "risk"),
                NormalizationRule.of("whitespace-to-dash", "\\s+", "-", 30, "risk")
        );
    }
}
