package com.entity.reconciliation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies normalization rules to identity text, lowest priority number first.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Engine loaded with {@link IdentifierNormalizationRules#defaults()}.
     */
    public static NormalizationEngine withDefaults() {
        return new NormalizationEngine(IdentifierNormalizationRules.defaults());
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * NFC, then the rules that apply to the discriminator, then lower-casing. A null or
     * blank input normalizes to the empty string.
     */
    public String normalize(String text, String type) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = Identifiers.nfc(text);
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(type)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.debug("normalize.rule name={} type={}", rule.name(), type);
                }
            }
        }
        return result.toLowerCase(Locale.ROOT);
    }
}
