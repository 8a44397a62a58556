package com.entity.reconciliation.rules;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A case-insensitive regex rewrite applied to a free-text key component.
 *
 * @param name        rule name, for logging
 * @param pattern     what to rewrite
 * @param replacement replacement text
 * @param types       discriminators the rule is limited to; empty means every type
 * @param priority    lower runs first
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, Set<String> types, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        types = types.stream().map(t -> t.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }

    public static NormalizationRule of(String name, String regex, String replacement, int priority, String... types) {
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement,
                Set.of(types), priority);
    }

    boolean appliesTo(String type) {
        return types.isEmpty() || (type != null && types.contains(type.toLowerCase(Locale.ROOT)));
    }

    String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
