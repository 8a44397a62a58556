package com.entity.reconciliation.key;

import com.entity.reconciliation.rules.Identifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identity layout of one entity class: the key prefix, the length ceiling, which
 * component may be truncated to honour it, whether components are case folded, and the
 * pattern a well-formed key must match.
 *
 * <p>Keys have the form {@code #<type>#<component>#<component>...}, optionally followed by
 * a parent key which already carries its own leading {@code #}.</p>
 *
 * @param type          key prefix, without the leading {@code #}
 * @param ceiling       maximum key length in characters
 * @param variableIndex index of the component truncated when the key is too long, or -1
 * @param fold          whether components are lower-cased
 * @param validPattern  pattern checked by {@link #valid(String)}
 */
public record KeySpec(String type, int ceiling, int variableIndex, boolean fold, Pattern validPattern) {

    public static final int NO_VARIABLE_COMPONENT = -1;

    public KeySpec {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(validPattern, "validPattern is required");
        if (type.isEmpty() || type.indexOf('#') >= 0) {
            throw new IllegalArgumentException("type must be a non-empty segment");
        }
        if (ceiling <= type.length() + 1) {
            throw new IllegalArgumentException("ceiling must exceed the key prefix");
        }
        if (variableIndex < NO_VARIABLE_COMPONENT) {
            throw new IllegalArgumentException("variableIndex must be >= -1");
        }
    }

    public static KeySpec of(String type, int ceiling, int variableIndex, boolean fold, String validPattern) {
        return new KeySpec(type, ceiling, variableIndex, fold, Pattern.compile(validPattern));
    }

    /**
     * Builds a key from identity components.
     */
    public String build(String... components) {
        return buildWithParent(null, components);
    }

    /**
     * Builds a key from identity components followed by a parent key. The parent key is
     * appended verbatim and never truncated.
     */
    public String buildWithParent(String parentKey, String... components) {
        List<String> segments = new ArrayList<>(components.length);
        for (String component : components) {
            segments.add(fold ? Identifiers.fold(component) : Identifiers.nfc(component));
        }
        String suffix = parentKey == null ? "" : parentKey;

        String key = assemble(segments, suffix);
        if (key.length() <= ceiling) {
            return key;
        }

        if (variableIndex >= 0 && variableIndex < segments.size()) {
            String variable = segments.get(variableIndex);
            int budget = ceiling - (key.length() - variable.length());
            if (budget >= 0) {
                segments.set(variableIndex, truncate(variable, budget));
                return assemble(segments, suffix);
            }
        }
        return truncate(key, ceiling);
    }

    /**
     * Checks a key against the class pattern and ceiling.
     */
    public boolean valid(String key) {
        return key != null && key.length() <= ceiling && validPattern.matcher(key).matches();
    }

    /**
     * The {@code #<type>#} prefix every key of this class starts with.
     */
    public String prefix() {
        return "#" + type + "#";
    }

    private String assemble(List<String> segments, String suffix) {
        StringBuilder key = new StringBuilder(prefix().length() + suffix.length() + 32);
        key.append('#').append(type);
        for (String segment : segments) {
            key.append('#').append(segment);
        }
        return key.append(suffix).toString();
    }

    static String truncate(String value, int length) {
        if (value.length() <= length) {
            return value;
        }
        int end = length;
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
