package com.entity.reconciliation.key;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parsing helpers for {@code #<type>#...} keys.
 */
public final class Keys {

    private Keys() {
    }

    /**
     * Returns the lower-cased first segment of a key, when the key has the
     * {@code #<type>#} shape.
     */
    public static Optional<String> discriminator(String key) {
        if (key == null || key.length() < 3 || key.charAt(0) != '#') {
            return Optional.empty();
        }
        int end = key.indexOf('#', 1);
        if (end <= 1) {
            return Optional.empty();
        }
        return Optional.of(key.substring(1, end).toLowerCase(Locale.ROOT));
    }

    /**
     * Splits a key into its segments, without the leading empty one.
     * Empty components are kept so {@code #asset##name} yields {@code [asset, "", name]}.
     */
    public static List<String> segments(String key) {
        List<String> segments = new ArrayList<>();
        if (key == null || key.isEmpty() || key.charAt(0) != '#') {
            return segments;
        }
        int start = 1;
        for (int i = 1; i <= key.length(); i++) {
            if (i == key.length() || key.charAt(i) == '#') {
                segments.add(key.substring(start, i));
                start = i + 1;
            }
        }
        return segments;
    }
}
