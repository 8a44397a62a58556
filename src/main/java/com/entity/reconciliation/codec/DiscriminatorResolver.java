package com.entity.reconciliation.codec;

import com.entity.reconciliation.key.Keys;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;

/**
 * Finds the discriminator of a JSON envelope.
 *
 * <p>An explicit {@code type} field wins. Otherwise the first segment of the {@code key}
 * (or {@code Key}) field is used, and when neither is present the nested {@code model}
 * object is searched the same way.</p>
 */
public final class DiscriminatorResolver {

    static final String TYPE_FIELD = "type";
    static final String MODEL_FIELD = "model";

    private DiscriminatorResolver() {
    }

    public static Optional<String> resolve(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode type = node.get(TYPE_FIELD);
        if (type != null && type.isTextual() && !type.asText().isBlank()) {
            return Optional.of(type.asText().toLowerCase(Locale.ROOT));
        }
        Optional<String> fromKey = Keys.discriminator(text(node, "key"));
        if (fromKey.isEmpty()) {
            fromKey = Keys.discriminator(text(node, "Key"));
        }
        if (fromKey.isPresent()) {
            return fromKey;
        }
        return resolve(node.get(MODEL_FIELD));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
