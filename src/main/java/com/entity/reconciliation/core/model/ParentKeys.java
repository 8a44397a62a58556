package com.entity.reconciliation.core.model;

import com.entity.reconciliation.key.Keys;
import com.entity.reconciliation.registry.HookException;

import java.util.List;
import java.util.Optional;

import static com.entity.reconciliation.rules.Identifiers.isBlank;

/**
 * Helpers for entities keyed under a parent node, such as ports and attributes.
 */
final class ParentKeys {

    private ParentKeys() {
    }

    /**
     * The parent key from the in-memory parent, falling back to the stored source key.
     *
     * @throws HookException when neither is available
     */
    static String require(GraphModel parent, String storedSource) {
        if (parent != null && !isBlank(parent.getKey())) {
            return parent.getKey();
        }
        if (!isBlank(storedSource)) {
            return storedSource;
        }
        throw new HookException("parent is required");
    }

    /**
     * Rebuilds the parent asset from an {@code #asset#dns#name} key.
     */
    static Optional<Asset> asset(String parentKey) {
        List<String> segments = Keys.segments(parentKey);
        if (segments.size() != 3 || !"asset".equals(segments.get(0))) {
            return Optional.empty();
        }
        return Optional.of(Asset.create(segments.get(1), segments.get(2)));
    }

    /**
     * The DNS segment of a parent key, or the empty string.
     */
    static String dns(String parentKey) {
        List<String> segments = Keys.segments(parentKey);
        return segments.size() >= 2 ? segments.get(1) : "";
    }
}
