package com.entity.reconciliation.core.model;

import java.util.Optional;

/**
 * A node that can carry a label addition the graph store has not applied yet.
 * The pending label is never serialized.
 */
public interface Relabelable extends GraphModel {

    String getPendingLabelAddition();

    void setPendingLabelAddition(String label);

    /**
     * Returns the pending label of a model, if it is relabelable and has one.
     */
    static Optional<String> pendingLabelAddition(GraphModel model) {
        if (model instanceof Relabelable relabelable) {
            String label = relabelable.getPendingLabelAddition();
            if (label != null && !label.isEmpty()) {
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }
}
