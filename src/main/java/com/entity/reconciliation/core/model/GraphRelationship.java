package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.Model;

/**
 * A labeled edge between two graph models.
 */
public interface GraphRelationship extends Model {

    /**
     * The edge label, for example {@code DISCOVERED}.
     */
    String label();

    Nodes nodes();

    /**
     * The mutable metadata shared by every relationship type.
     */
    BaseRelationship base();

    void visit(GraphRelationship other);

    boolean valid();

    default String getKey() {
        return base().getKey();
    }

    /**
     * Endpoints of a relationship. Either may be null on a decoded relationship.
     */
    record Nodes(GraphModel source, GraphModel target) {
    }
}
