package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.HookPipeline;

public class HasAttribute extends BaseRelationship {

    public static final String LABEL = "HAS_ATTRIBUTE";

    public HasAttribute() {
    }

    public HasAttribute(GraphModel source, GraphModel target) {
        super(source, target);
    }

    public static HasAttribute create(GraphModel source, GraphModel target) {
        return HookPipeline.run(new HasAttribute(source, target));
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public String getDescription() {
        return "Represents the relationship indicating an entity has a specific attribute.";
    }
}
