package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.HookPipeline;

public class Discovered extends BaseRelationship {

    public static final String LABEL = "DISCOVERED";

    public Discovered() {
    }

    public Discovered(GraphModel source, GraphModel target) {
        super(source, target);
    }

    public static Discovered create(GraphModel source, GraphModel target) {
        return HookPipeline.run(new Discovered(source, target));
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public String getDescription() {
        return "Represents a discovery relationship between two entities, such as a host and a service it exposes.";
    }
}
