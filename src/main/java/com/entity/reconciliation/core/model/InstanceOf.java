package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.HookPipeline;

public class InstanceOf extends BaseRelationship {

    public static final String LABEL = "INSTANCE_OF";

    public InstanceOf() {
    }

    public InstanceOf(GraphModel source, GraphModel target) {
        super(source, target);
    }

    public static InstanceOf create(GraphModel source, GraphModel target) {
        return HookPipeline.run(new InstanceOf(source, target));
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public String getDescription() {
        return "Represents an instance-of relationship, such as a host running a software package.";
    }
}
