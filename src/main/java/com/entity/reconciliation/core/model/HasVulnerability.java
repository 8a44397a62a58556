package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.HookPipeline;

public class HasVulnerability extends BaseRelationship {

    public static final String LABEL = "HAS_VULNERABILITY";

    public HasVulnerability() {
    }

    public HasVulnerability(GraphModel source, GraphModel target) {
        super(source, target);
    }

    public static HasVulnerability create(GraphModel source, GraphModel target) {
        return HookPipeline.run(new HasVulnerability(source, target));
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public String getDescription() {
        return "Represents the relationship indicating an asset has a specific vulnerability.";
    }
}
