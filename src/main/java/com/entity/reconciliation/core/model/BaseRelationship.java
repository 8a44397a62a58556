package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.Hook;

import java.util.List;

import static com.entity.reconciliation.rules.Identifiers.isBlank;

/**
 * Metadata shared by every relationship. The key is {@code <source key>#<LABEL><target key>};
 * the endpoints themselves are not serialized with the relationship.
 */
public abstract class BaseRelationship implements GraphRelationship {

    private transient GraphModel source;
    private transient GraphModel target;
    protected String created;
    protected String visited;
    protected String capability;
    protected String key;
    protected String attachmentPath;

    protected BaseRelationship() {
    }

    protected BaseRelationship(GraphModel source, GraphModel target) {
        this.source = source;
        this.target = target;
    }

    @Override
    public BaseRelationship base() {
        return this;
    }

    @Override
    public Nodes nodes() {
        return new Nodes(source, target);
    }

    /**
     * Reattaches endpoints, for example after decoding.
     */
    public void setNodes(GraphModel source, GraphModel target) {
        this.source = source;
        this.target = target;
    }

    @Override
    public void defaulted() {
        if (isBlank(created)) {
            created = Timestamps.now();
        }
        if (isBlank(visited)) {
            visited = Timestamps.now();
        }
    }

    @Override
    public List<Hook<?>> getHooks() {
        return List.of(Hook.<BaseRelationship>of("derive key from endpoints", BaseRelationship::deriveKey));
    }

    private BaseRelationship deriveKey() {
        if (source != null && target != null) {
            key = source.getKey() + "#" + label() + target.getKey();
        }
        return this;
    }

    @Override
    public void visit(GraphRelationship other) {
        BaseRelationship incoming = other.base();
        if (!isBlank(incoming.visited)) {
            visited = incoming.visited;
        }
        if (!isBlank(incoming.capability)) {
            capability = incoming.capability;
        }
        if (incoming.source != null) {
            source = incoming.source;
        }
        if (incoming.target != null) {
            target = incoming.target;
        }
        if (!isBlank(incoming.attachmentPath)) {
            attachmentPath = incoming.attachmentPath;
        }
    }

    @Override
    public boolean valid() {
        return !isBlank(key);
    }

    @Override
    public String getKey() {
        return key;
    }

    public String getCreated() {
        return created;
    }

    public String getVisited() {
        return visited;
    }

    public void setVisited(String visited) {
        this.visited = visited;
    }

    public String getCapability() {
        return capability;
    }

    public void setCapability(String capability) {
        this.capability = capability;
    }

    public String getAttachmentPath() {
        return attachmentPath;
    }

    public void setAttachmentPath(String attachmentPath) {
        this.attachmentPath = attachmentPath;
    }
}
