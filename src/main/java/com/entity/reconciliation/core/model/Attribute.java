package com.entity.reconciliation.core.model;

import com.entity.reconciliation.key.KeySpec;
import com.entity.reconciliation.registry.Hook;
import com.entity.reconciliation.registry.HookPipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.entity.reconciliation.rules.Identifiers.isBlank;

/**
 * A name/value fact attached to a parent node. The value is truncated so the key fits
 * in 1024 characters.
 */
public class Attribute implements Target, Reconcilable<Attribute> {

    public static final String LABEL = "Attribute";
    public static final KeySpec KEY = KeySpec.of("attribute", 1024, 1, false, "^#attribute#[^#]+#.+$");

    private String username;
    private String key;
    private String source;
    private String name;
    private String value;
    private String status;
    private String created;
    private String visited;
    private long ttl;
    private String capability;
    private Map<String, String> metadata;
    private transient GraphModel parent;

    public Attribute() {
    }

    public Attribute(String name, String value, GraphModel parent) {
        this.name = name;
        this.value = value;
        this.parent = parent;
    }

    protected Attribute(Attribute other) {
        this.username = other.username;
        this.key = other.key;
        this.source = other.source;
        this.name = other.name;
        this.value = other.value;
        this.status = other.status;
        this.created = other.created;
        this.visited = other.visited;
        this.ttl = other.ttl;
        this.capability = other.capability;
        this.metadata = other.metadata == null ? null : new LinkedHashMap<>(other.metadata);
        this.parent = other.parent;
    }

    public static Attribute create(String name, String value, GraphModel parent) {
        return HookPipeline.run(new Attribute(name, value, parent));
    }

    @Override
    public String getDescription() {
        return "Represents a name/value attribute attached to another entity.";
    }

    @Override
    public List<String> getLabels() {
        return List.of(LABEL, Labels.TTL);
    }

    @Override
    public void defaulted() {
        boolean fresh = isBlank(created);
        if (isBlank(status)) {
            status = Statuses.ACTIVE;
        }
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
        }
        if (fresh) {
            created = Timestamps.now();
            if (ttl == 0) {
                ttl = Timestamps.future(14 * 24);
            }
        }
        if (isBlank(visited)) {
            visited = Timestamps.now();
        }
    }

    @Override
    public List<Hook<?>> getHooks() {
        return List.of(Hook.<Attribute>of("derive key from parent", Attribute::deriveKey));
    }

    private Attribute deriveKey() {
        String parentKey = ParentKeys.require(parent, source);
        key = KEY.buildWithParent(parentKey, name, value);
        source = parentKey;
        return this;
    }

    @Override
    public boolean valid() {
        return KEY.valid(key);
    }

    @Override
    public void merge(Attribute update) {
        if (!isBlank(update.status)) {
            status = update.status;
        }
        if (!isBlank(update.capability)) {
            capability = update.capability;
        }
        if (update.metadata != null && !update.metadata.isEmpty()) {
            if (metadata == null) {
                metadata = new LinkedHashMap<>();
            }
            metadata.putAll(update.metadata);
        }
        if (isBlank(created)) {
            created = update.created;
        }
    }

    @Override
    public void visit(Attribute other) {
        if (!isBlank(other.visited)) {
            visited = other.visited;
        }
        if (!isBlank(other.status) && !Statuses.PENDING.equals(other.status)) {
            status = other.status;
        }
        if (ttl != 0) {
            ttl = other.ttl;
        }
        if (!isBlank(other.capability)) {
            capability = other.capability;
        }
        if (other.metadata != null && !other.metadata.isEmpty()) {
            metadata = new LinkedHashMap<>(other.metadata);
        }
        if (other.parent != null) {
            parent = other.parent;
        }
    }

    /**
     * {@code name://dns:value}, with {@code port} and {@code protocol} attributes
     * rendered as {@code dns:port} and {@code value://dns}.
     */
    public String target() {
        String dns = ParentKeys.dns(source);
        if (dns.isEmpty()) {
            return "";
        }
        if ("port".equals(name)) {
            return dns + ":" + value;
        }
        if ("protocol".equals(name)) {
            return value + "://" + dns;
        }
        return name + "://" + dns + ":" + value;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public String getStatus() {
        return status;
    }

    @Override
    public Attribute withStatus(String status) {
        Attribute copy = new Attribute(this);
        copy.status = status;
        return copy;
    }

    @Override
    public String group() {
        return ParentKeys.dns(source);
    }

    @Override
    public String identifier() {
        return target();
    }

    @Override
    public boolean isClass(String prefix) {
        return name != null && name.startsWith(prefix);
    }

    @Override
    public boolean isPrivate() {
        if (parent instanceof Target t) {
            return t.isPrivate();
        }
        return ParentKeys.asset(source).map(Asset::isPrivate).orElse(false);
    }

    public String getSource() {
        return source;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public String getCapability() {
        return capability;
    }

    public void setCapability(String capability) {
        this.capability = capability;
    }

    public Map<String, String> getMetadata() {
        return metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public void putMetadata(String key, String value) {
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
        }
        metadata.put(key, value);
    }

    public GraphModel getParent() {
        return parent;
    }
}
