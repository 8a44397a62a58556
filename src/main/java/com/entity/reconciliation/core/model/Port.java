package com.entity.reconciliation.core.model;

import com.entity.reconciliation.key.KeySpec;
import com.entity.reconciliation.key.Keys;
import com.entity.reconciliation.registry.Hook;
import com.entity.reconciliation.registry.HookPipeline;

import java.util.List;

import static com.entity.reconciliation.rules.Identifiers.isBlank;

/**
 * An open port on a parent asset. Identity is {@code (protocol, port, parent key)}.
 */
public class Port implements Target, Reconcilable<Port> {

    public static final String LABEL = "Port";
    public static final String TCP = "tcp";
    public static final String UDP = "udp";
    public static final KeySpec KEY = KeySpec.of("port", 1024, KeySpec.NO_VARIABLE_COMPONENT, true,
            "^#port#[^#]+#\\d+#.+$");

    private String username;
    private String key;
    private String source;
    private String status;
    private String created;
    private String visited;
    private long ttl;
    private String protocol;
    private int port;
    private String service;
    private transient GraphModel parent;

    public Port() {
    }

    public Port(String protocol, int port, GraphModel parent) {
        this.protocol = protocol;
        this.port = port;
        this.parent = parent;
    }

    protected Port(Port other) {
        this.username = other.username;
        this.key = other.key;
        this.source = other.source;
        this.status = other.status;
        this.created = other.created;
        this.visited = other.visited;
        this.ttl = other.ttl;
        this.protocol = other.protocol;
        this.port = other.port;
        this.service = other.service;
        this.parent = other.parent;
    }

    public static Port create(String protocol, int port, GraphModel parent) {
        return HookPipeline.run(new Port(protocol, port, parent));
    }

    @Override
    public String getDescription() {
        return "Represents an open port on an asset with protocol, port number, and optional service information.";
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
        return List.of(Hook.<Port>of("derive key from parent", Port::deriveKey));
    }

    private Port deriveKey() {
        String parentKey = ParentKeys.require(parent, source);
        key = KEY.buildWithParent(parentKey, protocol, String.valueOf(port));
        source = parentKey;
        return this;
    }

    @Override
    public boolean valid() {
        return !isBlank(key) && port > 0 && port <= 65535;
    }

    /**
     * Fields set explicitly on the update win; the parent link is kept.
     */
    @Override
    public void merge(Port update) {
        if (!isBlank(update.status)) {
            status = update.status;
        }
        if (!isBlank(update.service)) {
            service = update.service;
        }
        if (isBlank(created)) {
            created = update.created;
        }
    }

    @Override
    public void visit(Port other) {
        if (!isBlank(other.visited)) {
            visited = other.visited;
        }
        if (!isBlank(other.status) && !Statuses.PENDING.equals(other.status)) {
            status = other.status;
        }
        if (other.ttl != 0) {
            ttl = other.ttl;
        }
        if (!isBlank(other.service)) {
            service = other.service;
        }
        if (other.parent != null) {
            parent = other.parent;
        }
    }

    /**
     * {@code service://dns:port} when the service is known, {@code name:port} otherwise.
     */
    public String target() {
        List<String> segments = Keys.segments(source);
        String dns = segments.size() >= 2 ? segments.get(1) : "";
        String name = segments.size() >= 3 ? segments.get(2) : "";
        if (!isBlank(service)) {
            return service + "://" + dns + ":" + port;
        }
        return name + ":" + port;
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
    public Port withStatus(String status) {
        Port copy = new Port(this);
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
    public boolean isClass(String value) {
        return (service != null && service.startsWith(value)) || String.valueOf(port).equals(value);
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

    public String getProtocol() {
        return protocol;
    }

    public int getPort() {
        return port;
    }

    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    public long getTtl() {
        return ttl;
    }

    public String getVisited() {
        return visited;
    }

    public GraphModel getParent() {
        return parent;
    }
}
