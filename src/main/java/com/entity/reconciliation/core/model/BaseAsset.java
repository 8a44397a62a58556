package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.Hook;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import static com.entity.reconciliation.rules.Identifiers.isBlank;

/**
 * Fields and reconciliation rules shared by every asset-like entity.
 */
public abstract class BaseAsset implements Assetlike, StatusTracked {

    protected String username;
    protected String key;
    protected String origin;
    protected String source;
    protected String status;
    protected String created;
    protected String visited;
    protected long ttl;
    protected String secret;
    @GraphExcluded
    protected String comment;
    protected String identifier;
    protected String group;
    @JsonProperty("class")
    protected String assetClass;
    @JsonUnwrapped
    @GraphExcluded
    protected History history = new History();
    @JsonUnwrapped
    protected Metadata metadata = new Metadata();
    @JsonUnwrapped
    protected Tags tags = new Tags();

    protected BaseAsset() {
    }

    protected BaseAsset(BaseAsset other) {
        this.username = other.username;
        this.key = other.key;
        this.origin = other.origin;
        this.source = other.source;
        this.status = other.status;
        this.created = other.created;
        this.visited = other.visited;
        this.ttl = other.ttl;
        this.secret = other.secret;
        this.comment = other.comment;
        this.identifier = other.identifier;
        this.group = other.group;
        this.assetClass = other.assetClass;
        this.history = new History(other.history);
        this.metadata = new Metadata(other.metadata);
        this.tags = new Tags(other.tags);
    }

    @Override
    public BaseAsset getBase() {
        return this;
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
    public void setStatus(String status) {
        this.status = status;
    }

    public String getSource() {
        return source;
    }

    @Override
    public void setSource(String source) {
        if (Sources.SEED.equals(this.source) || Sources.ACCOUNT.equals(this.source)) {
            return;
        }
        this.source = source;
    }

    public String getOrigin() {
        return origin;
    }

    public void setOrigin(String origin) {
        this.origin = origin;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
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

    public long getTtl() {
        return ttl;
    }

    public void setTtl(long ttl) {
        this.ttl = ttl;
    }

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public String getGroup() {
        return group;
    }

    public void setGroup(String group) {
        this.group = group;
    }

    public String getAssetClass() {
        return assetClass;
    }

    @Override
    public History getHistory() {
        return history;
    }

    @Override
    public Metadata getMetadata() {
        return metadata;
    }

    public Tags getTags() {
        return tags;
    }

    @Override
    public boolean isClass(String prefix) {
        return assetClass != null && assetClass.startsWith(prefix);
    }

    @Override
    public boolean isPrivate() {
        return false;
    }

    /**
     * First character of the status.
     */
    public String state() {
        return isBlank(status) ? "" : status.substring(0, 1);
    }

    /**
     * Status characters after the first.
     */
    public String substate() {
        return status == null || status.length() < 2 ? "" : status.substring(1);
    }

    /**
     * Fills blank fields: status active, source self, created and visited now, and a
     * 30 day TTL for entities that had no creation time yet.
     */
    @Override
    public void defaulted() {
        boolean fresh = isBlank(created);
        if (isBlank(status)) {
            status = Statuses.ACTIVE;
        }
        if (isBlank(source)) {
            source = Sources.SELF;
        }
        if (fresh) {
            created = Timestamps.now();
            if (ttl == 0) {
                ttl = Timestamps.future(30 * 24);
            }
        }
        if (isBlank(visited)) {
            visited = Timestamps.now();
        }
    }

    /**
     * Status changes go through the history; a non-active asset stops expiring; origin
     * and created are only filled when absent; metadata and explicit tags are taken over.
     */
    protected void mergeFields(Assetlike u) {
        BaseAsset update = u.getBase();
        if (history.update(status, update.status, update.source, update.comment, update.history)) {
            status = update.status;
        }
        if (!isStatus(Statuses.ACTIVE)) {
            ttl = 0;
        }
        if (isBlank(origin)) {
            origin = update.origin;
        }
        if (isBlank(created)) {
            created = update.created;
        }
        metadata.merge(update.metadata);
        tags.merge(update.tags);
    }

    /**
     * A pending self-discovered asset becomes active when observed active; the TTL follows
     * the observation while the asset still expires, and permanent sources stop it.
     */
    protected void visitFields(Assetlike o) {
        BaseAsset other = o.getBase();
        if (!isBlank(other.visited)) {
            visited = other.visited;
        }
        if (Sources.SELF.equals(source) && isStatus(Statuses.PENDING) && other.isStatus(Statuses.ACTIVE)) {
            status = other.status;
        }
        if (isStatus(Statuses.ACTIVE) && ttl != 0) {
            ttl = other.ttl;
        }
        if (Sources.isPermanent(other.source) || other.ttl == 0) {
            ttl = 0;
        }
        if (isBlank(origin)) {
            origin = other.origin;
        }
        if (!isBlank(other.secret)) {
            secret = other.secret;
        }
        metadata.visit(other.metadata);
        tags.visit(other.tags);
    }

    /**
     * Hook adopting a caller-supplied group and identifier into the class's own identity
     * fields before the key is derived.
     */
    protected static <T extends BaseAsset> Hook<T> useGroupAndIdentifier() {
        return Hook.of("use group and identifier", asset -> {
            if (!isBlank(asset.group)) {
                asset.applyGroup(asset.group);
            }
            if (!isBlank(asset.identifier)) {
                asset.applyIdentifier(asset.identifier);
            }
            return asset;
        });
    }

    /**
     * Hook writing the normalized identity back to group and identifier.
     */
    protected static <T extends BaseAsset> Hook<T> setGroupAndIdentifier() {
        return Hook.of("set group and identifier", asset -> {
            asset.group = asset.group();
            asset.identifier = asset.identifier();
            return asset;
        });
    }

    /**
     * Stores a generic group into the class-specific field it maps to.
     */
    protected abstract void applyGroup(String group);

    /**
     * Stores a generic identifier into the class-specific field it maps to.
     */
    protected abstract void applyIdentifier(String identifier);
}
