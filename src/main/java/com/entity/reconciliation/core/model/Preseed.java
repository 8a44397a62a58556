package com.entity.reconciliation.core.model;

import com.entity.reconciliation.key.KeySpec;
import com.entity.reconciliation.registry.Hook;
import com.entity.reconciliation.registry.HookPipeline;

import java.util.List;

import static com.entity.reconciliation.rules.Identifiers.isBlank;

/**
 * Pre-seeded information (a whois registrant, a favicon hash, a certificate subject...)
 * used to bootstrap discovery. Identity is {@code (category, title, value)}; the value is
 * truncated so the key fits in 1024 characters.
 */
public class Preseed implements Target, Reconcilable<Preseed> {

    public static final String LABEL = "Preseed";
    public static final KeySpec KEY = KeySpec.of("preseed", 1024, 2, false, "^#preseed#[^#]+#[^#]*#.+$");

    private String username;
    private String key;
    private String category;
    private String title;
    private String value;
    private String display;
    private String status;
    private String created;
    private String visited;
    private long ttl;

    public Preseed() {
    }

    public Preseed(String category, String title, String value) {
        this.category = category;
        this.title = title;
        this.value = value;
    }

    protected Preseed(Preseed other) {
        this.username = other.username;
        this.key = other.key;
        this.category = other.category;
        this.title = other.title;
        this.value = other.value;
        this.display = other.display;
        this.status = other.status;
        this.created = other.created;
        this.visited = other.visited;
        this.ttl = other.ttl;
    }

    public static Preseed create(String category, String title, String value) {
        return HookPipeline.run(new Preseed(category, title, value));
    }

    @Override
    public String getDescription() {
        return "Represents pre-seeded information about an asset or entity, used to bootstrap discovery.";
    }

    @Override
    public List<String> getLabels() {
        return List.of(LABEL, Labels.TTL);
    }

    /**
     * Preseeds start pending until a capability confirms them.
     */
    @Override
    public void defaulted() {
        boolean fresh = isBlank(created);
        if (isBlank(status)) {
            status = Statuses.PENDING;
        }
        if (isBlank(display)) {
            display = display(category);
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

    static String display(String category) {
        if ("csp".equals(category)) {
            return "base64";
        }
        if ("favicon".equals(category)) {
            return "image";
        }
        if ("tlscert".equals(category)) {
            return "tlscert";
        }
        return "text";
    }

    @Override
    public List<Hook<?>> getHooks() {
        return List.of(Hook.<Preseed>of("derive key", Preseed::deriveKey));
    }

    private Preseed deriveKey() {
        key = KEY.build(category, title, value);
        return this;
    }

    @Override
    public boolean valid() {
        return KEY.valid(key);
    }

    @Override
    public void merge(Preseed update) {
        if (!isBlank(update.status)) {
            status = update.status;
        }
        if (isBlank(created)) {
            created = update.created;
        }
    }

    @Override
    public void visit(Preseed other) {
        if (!isBlank(other.status) && !Statuses.PENDING.equals(other.status)) {
            status = other.status;
        }
        if (ttl != 0) {
            ttl = other.ttl;
        }
        if (!isBlank(other.visited)) {
            visited = other.visited;
        }
    }

    /**
     * Category up to the first {@code +}, for example {@code whois} for {@code whois+company}.
     */
    public String categoryClass() {
        if (category == null) {
            return "";
        }
        int plus = category.indexOf('+');
        return plus < 0 ? category : category.substring(0, plus);
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
    public Preseed withStatus(String status) {
        Preseed copy = new Preseed(this);
        copy.status = status;
        return copy;
    }

    @Override
    public String group() {
        return category;
    }

    @Override
    public String identifier() {
        return value;
    }

    @Override
    public boolean isClass(String prefix) {
        return category != null && category.startsWith(prefix);
    }

    @Override
    public boolean isPrivate() {
        return false;
    }

    public String getCategory() {
        return category;
    }

    public String getTitle() {
        return title;
    }

    public String getValue() {
        return value;
    }

    public String getDisplay() {
        return display;
    }

    public long getTtl() {
        return ttl;
    }
}
