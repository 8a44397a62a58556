package com.entity.reconciliation.core.model;

import com.entity.reconciliation.key.KeySpec;
import com.entity.reconciliation.registry.Hook;
import com.entity.reconciliation.registry.HookPipeline;
import com.entity.reconciliation.rules.Identifiers;
import com.entity.reconciliation.rules.NormalizationEngine;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.entity.reconciliation.rules.Identifiers.isBlank;

/**
 * A security finding on a target. Identity is {@code (dns, name)}; the dns component of
 * the key is case folded so risks on the same asset share a key.
 *
 * <p>The status packs {@code [state][severity][substate]}; see {@link RiskStatus}. Only the
 * state is tracked in history, severity changes are applied silently.</p>
 */
public class Risk implements GraphModel, Reconcilable<Risk>, StatusTracked {

    public static final String LABEL = "Risk";
    public static final KeySpec KEY = KeySpec.of("risk", 1024, 1, false, "^#risk#([^#]+)#([^#]+)$");

    private static final Pattern CVE = Pattern.compile("(?i)^cve-\\d+-\\d+$");
    private static final NormalizationEngine NAME_RULES = NormalizationEngine.withDefaults();

    private String username;
    private String key;
    private String dns;
    private String name;
    private String source;
    private String status;
    private int priority;
    private String created;
    private String updated;
    private String visited;
    private long ttl;
    @GraphExcluded
    private String comment;
    @JsonUnwrapped
    @GraphExcluded
    private History history = new History();
    private transient Target target;

    public Risk() {
    }

    public Risk(String dns, String name, String status) {
        this.dns = dns;
        this.name = name;
        this.status = status;
    }

    protected Risk(Risk other) {
        this.username = other.username;
        this.key = other.key;
        this.dns = other.dns;
        this.name = other.name;
        this.source = other.source;
        this.status = other.status;
        this.priority = other.priority;
        this.created = other.created;
        this.updated = other.updated;
        this.visited = other.visited;
        this.ttl = other.ttl;
        this.comment = other.comment;
        this.history = new History(other.history);
        this.target = other.target;
    }

    /**
     * A risk on a target, grouped under the target's group.
     */
    public static Risk create(Target target, String name, String status) {
        return create(target, name, target.group(), status);
    }

    public static Risk create(Target target, String name, String dns, String status) {
        Risk risk = new Risk(dns, name, status);
        risk.target = target;
        return HookPipeline.run(risk);
    }

    /**
     * An update carrying only a status, as sent by an explicit API call.
     */
    public static Risk statusUpdate(String status) {
        Risk update = new Risk();
        update.status = status;
        return update;
    }

    @Override
    public String getDescription() {
        return "Represents a security risk linking an asset to a condition or vulnerability, "
                + "including its status, severity, and history.";
    }

    @Override
    public List<String> getLabels() {
        return List.of(LABEL, Labels.TTL);
    }

    /**
     * Fills blank fields: source provided, timestamps now, and a 14 day TTL for a new risk.
     */
    @Override
    public void defaulted() {
        boolean fresh = isBlank(created);
        if (isBlank(source)) {
            source = Sources.PROVIDED;
        }
        if (fresh) {
            created = Timestamps.now();
            if (ttl == 0) {
                ttl = Timestamps.future(14 * 24);
            }
        }
        if (isBlank(updated)) {
            updated = Timestamps.now();
        }
        if (isBlank(visited)) {
            visited = Timestamps.now();
        }
    }

    @Override
    public List<Hook<?>> getHooks() {
        return List.of(Hook.<Risk>of("format name and derive key", Risk::deriveKey));
    }

    private Risk deriveKey() {
        name = formatName(name);
        key = KEY.build(Identifiers.fold(dns), name);
        priority = RiskStatus.priority(status);
        return this;
    }

    static String formatName(String name) {
        if (name == null) {
            return "";
        }
        if (CVE.matcher(name).matches()) {
            return name.toUpperCase(Locale.ROOT);
        }
        return NAME_RULES.normalize(name, "risk");
    }

    @Override
    public boolean valid() {
        return KEY.valid(key) && !isBlank(status);
    }

    /**
     * Prefix match on the status.
     */
    public boolean is(String prefix) {
        return status != null && status.startsWith(prefix);
    }

    public boolean is(RiskState state) {
        return is(state.code());
    }

    /**
     * Status changes that move the state are recorded in history and refresh
     * {@code updated}; severity-only changes are applied without a record. Once out of
     * triage the risk no longer expires.
     */
    @Override
    public void merge(Risk update) {
        String incoming = update.status;
        boolean changed = !isBlank(incoming) && !incoming.equals(status);
        boolean stateChange = changed && !RiskStatus.state(incoming).equals(state());

        if (history.update(status, stateChange ? incoming : null, update.source, update.comment, update.history)) {
            setStatus(incoming);
            updated = Timestamps.now();
        } else if (changed && !stateChange) {
            setStatus(incoming);
        }
        if (isBlank(created)) {
            created = update.created;
        }
        if (!is(RiskState.TRIAGE)) {
            ttl = 0;
        }
    }

    /**
     * A re-observed risk keeps expiring while in triage and reopens if it was remediated.
     */
    @Override
    public void visit(Risk observation) {
        if (!isBlank(observation.visited)) {
            visited = observation.visited;
        }
        if (is(RiskState.TRIAGE)) {
            ttl = observation.ttl;
        }
        if (is(RiskState.REMEDIATED)) {
            set(RiskState.OPEN);
        }
        if (!isBlank(observation.comment)) {
            comment = observation.comment;
        }
    }

    /**
     * Moves the risk to another state, keeping severity and substate.
     */
    public void set(RiskState state) {
        Risk update = statusUpdate(RiskStatus.withState(status, state));
        update.source = source;
        merge(update);
    }

    /**
     * Changes the severity, keeping state and substate.
     */
    public void setSeverity(RiskSeverity severity) {
        if (status == null || status.length() < 2) {
            return;
        }
        merge(statusUpdate(RiskStatus.withSeverity(status, severity)));
    }

    private void setStatus(String status) {
        this.status = status;
        this.priority = RiskStatus.priority(status);
    }

    public String state() {
        return RiskStatus.state(status);
    }

    public String severity() {
        return RiskStatus.severity(status);
    }

    public String substate() {
        return RiskStatus.substate(status);
    }

    @Override
    public String getKey() {
        return key;
    }

    public String getDns() {
        return dns;
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    @Override
    public String getStatus() {
        return status;
    }

    public int getPriority() {
        return priority;
    }

    public String getCreated() {
        return created;
    }

    public void setCreated(String created) {
        this.created = created;
    }

    public String getUpdated() {
        return updated;
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

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    @Override
    public History getHistory() {
        return history;
    }

    /**
     * The target the risk was raised on, when constructed in-process. Not serialized.
     */
    public Target getTarget() {
        return target;
    }

    @Override
    public String toString() {
        return "Risk{key='" + key + "', status='" + status + "', priority=" + priority + "}";
    }
}
