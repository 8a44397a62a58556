package com.entity.reconciliation.core.model;

import com.entity.reconciliation.key.KeySpec;
import com.entity.reconciliation.registry.Hook;
import com.entity.reconciliation.registry.HookPipeline;
import com.entity.reconciliation.rules.Identifiers;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A host-like thing: a domain, an IP, a CIDR block, a cloud resource ARN...
 * Identity is {@code (dns, name)}; the key is case folded.
 */
public class Asset extends BaseAsset implements Relabelable {

    public static final String LABEL = "Asset";
    public static final KeySpec KEY = KeySpec.of("asset", 2048, 1, true, "^#asset(#[^#]+){2,}$");

    static final String NON_ROUTABLE_AS_NAME = "Non-Routable";
    static final String NON_ROUTABLE_AS_NUMBER = "0";

    private String dns;
    private String name;
    @JsonProperty("private")
    private boolean privateAddress;
    private transient String pendingLabelAddition;

    public Asset() {
    }

    public Asset(String dns, String name) {
        this.dns = dns;
        this.name = name;
    }

    protected Asset(Asset other) {
        super(other);
        this.dns = other.dns;
        this.name = other.name;
        this.privateAddress = other.privateAddress;
        this.pendingLabelAddition = other.pendingLabelAddition;
    }

    /**
     * Builds a normalized asset.
     */
    public static Asset create(String dns, String name) {
        return HookPipeline.run(new Asset(dns, name));
    }

    /**
     * A customer-supplied seed: pending until confirmed, never expiring.
     */
    public static Asset seed(String name) {
        Asset asset = new Asset(name, name);
        asset.source = Sources.SEED;
        asset.status = Statuses.PENDING;
        HookPipeline.run(asset);
        asset.ttl = 0;
        return asset;
    }

    @Override
    public String getDescription() {
        return "Represents a discoverable entity within an infrastructure, such as a host, service, or application.";
    }

    @Override
    public List<String> getLabels() {
        List<String> labels = new ArrayList<>(List.of(LABEL, Labels.TTL));
        if (Sources.SEED.equals(source)) {
            labels.add(Labels.SEED);
        }
        return labels;
    }

    @Override
    public List<Hook<?>> getHooks() {
        return List.of(
                Hook.<Asset>of("normalize unicode characters with punycode", Asset::punycode),
                BaseAsset.<Asset>useGroupAndIdentifier(),
                Hook.<Asset>of("derive key and classification", Asset::deriveKey),
                BaseAsset.<Asset>setGroupAndIdentifier()
        );
    }

    private Asset punycode() {
        dns = Identifiers.punycode(dns);
        name = Identifiers.punycode(name);
        return this;
    }

    private Asset deriveKey() {
        key = KEY.build(dns, name);
        assetClass = classify();
        privateAddress = computePrivate();
        if (privateAddress && (isClass("ip") || isClass(AddressClassifier.CIDR))) {
            metadata.setAsName(NON_ROUTABLE_AS_NAME);
            metadata.setAsNumber(NON_ROUTABLE_AS_NUMBER);
        }
        return this;
    }

    private String classify() {
        if (Sources.ACCOUNT.equals(source)) {
            return dns;
        }
        return AddressClassifier.classify(dns, name);
    }

    private boolean computePrivate() {
        if (isClass("ipv")) {
            return AddressClassifier.parseAddress(name).map(AddressClassifier::isPrivate).orElse(false);
        }
        if (isClass(AddressClassifier.CIDR)) {
            return AddressClassifier.parseCidr(name).map(AddressClassifier::isPrivate).orElse(false);
        }
        return false;
    }

    @Override
    public boolean valid() {
        return KEY.valid(key);
    }

    @Override
    public boolean isPrivate() {
        return privateAddress;
    }

    @Override
    public void setSource(String source) {
        super.setSource(source);
        assetClass = classify();
    }

    @Override
    public void merge(Assetlike update) {
        if (update instanceof Asset other) {
            SeedPromotion.merge(this, other);
        }
    }

    @Override
    public void visit(Assetlike observation) {
        if (observation instanceof Asset other) {
            SeedPromotion.visit(this, other);
            privateAddress = other.privateAddress;
        }
    }

    @Override
    public Asset withStatus(String status) {
        Asset copy = new Asset(this);
        copy.status = status;
        return copy;
    }

    /**
     * A new asset under this one's status, for example a name resolved from this domain.
     */
    public Asset spawn(String dns, String name) {
        Asset asset = create(dns, name);
        asset.status = status;
        return asset;
    }

    @Override
    public String group() {
        return dns;
    }

    @Override
    public String identifier() {
        return name;
    }

    @Override
    protected void applyGroup(String group) {
        this.dns = group;
    }

    @Override
    protected void applyIdentifier(String identifier) {
        this.name = identifier;
    }

    public String getDns() {
        return dns;
    }

    public String getName() {
        return name;
    }

    @Override
    public String getPendingLabelAddition() {
        return pendingLabelAddition;
    }

    @Override
    public void setPendingLabelAddition(String label) {
        this.pendingLabelAddition = label;
    }

    @Override
    public String toString() {
        return "Asset{key='" + key + "', status='" + status + "', source='" + source + "'}";
    }
}
