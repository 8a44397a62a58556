package com.entity.reconciliation.core.model;

import com.entity.reconciliation.key.KeySpec;
import com.entity.reconciliation.registry.Aliasable;
import com.entity.reconciliation.registry.Hook;
import com.entity.reconciliation.registry.HookPipeline;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.entity.reconciliation.rules.Identifiers.isBlank;

/**
 * An Active Directory object. One representation serves the whole AD family: the
 * concrete kind lives in {@link #getLabel()} and is chosen from the explicit label or,
 * failing that, from the alias the object was allocated under.
 */
public class ADObject extends BaseAsset implements Relabelable, Aliasable {

    public static final String LABEL = "ADObject";
    public static final String TIER_ZERO_TAG = "tier-zero";
    public static final int KEY_CEILING = 1024;

    public static final List<String> AD_LABELS = List.of(
            LABEL, "ADUser", "ADComputer", "ADGroup", "ADGPO", "ADOU", "ADContainer", "ADDomain",
            "ADLocalGroup", "ADLocalUser", "ADAIACA", "ADRootCA", "ADEnterpriseCA", "ADNTAuthStore",
            "ADCertTemplate", "ADIssuancePolicy");

    static final List<String> TIER_ZERO_SID_SUFFIXES = List.of(
            "S-1-5-9", "-500", "-512", "-516", "-518", "-519", "-526", "-527", "-544", "-551");

    private static final String KEY_PATTERN = "(?i)^#ad[a-z]+#[^#]+#[A-FS0-9-]+$";
    private static final Pattern KEY_REGEX = Pattern.compile(KEY_PATTERN);

    private String label;
    private String domain;
    @JsonProperty("objectid")
    private String objectId;
    private String sid;
    private String distinguishedName;
    private String displayName;
    private List<String> secondaryLabels;
    private transient String alias;
    private transient String pendingLabelAddition;

    public ADObject() {
    }

    public ADObject(String domain, String objectId, String distinguishedName, String label) {
        this.domain = domain;
        this.objectId = objectId;
        this.distinguishedName = distinguishedName;
        this.label = label;
    }

    protected ADObject(ADObject other) {
        super(other);
        this.label = other.label;
        this.domain = other.domain;
        this.objectId = other.objectId;
        this.sid = other.sid;
        this.distinguishedName = other.distinguishedName;
        this.displayName = other.displayName;
        this.secondaryLabels = other.secondaryLabels == null ? null : new ArrayList<>(other.secondaryLabels);
        this.alias = other.alias;
        this.pendingLabelAddition = other.pendingLabelAddition;
    }

    public static ADObject create(String domain, String objectId, String distinguishedName, String label) {
        return HookPipeline.run(new ADObject(domain, objectId, distinguishedName, label));
    }

    @Override
    public String getDescription() {
        return "Represents an Active Directory object such as a user, computer, group or certificate template.";
    }

    @Override
    public List<String> getLabels() {
        List<String> labels = new ArrayList<>(List.of(LABEL, Asset.LABEL, Labels.TTL));
        if (!isBlank(label) && !LABEL.equals(label)) {
            labels.add(label);
        }
        if (secondaryLabels != null) {
            labels.addAll(secondaryLabels);
        }
        if (Sources.SEED.equals(source)) {
            labels.add(Labels.SEED);
        }
        return labels;
    }

    /**
     * AD objects are permanent: TTL is always zero.
     */
    @Override
    public void defaulted() {
        super.defaulted();
        ttl = 0;
    }

    @Override
    public List<Hook<?>> getHooks() {
        return List.of(
                BaseAsset.<ADObject>useGroupAndIdentifier(),
                Hook.<ADObject>of("derive label, key and class", ADObject::deriveKey),
                BaseAsset.<ADObject>setGroupAndIdentifier()
        );
    }

    private ADObject deriveKey() {
        label = resolveLabel();
        domain = domain == null ? "" : domain.toLowerCase(Locale.ROOT);
        objectId = objectId == null ? "" : objectId.toUpperCase(Locale.ROOT);

        KeySpec labelKey = keySpec(label);
        key = labelKey.build(domain, objectId);
        assetClass = label.substring(2).toLowerCase(Locale.ROOT);
        if (objectId.startsWith("S-")) {
            sid = objectId;
        }
        ttl = 0;
        tagIfTierZero();
        return this;
    }

    static KeySpec keySpec(String label) {
        return new KeySpec(label.toLowerCase(Locale.ROOT), KEY_CEILING, 1, false, KEY_REGEX);
    }

    private String resolveLabel() {
        return findLabel(label)
                .or(() -> findLabel(alias))
                .orElse(LABEL);
    }

    private static Optional<String> findLabel(String candidate) {
        if (isBlank(candidate)) {
            return Optional.empty();
        }
        return AD_LABELS.stream().filter(l -> l.equalsIgnoreCase(candidate)).findFirst();
    }

    private void tagIfTierZero() {
        if (tags.contains(TIER_ZERO_TAG) || isBlank(sid)) {
            return;
        }
        for (String suffix : TIER_ZERO_SID_SUFFIXES) {
            if (sid.endsWith(suffix)) {
                tags.add(TIER_ZERO_TAG);
                return;
            }
        }
    }

    @Override
    public boolean valid() {
        return !isBlank(objectId) && !isBlank(domain) && key != null && KEY_REGEX.matcher(key).matches();
    }

    @Override
    public boolean isClass(String value) {
        return value.equalsIgnoreCase(assetClass) || value.equalsIgnoreCase("adobject");
    }

    @Override
    public void merge(Assetlike update) {
        if (update instanceof ADObject other) {
            SeedPromotion.merge(this, other);
            copyProperties(other);
        }
    }

    @Override
    public void visit(Assetlike observation) {
        if (!(observation instanceof ADObject other) || key == null || !key.equals(other.key)) {
            return;
        }
        copyProperties(other);
        SeedPromotion.visit(this, other);
        ttl = 0;
    }

    private void copyProperties(ADObject other) {
        if (!isBlank(other.distinguishedName)) {
            distinguishedName = other.distinguishedName;
        }
        if (!isBlank(other.displayName)) {
            displayName = other.displayName;
        }
        if (!isBlank(other.sid)) {
            sid = other.sid;
        }
        if (other.secondaryLabels != null) {
            for (String secondary : other.secondaryLabels) {
                if (secondaryLabels == null) {
                    secondaryLabels = new ArrayList<>();
                }
                if (!secondaryLabels.contains(secondary)) {
                    secondaryLabels.add(secondary);
                }
            }
        }
    }

    @Override
    public ADObject withStatus(String status) {
        ADObject copy = new ADObject(this);
        copy.status = status;
        return copy;
    }

    @Override
    public String group() {
        return domain;
    }

    @Override
    public String identifier() {
        return objectId;
    }

    @Override
    protected void applyGroup(String group) {
        this.domain = group;
    }

    @Override
    protected void applyIdentifier(String identifier) {
        this.objectId = identifier;
    }

    @Override
    public void setAlias(String alias) {
        this.alias = alias;
    }

    @Override
    public String getAlias() {
        return alias;
    }

    public String getLabel() {
        return label;
    }

    public String getDomain() {
        return domain;
    }

    public String getObjectId() {
        return objectId;
    }

    public String getSid() {
        return sid;
    }

    public String getDistinguishedName() {
        return distinguishedName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String getPendingLabelAddition() {
        return pendingLabelAddition;
    }

    @Override
    public void setPendingLabelAddition(String label) {
        this.pendingLabelAddition = label;
    }
}
