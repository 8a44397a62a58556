package com.entity.reconciliation.core.model;

import com.entity.reconciliation.key.KeySpec;
import com.entity.reconciliation.registry.Hook;
import com.entity.reconciliation.registry.HookException;
import com.entity.reconciliation.registry.HookPipeline;
import com.entity.reconciliation.rules.UrlNormalizer;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

import static com.entity.reconciliation.rules.Identifiers.isBlank;

/**
 * A web application identified by its normalized primary URL. The URL keeps its natural
 * case apart from scheme and host.
 */
public class WebApplication extends BaseAsset implements Relabelable {

    public static final String LABEL = "WebApplication";
    public static final KeySpec KEY = KeySpec.of("webapplication", 2048, 0, false,
            "^#webapplication#https?://[^?#]+$");

    @JsonProperty("primary_url")
    private String primaryUrl;
    private List<String> urls;
    private String name;
    private transient String pendingLabelAddition;

    public WebApplication() {
    }

    public WebApplication(String primaryUrl, String name) {
        this.primaryUrl = primaryUrl;
        this.name = name;
    }

    protected WebApplication(WebApplication other) {
        super(other);
        this.primaryUrl = other.primaryUrl;
        this.urls = other.urls == null ? null : new ArrayList<>(other.urls);
        this.name = other.name;
        this.pendingLabelAddition = other.pendingLabelAddition;
    }

    public static WebApplication create(String primaryUrl, String name) {
        return HookPipeline.run(new WebApplication(primaryUrl, name));
    }

    @Override
    public String getDescription() {
        return "Represents a web application with a primary URL and associated URLs.";
    }

    @Override
    public List<String> getLabels() {
        List<String> labels = new ArrayList<>(List.of(LABEL, Asset.LABEL, Labels.TTL));
        if (Sources.SEED.equals(source)) {
            labels.add(Labels.SEED);
        }
        return labels;
    }

    @Override
    public void defaulted() {
        super.defaulted();
        if (isBlank(assetClass)) {
            assetClass = "webapplication";
        }
        if (urls == null) {
            urls = new ArrayList<>();
        }
    }

    @Override
    public List<Hook<?>> getHooks() {
        return List.of(
                BaseAsset.<WebApplication>useGroupAndIdentifier(),
                Hook.<WebApplication>of("normalize primary URL and derive key", WebApplication::deriveKey),
                BaseAsset.<WebApplication>setGroupAndIdentifier()
        );
    }

    private WebApplication deriveKey() {
        if (isBlank(primaryUrl)) {
            throw new HookException("web application requires a non-empty primary URL");
        }
        try {
            primaryUrl = UrlNormalizer.normalize(primaryUrl);
        } catch (IllegalArgumentException e) {
            throw new HookException("failed to normalize primary URL: " + e.getMessage(), e);
        }
        key = KEY.build(primaryUrl);

        List<String> normalized = new ArrayList<>();
        if (urls != null) {
            for (String url : urls) {
                if (UrlNormalizer.isValid(url)) {
                    normalized.add(UrlNormalizer.normalize(url));
                }
            }
        }
        urls = normalized;
        return this;
    }

    @Override
    public boolean valid() {
        return KEY.valid(key);
    }

    @Override
    public void merge(Assetlike update) {
        if (!(update instanceof WebApplication other)) {
            return;
        }
        SeedPromotion.merge(this, other);
        mergeDetails(other);
        unionUrls(other);
    }

    @Override
    public void visit(Assetlike observation) {
        if (!(observation instanceof WebApplication other)) {
            return;
        }
        SeedPromotion.visit(this, other);
        mergeDetails(other);
        unionUrls(other);
    }

    private void unionUrls(WebApplication other) {
        if (other.urls == null || other.urls.isEmpty()) {
            return;
        }
        if (urls == null) {
            urls = new ArrayList<>();
        }
        for (String url : other.urls) {
            if (!urls.contains(url)) {
                urls.add(url);
            }
        }
    }

    private void mergeDetails(WebApplication other) {
        if (!isBlank(other.name) && (isBlank(name) || name.equals(primaryUrl) || !other.name.equals(other.primaryUrl))) {
            name = other.name;
            group = other.name;
        }
    }

    @Override
    public WebApplication withStatus(String status) {
        WebApplication copy = new WebApplication(this);
        copy.status = status;
        return copy;
    }

    @Override
    public String group() {
        return name;
    }

    @Override
    public String identifier() {
        return primaryUrl;
    }

    @Override
    protected void applyGroup(String group) {
        this.name = group;
    }

    @Override
    protected void applyIdentifier(String identifier) {
        this.primaryUrl = identifier;
    }

    public String getPrimaryUrl() {
        return primaryUrl;
    }

    public List<String> getUrls() {
        return urls == null ? List.of() : List.copyOf(urls);
    }

    public void setUrls(List<String> urls) {
        this.urls = urls == null ? null : new ArrayList<>(urls);
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
}
