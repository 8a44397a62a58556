package com.entity.reconciliation.core.model;

/**
 * A target that shares the {@link BaseAsset} fields and reconciles through them.
 */
public interface Assetlike extends Target, Reconcilable<Assetlike> {

    BaseAsset getBase();

    /**
     * Sets the provenance, unless the current one is seed or account.
     */
    void setSource(String source);

    void setStatus(String status);

    default Metadata getMetadata() {
        return getBase().getMetadata();
    }
}
