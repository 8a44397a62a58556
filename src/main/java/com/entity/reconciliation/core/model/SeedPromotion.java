package com.entity.reconciliation.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Promotion of a self-discovered entity to a seed when a seed-sourced observation of it
 * arrives. The graph relabel is deferred through {@link Relabelable}.
 */
public final class SeedPromotion {
    private static final Logger log = LoggerFactory.getLogger(SeedPromotion.class);

    private SeedPromotion() {
    }

    /**
     * True when {@code current} is not a seed and {@code incoming} is.
     */
    public static boolean isPromotion(BaseAsset current, BaseAsset incoming) {
        return !Sources.SEED.equals(current.source) && Sources.SEED.equals(incoming.source);
    }

    /**
     * Marks the seed label as pending, flips the source to seed and records the promotion
     * as exactly one history entry ending in {@code status}.
     */
    public static void promote(BaseAsset base, Relabelable relabelable, String status) {
        relabelable.setPendingLabelAddition(Labels.SEED);
        base.source = Sources.SEED;
        base.history.append(new HistoryRecord(null, status, Sources.SEED, null, Timestamps.now()));
        base.status = status;
        log.debug("seed.promoted key={} status={}", base.key, status);
    }

    /**
     * Visit with promotion: the current status is kept.
     */
    public static <T extends BaseAsset & Relabelable> void visit(T current, Assetlike observation) {
        if (isPromotion(current, observation.getBase())) {
            promote(current, current, current.status);
        }
        current.visitFields(observation);
    }

    /**
     * Merge with promotion: the promoted entity takes the update's status, recorded once.
     */
    public static <T extends BaseAsset & Relabelable> void merge(T current, Assetlike update) {
        BaseAsset incoming = update.getBase();
        if (isPromotion(current, incoming)) {
            String status = incoming.status == null || incoming.status.isEmpty() ? current.status : incoming.status;
            promote(current, current, status);
        }
        current.mergeFields(update);
    }
}
