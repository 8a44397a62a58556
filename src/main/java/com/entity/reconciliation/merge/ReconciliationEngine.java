package com.entity.reconciliation.merge;

import com.entity.reconciliation.core.model.GraphModel;
import com.entity.reconciliation.core.model.GraphRelationship;
import com.entity.reconciliation.core.model.Reconcilable;
import com.entity.reconciliation.core.model.Relabelable;
import com.entity.reconciliation.core.model.StatusTracked;
import com.entity.reconciliation.logging.LogContext;
import com.entity.reconciliation.metrics.MetricsService;
import com.entity.reconciliation.metrics.NoOpMetricsService;
import com.entity.reconciliation.registry.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Folds an incoming observation into the stored entity with the same key.
 *
 * <p>The engine owns no state besides its metrics sink; it mutates the existing entity in
 * place. Callers serialize access to one entity, see {@link KeyedReconciler}.</p>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final MetricsService metricsService;

    public ReconciliationEngine() {
        this(new NoOpMetricsService());
    }

    public ReconciliationEngine(MetricsService metricsService) {
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    public <T extends GraphModel & Reconcilable<? super T>> ReconciliationResult<T> merge(T existing, T update) {
        return reconcile(existing, update, ReconciliationMode.MERGE);
    }

    public <T extends GraphModel & Reconcilable<? super T>> ReconciliationResult<T> visit(T existing, T observation) {
        return reconcile(existing, observation, ReconciliationMode.VISIT);
    }

    /**
     * Folds {@code incoming} into {@code existing}.
     *
     * @throws IllegalArgumentException if the two models do not share a key
     */
    public <T extends GraphModel & Reconcilable<? super T>> ReconciliationResult<T> reconcile(
            T existing, T incoming, ReconciliationMode mode) {
        Objects.requireNonNull(existing, "existing is required");
        Objects.requireNonNull(incoming, "incoming is required");
        Objects.requireNonNull(mode, "mode is required");
        if (!Objects.equals(existing.getKey(), incoming.getKey())) {
            throw new IllegalArgumentException("cannot reconcile different keys: "
                    + existing.getKey() + " and " + incoming.getKey());
        }

        String type = TypeRegistry.name(existing);
        String modeName = mode.name().toLowerCase(Locale.ROOT);
        try (LogContext ctx = LogContext.forReconcile(LogContext.generateCorrelationId(), type,
                existing.getKey(), modeName)) {
            long start = System.nanoTime();
            String statusBefore = status(existing);
            int historyBefore = historySize(existing);
            boolean pendingBefore = Relabelable.pendingLabelAddition(existing).isPresent();

            if (!existing.valid() || !incoming.valid()) {
                log.debug("reconcile.invalidInput key={} existingValid={} incomingValid={}",
                        existing.getKey(), existing.valid(), incoming.valid());
            }

            switch (mode) {
                case MERGE -> existing.merge(incoming);
                case VISIT -> existing.visit(incoming);
            }

            String statusAfter = status(existing);
            int historyAdded = Math.max(0, historySize(existing) - historyBefore);
            String pendingLabel = Relabelable.pendingLabelAddition(existing).orElse(null);

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordReconcileDuration(type, modeName, duration);
            if (!Objects.equals(statusBefore, statusAfter)) {
                metricsService.incrementStatusTransition(type);
            }
            if (!pendingBefore && pendingLabel != null) {
                metricsService.incrementSeedPromotion(type);
                log.info("reconcile.promoted key={} pendingLabel={}", existing.getKey(), pendingLabel);
            }
            log.debug("reconcile.completed key={} mode={} statusBefore={} statusAfter={} historyAdded={}",
                    existing.getKey(), modeName, statusBefore, statusAfter, historyAdded);

            return new ReconciliationResult<>(existing, mode, statusBefore, statusAfter, historyAdded,
                    pendingLabel, false);
        }
    }

    /**
     * Folds a re-observed relationship into the stored one.
     *
     * @throws IllegalArgumentException if the two relationships do not share a key
     */
    public <R extends GraphRelationship> R visitRelationship(R existing, GraphRelationship observation) {
        Objects.requireNonNull(existing, "existing is required");
        Objects.requireNonNull(observation, "observation is required");
        if (!Objects.equals(existing.getKey(), observation.getKey())) {
            throw new IllegalArgumentException("cannot reconcile different relationship keys: "
                    + existing.getKey() + " and " + observation.getKey());
        }
        long start = System.nanoTime();
        existing.visit(observation);
        metricsService.recordReconcileDuration(existing.label(), "visit", Duration.ofNanos(System.nanoTime() - start));
        log.debug("relationship.visited key={} label={}", existing.getKey(), existing.label());
        return existing;
    }

    static String status(GraphModel model) {
        return model instanceof StatusTracked tracked ? tracked.getStatus() : null;
    }

    static int historySize(GraphModel model) {
        return model instanceof StatusTracked tracked ? tracked.getHistory().size() : 0;
    }
}
