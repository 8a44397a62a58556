package com.entity.reconciliation.merge;

import com.entity.reconciliation.core.model.GraphModel;
import com.entity.reconciliation.core.model.Reconcilable;
import com.entity.reconciliation.core.model.Relabelable;
import com.entity.reconciliation.lock.KeyLock;
import com.entity.reconciliation.lock.LocalKeyLock;
import com.entity.reconciliation.lock.LockAcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Read-reconcile-write of one entity under a per-key lock.
 *
 * <p>The store is reached only through the loader and writer the caller passes in. With
 * the default {@link LocalKeyLock} concurrent upserts of the same key inside one JVM are
 * serialized; stores that offer conditional writes can use
 * {@link com.entity.reconciliation.lock.NoOpKeyLock#INSTANCE} and retry on conflict instead.</p>
 */
public class KeyedReconciler {
    private static final Logger log = LoggerFactory.getLogger(KeyedReconciler.class);

    private final ReconciliationEngine engine;
    private final KeyLock lock;

    public KeyedReconciler() {
        this(new ReconciliationEngine(), new LocalKeyLock());
    }

    public KeyedReconciler(ReconciliationEngine engine, KeyLock lock) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.lock = Objects.requireNonNull(lock, "lock is required");
    }

    /**
     * Loads the stored entity for the incoming key, folds the incoming one into it (or
     * takes the incoming one when nothing is stored) and writes the result.
     *
     * @throws IllegalArgumentException if the incoming entity is not valid
     * @throws LockAcquisitionException if the key lock is not acquired
     */
    public <T extends GraphModel & Reconcilable<? super T>> ReconciliationResult<T> upsert(
            T incoming, ReconciliationMode mode, Function<String, Optional<T>> loader, Consumer<T> writer) {
        Objects.requireNonNull(incoming, "incoming is required");
        if (!incoming.valid()) {
            throw new IllegalArgumentException("refusing to persist invalid model with key " + incoming.getKey());
        }

        String key = incoming.getKey();
        if (!lock.tryLock(key)) {
            throw new LockAcquisitionException(key, "lock not acquired for key " + key);
        }
        try {
            Optional<T> existing = loader.apply(key);
            ReconciliationResult<T> result;
            if (existing.isPresent()) {
                result = engine.reconcile(existing.get(), incoming, mode);
            } else {
                result = ReconciliationResult.created(incoming, ReconciliationEngine.status(incoming),
                        Relabelable.pendingLabelAddition(incoming).orElse(null));
                log.debug("upsert.created key={}", key);
            }
            writer.accept(result.entity());
            return result;
        } finally {
            lock.unlock(key);
        }
    }
}
