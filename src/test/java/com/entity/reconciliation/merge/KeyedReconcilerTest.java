package com.entity.reconciliation.merge;

import com.entity.reconciliation.core.model.Asset;
import com.entity.reconciliation.core.model.Statuses;
import com.entity.reconciliation.lock.KeyLock;
import com.entity.reconciliation.lock.LocalKeyLock;
import com.entity.reconciliation.lock.LockAcquisitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KeyedReconcilerTest {

    @Mock
    private KeyLock lock;

    private KeyedReconciler reconciler;
    private Map<String, Asset> store;

    @BeforeEach
    void setUp() {
        reconciler = new KeyedReconciler(new ReconciliationEngine(), lock);
        store = new ConcurrentHashMap<>();
    }

    private Optional<Asset> load(String key) {
        return Optional.ofNullable(store.get(key));
    }

    @Test
    @DisplayName("A new key should be stored as is")
    void testCreated() {
        Asset asset = Asset.create("example.com", "example.com");
        when(lock.tryLock(asset.getKey())).thenReturn(true);

        ReconciliationResult<Asset> result = reconciler.upsert(asset, ReconciliationMode.MERGE,
                this::load, a -> store.put(a.getKey(), a));

        assertTrue(result.created());
        assertSame(asset, store.get(asset.getKey()));
        assertEquals(Statuses.ACTIVE, result.statusAfter());
        verify(lock).tryLock(asset.getKey());
        verify(lock).unlock(asset.getKey());
    }

    @Test
    @DisplayName("An existing key should be reconciled into the stored entity")
    void testReconciled() {
        Asset stored = Asset.create("example.com", "example.com");
        store.put(stored.getKey(), stored);
        Asset update = Asset.create("example.com", "example.com").withStatus(Statuses.FROZEN);
        when(lock.tryLock(update.getKey())).thenReturn(true);

        ReconciliationResult<Asset> result = reconciler.upsert(update, ReconciliationMode.MERGE,
                this::load, a -> store.put(a.getKey(), a));

        assertFalse(result.created());
        assertSame(stored, result.entity());
        assertEquals(Statuses.FROZEN, stored.getStatus());
        assertEquals(1, stored.getHistory().size());
    }

    @Test
    @DisplayName("The lock should be released when the writer fails")
    void testUnlockOnFailure() {
        Asset asset = Asset.create("example.com", "example.com");
        when(lock.tryLock(asset.getKey())).thenReturn(true);

        assertThrows(IllegalStateException.class, () -> reconciler.upsert(asset, ReconciliationMode.VISIT,
                this::load, a -> {
                    throw new IllegalStateException("store unavailable");
                }));

        verify(lock).unlock(asset.getKey());
    }

    @Test
    @DisplayName("A failed lock should skip the load and the write")
    void testLockFailure() {
        Asset asset = Asset.create("example.com", "example.com");
        when(lock.tryLock(asset.getKey())).thenThrow(new LockAcquisitionException(asset.getKey(), "busy"));
        List<String> loaded = new ArrayList<>();

        assertThrows(LockAcquisitionException.class, () -> reconciler.upsert(asset, ReconciliationMode.MERGE,
                key -> {
                    loaded.add(key);
                    return Optional.empty();
                }, a -> store.put(a.getKey(), a)));

        assertTrue(loaded.isEmpty());
        assertTrue(store.isEmpty());
        verify(lock, never()).unlock(anyString());
    }

    @Test
    @DisplayName("A lock that reports failure should stop the upsert")
    void testLockRefused() {
        Asset asset = Asset.create("example.com", "example.com");
        when(lock.tryLock(asset.getKey())).thenReturn(false);

        LockAcquisitionException e = assertThrows(LockAcquisitionException.class,
                () -> reconciler.upsert(asset, ReconciliationMode.MERGE, this::load, a -> store.put(a.getKey(), a)));

        assertEquals(asset.getKey(), e.getKey());
        assertTrue(store.isEmpty());
        verify(lock, never()).unlock(anyString());
    }

    @Test
    @DisplayName("An invalid model should be refused before locking")
    void testInvalid() {
        Asset invalid = new Asset("example.com", "example.com");

        assertThrows(IllegalArgumentException.class, () -> reconciler.upsert(invalid, ReconciliationMode.MERGE,
                this::load, a -> store.put(a.getKey(), a)));
        verifyNoInteractions(lock);
    }

    @Test
    @DisplayName("Concurrent merges of one key should not lose history")
    void testConcurrentUpserts() throws Exception {
        KeyedReconciler local = new KeyedReconciler(new ReconciliationEngine(), new LocalKeyLock());
        Asset stored = Asset.create("example.com", "example.com");
        store.put(stored.getKey(), stored);
        String[] statuses = {Statuses.FROZEN, Statuses.ACTIVE};

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                Asset update = Asset.create("example.com", "example.com").withStatus(statuses[i % 2]);
                futures.add(executor.submit(() -> local.upsert(update, ReconciliationMode.MERGE,
                        this::load, a -> store.put(a.getKey(), a))));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        int transitions = stored.getHistory().size();
        assertTrue(transitions > 0);
        assertEquals(stored.getHistory().getRecords().get(transitions - 1).getTo(), stored.getStatus());
    }
}
