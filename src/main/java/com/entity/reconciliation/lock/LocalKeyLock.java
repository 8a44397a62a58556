package com.entity.reconciliation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock using one {@link ReentrantLock} per key.
 * Suitable when a single JVM writes a given tenant partition.
 *
 * <p>An entry lives only while some thread holds or waits for its key; it is dropped when
 * the last user releases it.</p>
 */
public class LocalKeyLock implements KeyLock {
    private static final Logger log = LoggerFactory.getLogger(LocalKeyLock.class);

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalKeyLock() {
        this(LockConfig.defaults());
    }

    public LocalKeyLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        Entry entry = acquire(key);
        boolean acquired = false;
        try {
            for (int attempt = 0; attempt < config.attempts(); attempt++) {
                if (entry.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                    log.debug("Lock acquired: {} (attempt {})", key, attempt + 1);
                    acquired = true;
                    return true;
                }
                if (attempt < config.attempts() - 1) {
                    Thread.sleep(config.retryDelayMs());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(key, "Interrupted while acquiring lock for key: " + key, e);
        } finally {
            if (!acquired) {
                release(key);
            }
        }
        throw new LockAcquisitionException(key, "Failed to acquire lock for key '" + key + "' after "
                + config.attempts() + " attempts of " + config.timeoutMs() + "ms");
    }

    @Override
    public void unlock(String key) {
        Entry entry = locks.get(key);
        if (entry != null && entry.lock.isHeldByCurrentThread()) {
            entry.lock.unlock();
            release(key);
            log.debug("Lock released: {}", key);
        }
    }

    /**
     * Number of keys currently held or waited for.
     */
    int size() {
        return locks.size();
    }

    private Entry acquire(String key) {
        return locks.compute(key, (k, entry) -> {
            Entry current = entry == null ? new Entry() : entry;
            current.users++;
            return current;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    // Guarded by the map's per-key compute.
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
