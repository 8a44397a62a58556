package com.entity.reconciliation.lock;

/**
 * Per-key lock serializing the read-reconcile-write cycle of one entity.
 */
public interface KeyLock {

    /**
     * Acquires the lock on the given entity key.
     *
     * @param key the entity key
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock could not be acquired
     */
    boolean tryLock(String key);

    /**
     * Releases the lock on the given key.
     */
    void unlock(String key);
}
