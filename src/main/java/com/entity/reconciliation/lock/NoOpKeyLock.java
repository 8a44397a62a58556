package com.entity.reconciliation.lock;

/**
 * Lock that never blocks, for stores that serialize writes per key themselves.
 */
public final class NoOpKeyLock implements KeyLock {

    public static final NoOpKeyLock INSTANCE = new NoOpKeyLock();

    private NoOpKeyLock() {
    }

    @Override
    public boolean tryLock(String key) {
        return true;
    }

    @Override
    public void unlock(String key) {
    }
}
