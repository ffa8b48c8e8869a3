package com.registry.core.storage;

/**
 * Held advisory lock. Released by {@link #close()}.
 */
public interface StorageLock extends AutoCloseable {

    /**
     * Release the lock. Idempotent.
     */
    @Override
    void close();
}
