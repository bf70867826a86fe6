package com.cloudferry.orchestrator.lock;

/**
 * A held lock. Meant for try-with-resources; closing releases it.
 */
public interface LockHandle extends AutoCloseable {

    String key();

    /**
     * Push the expiry out by another ttl.
     *
     * @return false when the lock has already been lost
     */
    boolean refresh();

    /** Release if still owned. Safe to call more than once. */
    void release();

    @Override
    default void close() {
        release();
    }
}
