package com.cloudferry.orchestrator.handler;

import com.cloudferry.orchestrator.model.StorageProviderType;

import java.util.UUID;

/** Per destination behaviour of the push phase. */
public interface StorageProviderHandler {

    StorageProviderType type();

    /**
     * Hand the push phase of {@code jobId} to the scheduler.
     *
     * @return the opaque task handle
     */
    String enqueuePush(UUID jobId);

    /**
     * Drop the provider-side upload lock held for {@code jobId}.
     *
     * @return true if a lock was removed
     */
    boolean releaseLock(UUID jobId);
}
