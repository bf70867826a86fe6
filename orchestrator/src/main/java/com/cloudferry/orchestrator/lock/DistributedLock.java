package com.cloudferry.orchestrator.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Cross-process mutex with an expiry that the holder keeps extending.
 */
public interface DistributedLock {

    /** Single attempt; empty when someone else holds {@code key}. */
    default Optional<LockHandle> acquire(String key, Duration ttl) {
        return acquire(key, ttl, Duration.ZERO);
    }

    /** Keep trying for up to {@code wait}; empty when the lock stayed busy. */
    Optional<LockHandle> acquire(String key, Duration ttl, Duration wait);
}
