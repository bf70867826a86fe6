package com.cloudferry.orchestrator.handler.impl;

import com.cloudferry.orchestrator.handler.StorageProviderHandler;
import com.cloudferry.orchestrator.scheduler.TaskKind;
import com.cloudferry.orchestrator.scheduler.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.UUID;

/**
 * Shared plumbing for destinations whose push runs as a {@link TaskQueue} task.
 *
 * While an upload is in flight the push worker holds the Redis key
 * {@code push:lock:{provider}:{jobId}}; {@link #releaseLock} drops it so a
 * cancelled or retried Job is not blocked by a dead uploader.
 */
abstract class QueuedStorageHandler implements StorageProviderHandler {

    private static final Logger log = LoggerFactory.getLogger(QueuedStorageHandler.class);

    private final TaskQueue           taskQueue;
    private final StringRedisTemplate redis;

    protected QueuedStorageHandler(TaskQueue taskQueue, StringRedisTemplate redis) {
        this.taskQueue = taskQueue;
        this.redis     = redis;
    }

    @Override
    public String enqueuePush(UUID jobId) {
        return taskQueue.enqueue(jobId, TaskKind.PUSH, type().name());
    }

    @Override
    public boolean releaseLock(UUID jobId) {
        String key = lockKey(jobId);
        try {
            boolean removed = Boolean.TRUE.equals(redis.delete(key));
            log.info("Upload lock {} {}", key, removed ? "released" : "was not held");
            return removed;
        } catch (DataAccessException e) {
            log.warn("Could not release upload lock {}: {}", key, e.getMessage());
            return false;
        }
    }

    String lockKey(UUID jobId) {
        return "push:lock:" + type().name().toLowerCase() + ":" + jobId;
    }
}
