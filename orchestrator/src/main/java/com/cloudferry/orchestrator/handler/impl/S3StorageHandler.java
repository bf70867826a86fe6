package com.cloudferry.orchestrator.handler.impl;

import com.cloudferry.orchestrator.model.StorageProviderType;
import com.cloudferry.orchestrator.scheduler.TaskQueue;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class S3StorageHandler extends QueuedStorageHandler {

    public S3StorageHandler(TaskQueue taskQueue, StringRedisTemplate redis) {
        super(taskQueue, redis);
    }

    @Override
    public StorageProviderType type() {
        return StorageProviderType.AWS_S3;
    }
}
