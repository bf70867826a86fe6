package com.cloudferry.orchestrator.handler.impl;

import com.cloudferry.orchestrator.model.StorageProviderType;
import com.cloudferry.orchestrator.scheduler.TaskQueue;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class GoogleDriveStorageHandler extends QueuedStorageHandler {

    public GoogleDriveStorageHandler(TaskQueue taskQueue, StringRedisTemplate redis) {
        super(taskQueue, redis);
    }

    @Override
    public StorageProviderType type() {
        return StorageProviderType.GOOGLE_DRIVE;
    }
}
