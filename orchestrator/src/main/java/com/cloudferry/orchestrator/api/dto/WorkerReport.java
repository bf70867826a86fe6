package com.cloudferry.orchestrator.api.dto;

import com.cloudferry.orchestrator.model.JobStatus;

/**
 * Body for the /worker/jobs/{id}/* calls. Every call needs the task handle;
 * the other fields are read by the endpoints that use them:
 *
 *   heartbeat : state
 *   progress  : bytes, totalBytes
 *   phase     : target, localPath
 */
public record WorkerReport(
        String    handle,
        String    state,
        Long      bytes,
        Long      totalBytes,
        JobStatus target,
        String    localPath
) {}
