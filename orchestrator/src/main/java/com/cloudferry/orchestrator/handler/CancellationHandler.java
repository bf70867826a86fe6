package com.cloudferry.orchestrator.handler;

import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobType;

/** Type-specific cleanup when a user or admin cancels a Job. */
public interface CancellationHandler {

    JobType type();

    void cancel(Job job);
}
