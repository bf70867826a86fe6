package com.cloudferry.orchestrator.handler;

import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.JobType;

import java.util.Optional;
import java.util.Set;

/**
 * How the recovery monitor revives a stale Job of one type.
 */
public interface RecoveryStrategy {

    JobType type();

    /** Statuses in which a missing heartbeat means the worker is gone. */
    Set<JobStatus> monitoredStatuses();

    /**
     * Re-enqueue the work for {@code job}.
     *
     * @return the new task handle, or empty to leave the Job for a later pass
     */
    Optional<String> recover(Job job);
}
