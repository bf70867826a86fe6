package com.cloudferry.orchestrator.handler;

import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.JobType;

import java.util.Set;
import java.util.UUID;

/**
 * Per job-type behaviour of the fetch phase.
 *
 * Implementations are Spring beans; {@link HandlerRegistry} picks them up
 * at startup. Exactly one handler may exist per {@link JobType}.
 */
public interface JobTypeHandler {

    JobType type();

    /**
     * Hand the fetch phase of {@code jobId} to the scheduler.
     *
     * @return the opaque task handle
     * @throws com.cloudferry.orchestrator.scheduler.SchedulerException if the scheduler is unavailable
     */
    String enqueueFetch(UUID jobId);

    /** Statuses that count as "failed" for this type; such a Job does not block a new one. */
    Set<JobStatus> failedStatuses();

    /** Whether a retry from {@code status} resumes the push phase instead of refetching. */
    boolean isPushPhase(JobStatus status);

    /** The status a Job lands on when the scheduler gives up on it while in {@code status}. */
    default JobStatus failureStatusFor(JobStatus status) {
        return JobStatus.failureStatusOf(status.phase());
    }
}
