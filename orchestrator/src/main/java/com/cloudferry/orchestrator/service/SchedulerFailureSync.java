package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.handler.HandlerRegistry;
import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.StatusChangeSource;
import com.cloudferry.orchestrator.repository.JobRepository;
import com.cloudferry.orchestrator.scheduler.TaskFailedEvent;
import com.cloudferry.orchestrator.scheduler.TaskRetryScheduledEvent;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Mirrors scheduler outcomes onto Jobs.
 *
 * When a task runs out of attempts the Job moves to the failure status of
 * the phase it was in. Notifications may arrive twice or late: a Job that is
 * already terminal, or that has since been given a different handle, is
 * left untouched.
 *
 * Listeners run after the scheduler's transaction commits, each in a new
 * transaction of their own.
 */
@Component
public class SchedulerFailureSync {

    private static final Logger log = LoggerFactory.getLogger(SchedulerFailureSync.class);

    private final JobRepository    jobRepo;
    private final HandlerRegistry  handlers;
    private final JobStatusService statusService;
    private final MeterRegistry    meterRegistry;

    public SchedulerFailureSync(JobRepository jobRepo,
                                HandlerRegistry handlers,
                                JobStatusService statusService,
                                MeterRegistry meterRegistry) {
        this.jobRepo       = jobRepo;
        this.handlers      = handlers;
        this.statusService = statusService;
        this.meterRegistry = meterRegistry;
    }

    @TransactionalEventListener(fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onTaskFailed(TaskFailedEvent event) {
        onTerminalFailure(event.handle(), event.jobId(), event.error());
    }

    @TransactionalEventListener(fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onTaskRetryScheduled(TaskRetryScheduledEvent event) {
        onRetryScheduled(event.handle(), event.jobId(), event.error(), event.nextRunAt());
    }

    /**
     * The scheduler gave up on {@code handle}.
     *
     * @return true if the Job was moved to a failure status
     */
    @Transactional
    public boolean onTerminalFailure(String handle, UUID jobId, String error) {
        MDC.put("jobId", String.valueOf(jobId));
        MDC.put("handle", handle);
        try {
            Optional<Job> owned = lockOwner(handle, jobId, "failure");
            if (owned.isEmpty()) {
                return false;
            }
            Job job = owned.get();
            JobStatus failure = handlers.jobType(job.getType()).failureStatusFor(job.getStatus());

            job.setNextRetryAt(null);
            statusService.transition(job, failure, StatusChangeSource.SYSTEM,
                    error != null ? error : "Task " + handle + " exhausted its retries",
                    Metadata.of("handle", handle));
            meterRegistry.counter("cloudferry.job.failures", "status", failure.name()).increment();
            return true;
        } finally {
            MDC.remove("jobId");
            MDC.remove("handle");
        }
    }

    /**
     * The scheduler will try {@code handle} again at {@code nextRunAt}.
     *
     * @return true if the Job was moved to its phase's retry status
     */
    @Transactional
    public boolean onRetryScheduled(String handle, UUID jobId, String error, Instant nextRunAt) {
        Optional<Job> owned = lockOwner(handle, jobId, "retry notice");
        if (owned.isEmpty()) {
            return false;
        }
        Job job = owned.get();
        JobStatus retrying = JobStatus.retryStatusOf(job.getStatus().phase());

        job.setNextRetryAt(nextRunAt);
        statusService.transition(job, retrying, StatusChangeSource.SYSTEM, error,
                Metadata.of("handle", handle, "nextRunAt", nextRunAt));
        return true;
    }

    // The Job, locked, if it is still live and still owns the handle.
    private Optional<Job> lockOwner(String handle, UUID jobId, String what) {
        Optional<Job> found = jobRepo.findByIdForUpdate(jobId);
        if (found.isEmpty()) {
            log.warn("Scheduler {} for unknown job {} (task {})", what, jobId, handle);
            return Optional.empty();
        }
        Job job = found.get();
        if (job.getStatus().isTerminal()) {
            log.info("Ignoring scheduler {} for job {}: already {}", what, jobId, job.getStatus());
            return Optional.empty();
        }
        if (!job.ownsHandle(handle)) {
            log.info("Ignoring scheduler {} for job {}: task {} was superseded", what, jobId, handle);
            return Optional.empty();
        }
        return found;
    }
}
