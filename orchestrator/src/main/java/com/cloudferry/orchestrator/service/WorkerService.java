package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.handler.HandlerRegistry;
import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.Phase;
import com.cloudferry.orchestrator.model.StatusChangeSource;
import com.cloudferry.orchestrator.repository.JobRepository;
import com.cloudferry.orchestrator.scheduler.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Operations a worker calls while it runs a task.
 *
 * Every call carries the task handle the worker was given. Only the holder
 * of the handle for the Job's current phase may write (the push handle in
 * the push phase, the fetch handle before it), and only while the Job is not
 * terminal; a stale worker gets false (or HANDLE_SUPERSEDED) and should stop. Heartbeat and progress are conditional bulk updates that
 * never touch the status.
 */
@Service
public class WorkerService {

    private static final Logger log = LoggerFactory.getLogger(WorkerService.class);

    private final JobRepository       jobRepo;
    private final JobStatusService    statusService;
    private final HandlerRegistry     handlers;
    private final TransactionTemplate tx;

    public WorkerService(JobRepository jobRepo,
                         JobStatusService statusService,
                         HandlerRegistry handlers,
                         PlatformTransactionManager txManager) {
        this.jobRepo       = jobRepo;
        this.statusService = statusService;
        this.handlers      = handlers;
        this.tx            = new TransactionTemplate(txManager);
    }

    /**
     * The worker picked up its task. Moves the Job to FETCHING or PUSHING
     * (depending on its phase) when that is a forward move.
     */
    public boolean markStarted(UUID jobId, String handle) {
        return withContext(jobId, handle, () -> Boolean.TRUE.equals(tx.execute(status -> {
            Optional<Job> owned = lockOwned(jobId, handle);
            if (owned.isEmpty()) {
                return false;
            }
            Job job = owned.get();
            Instant now = Instant.now();
            if (job.getStartedAt() == null) {
                job.setStartedAt(now);
            }
            job.setLastHeartbeat(now);

            JobStatus running = job.getStatus().phase() == Phase.PUSH ? JobStatus.PUSHING : JobStatus.FETCHING;
            if (job.getStatus() != running && job.getStatus().allowsWorkerTransitionTo(running)) {
                statusService.transition(job, running, StatusChangeSource.WORKER, null, Metadata.of("handle", handle));
            } else {
                jobRepo.save(job);
            }
            return true;
        })));
    }

    /** Liveness ping, optionally with a free-text note on what the worker is doing. */
    public boolean updateHeartbeat(UUID jobId, String handle, String state) {
        return withContext(jobId, handle, () -> {
            Integer rows = tx.execute(status ->
                    jobRepo.touchHeartbeat(jobId, handle, state, Instant.now(),
                            JobStatus.activeStatuses(), JobStatus.statusesOf(Phase.PUSH)));
            return rows != null && rows > 0;
        });
    }

    /** Bytes done so far; also counts as a heartbeat. */
    public boolean updateProgress(UUID jobId, String handle, long bytes, Long totalBytes) {
        return withContext(jobId, handle, () -> {
            Integer rows = tx.execute(status ->
                    jobRepo.updateProgress(jobId, handle, bytes, totalBytes, Instant.now(),
                            JobStatus.activeStatuses(), JobStatus.statusesOf(Phase.PUSH)));
            return rows != null && rows > 0;
        });
    }

    /**
     * Move the Job forward. Entering PENDING_PUSH queues the upload on the
     * Job's destination and stores the push handle.
     */
    public OperationResult<JobStatus> advancePhase(UUID jobId, String handle, JobStatus target, String localPath) {
        return withContext(jobId, handle, () -> {
            try {
                return tx.execute(status -> advanceLocked(jobId, handle, target, localPath));
            } catch (SchedulerException e) {
                log.warn("Scheduler unavailable while advancing job {} to {}: {}", jobId, target, e.getMessage());
                return OperationResult.fail(JobErrorCode.SCHEDULER_UNAVAILABLE, "Scheduler unavailable, try again later");
            }
        });
    }

    private OperationResult<JobStatus> advanceLocked(UUID jobId, String handle, JobStatus target, String localPath) {
        Optional<Job> found = jobRepo.findByIdForUpdate(jobId);
        if (found.isEmpty()) {
            return OperationResult.fail(JobErrorCode.JOB_NOT_FOUND, "Job " + jobId + " not found");
        }
        Job job = found.get();
        if (job.getStatus().isTerminal() || !job.ownsHandle(handle)) {
            return OperationResult.fail(JobErrorCode.HANDLE_SUPERSEDED,
                    "Task " + handle + " no longer owns job " + jobId);
        }
        JobStatus current = job.getStatus();
        if (!current.allowsWorkerTransitionTo(target)) {
            return OperationResult.fail(JobErrorCode.INVALID_TRANSITION, current + " -> " + target + " is not allowed");
        }
        // Only the fetch task hands over to the push phase, and only once.
        if (target == JobStatus.PENDING_PUSH && current.phase() == Phase.PUSH && current != JobStatus.PENDING_PUSH) {
            return OperationResult.fail(JobErrorCode.INVALID_TRANSITION,
                    current + " -> " + target + " would queue a second upload");
        }
        boolean pushStarted = job.getPushHandle() != null;
        if ((target == JobStatus.PUSHING || target == JobStatus.PUSH_RETRY || target == JobStatus.COMPLETED)
                && !(pushStarted && handle.equals(job.getPushHandle()))) {
            return OperationResult.fail(JobErrorCode.INVALID_TRANSITION,
                    target + " requires the push task's handle");
        }

        if (localPath != null) {
            job.setLocalPath(localPath);
        }
        job.setLastHeartbeat(Instant.now());

        String pushHandle = null;
        if (target == JobStatus.PENDING_PUSH && current != JobStatus.PENDING_PUSH) {
            if (job.getStorageProfile() == null) {
                return OperationResult.fail(JobErrorCode.NO_DESTINATION, "Job " + jobId + " has no destination");
            }
            pushHandle = handlers.storageProvider(job.getStorageProfile().getProviderType()).enqueuePush(jobId);
            job.setPushHandle(pushHandle);
        }

        if (!statusService.transition(job, target, StatusChangeSource.WORKER, null,
                Metadata.of("handle", handle, "pushHandle", pushHandle))) {
            jobRepo.save(job);
        }
        return OperationResult.ok(target);
    }

    private Optional<Job> lockOwned(UUID jobId, String handle) {
        Optional<Job> found = jobRepo.findByIdForUpdate(jobId);
        if (found.isEmpty()) {
            log.warn("Worker reported for unknown job {}", jobId);
            return Optional.empty();
        }
        Job job = found.get();
        if (job.getStatus().isTerminal() || !job.ownsHandle(handle)) {
            log.info("Rejecting worker call for job {}: task {} is not current ({})", jobId, handle, job.getStatus());
            return Optional.empty();
        }
        return found;
    }

    // Every log line below carries the Job and the task it concerns.
    private static <T> T withContext(UUID jobId, String handle, Supplier<T> body) {
        MDC.put("jobId", String.valueOf(jobId));
        MDC.put("handle", String.valueOf(handle));
        try {
            return body.get();
        } finally {
            MDC.remove("jobId");
            MDC.remove("handle");
        }
    }
}
