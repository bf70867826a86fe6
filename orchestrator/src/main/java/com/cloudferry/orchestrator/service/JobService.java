package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.dispatch.DispatchLog;
import com.cloudferry.orchestrator.handler.CancellationHandler;
import com.cloudferry.orchestrator.handler.HandlerRegistry;
import com.cloudferry.orchestrator.handler.JobTypeHandler;
import com.cloudferry.orchestrator.model.*;
import com.cloudferry.orchestrator.repository.InvoiceRepository;
import com.cloudferry.orchestrator.repository.JobRepository;
import com.cloudferry.orchestrator.repository.RequestedSourceRepository;
import com.cloudferry.orchestrator.repository.StorageProfileRepository;
import com.cloudferry.orchestrator.scheduler.ExternalSchedulerQuery;
import com.cloudferry.orchestrator.scheduler.SchedulerException;
import com.cloudferry.orchestrator.scheduler.TaskDetails;
import com.cloudferry.orchestrator.scheduler.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Job orchestrator: create, retry, cancel.
 *
 * Each operation locks the Job row (SELECT FOR UPDATE), validates, talks to
 * the handlers and records the transition in one transaction. Work that must
 * only happen once that transaction has committed (publishing the creation
 * event, the automatic refund after a cancel) runs afterwards, outside it,
 * which is why this class drives transactions with a TransactionTemplate
 * instead of @Transactional.
 *
 * Expected failures come back as {@link OperationResult}; nothing a user can
 * trigger is thrown.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository             jobRepo;
    private final RequestedSourceRepository sourceRepo;
    private final StorageProfileRepository  profileRepo;
    private final InvoiceRepository         invoiceRepo;
    private final JobStatusService          statusService;
    private final RefundService             refundService;
    private final HandlerRegistry           handlers;
    private final ExternalSchedulerQuery    scheduler;
    private final DispatchLog               dispatchLog;
    private final TransactionTemplate       tx;

    public JobService(JobRepository jobRepo,
                      RequestedSourceRepository sourceRepo,
                      StorageProfileRepository profileRepo,
                      InvoiceRepository invoiceRepo,
                      JobStatusService statusService,
                      RefundService refundService,
                      HandlerRegistry handlers,
                      ExternalSchedulerQuery scheduler,
                      DispatchLog dispatchLog,
                      PlatformTransactionManager txManager) {
        this.jobRepo       = jobRepo;
        this.sourceRepo    = sourceRepo;
        this.profileRepo   = profileRepo;
        this.invoiceRepo   = invoiceRepo;
        this.statusService = statusService;
        this.refundService = refundService;
        this.handlers      = handlers;
        this.scheduler     = scheduler;
        this.dispatchLog   = dispatchLog;
        this.tx            = new TransactionTemplate(txManager);
    }

    // ------------------------------------------------------------------
    // Create
    // ------------------------------------------------------------------

    /**
     * Create a Job for a ready source and hand its fetch phase to the scheduler.
     *
     * Steps:
     *  1. Validate the source (owned, READY)
     *  2. Refuse if the owner already has a live Job for that source
     *  3. Resolve the destination (explicit, or the owner's default)
     *  4. Save Job (QUEUED) + initial timeline entry, enqueue the fetch
     *  5. After commit, publish the creation event (advisory only)
     */
    public OperationResult<JobCreationResult> createAndDispatch(UUID sourceId,
                                                                Long ownerId,
                                                                UUID destinationId,
                                                                List<String> selectedPaths) {
        OperationResult<Job> created;
        try {
            created = tx.execute(status -> create(sourceId, ownerId, destinationId, selectedPaths));
        } catch (DataIntegrityViolationException e) {
            // Lost the race against a concurrent create; the partial unique index caught it.
            log.info("Duplicate job for source {} (owner={}) rejected by the database", sourceId, ownerId);
            return OperationResult.fail(JobErrorCode.JOB_ALREADY_EXISTS, "A job for this source is already in progress");
        } catch (SchedulerException e) {
            log.warn("Scheduler unavailable while creating job for source {}: {}", sourceId, e.getMessage());
            return OperationResult.fail(JobErrorCode.SCHEDULER_UNAVAILABLE, "Scheduler unavailable, try again later");
        }
        if (!created.isSuccess()) {
            return created.asFailure();
        }

        Job job = created.value();
        publishCreated(job);
        return OperationResult.ok(new JobCreationResult(job.getId(), job.getStorageProfile().getId()));
    }

    private OperationResult<Job> create(UUID sourceId, Long ownerId, UUID destinationId, List<String> selectedPaths) {
        Optional<RequestedSource> foundSource = sourceRepo.findByIdAndOwnerId(sourceId, ownerId);
        if (foundSource.isEmpty()) {
            return OperationResult.fail(JobErrorCode.SOURCE_NOT_FOUND, "Source " + sourceId + " not found");
        }
        RequestedSource source = foundSource.get();
        if (!source.isReady()) {
            return OperationResult.fail(JobErrorCode.SOURCE_NOT_READY,
                    "Source " + sourceId + " is " + source.getStatus());
        }

        JobTypeHandler handler = handlers.jobType(source.getJobType());
        Optional<Job> live = jobRepo.findBySourceAndOwnerInStatuses(sourceId, ownerId, JobStatus.activeStatuses())
                .stream()
                .filter(j -> !handler.failedStatuses().contains(j.getStatus()))
                .findFirst();
        if (live.isPresent()) {
            Job existing = live.get();
            if (existing.getStatus().isRetrying()) {
                return OperationResult.fail(JobErrorCode.JOB_RETRYING,
                        "Job " + existing.getId() + " for this source is retrying"
                                + (existing.getNextRetryAt() != null ? ", next attempt at " + existing.getNextRetryAt() : ""));
            }
            return OperationResult.fail(JobErrorCode.JOB_ALREADY_EXISTS,
                    "Job " + existing.getId() + " for this source is already " + existing.getStatus());
        }

        Optional<StorageProfile> destination = destinationId != null
                ? profileRepo.findById(destinationId).filter(p -> p.isUsableBy(ownerId))
                : profileRepo.findFirstByOwnerIdAndDefaultProfileTrueAndActiveTrue(ownerId);
        if (destination.isEmpty()) {
            return OperationResult.fail(JobErrorCode.NO_DESTINATION,
                    destinationId != null ? "Destination " + destinationId + " is not available"
                                          : "No active default destination configured");
        }

        Job job = new Job(ownerId, source, destination.get(), source.getJobType());
        job.setSelectedPaths(selectedPaths);
        job = jobRepo.saveAndFlush(job);
        statusService.recordInitial(job, Metadata.of(
                "destinationId", destination.get().getId(),
                "provider", destination.get().getProviderType(),
                "sourceId", sourceId,
                "selectedCount", job.getSelectedPaths().size()));

        String handle = handler.enqueueFetch(job.getId());
        job.setFetchHandle(handle);
        jobRepo.save(job);

        log.info("Created job {} for source {} (owner={}, fetch={})", job.getId(), sourceId, ownerId, handle);
        return OperationResult.ok(job);
    }

    private void publishCreated(Job job) {
        try {
            dispatchLog.publish(DispatchLog.JOBS_STREAM, Map.of(
                    "jobId",     job.getId().toString(),
                    "ownerId",   String.valueOf(job.getOwnerId()),
                    "jobType",   job.getType().name(),
                    "createdAt", job.getCreatedAt().toString()));
        } catch (RuntimeException e) {
            // The fetch task is already queued; the stream entry only speeds up dispatch.
            log.warn("Could not publish creation of job {}: {}", job.getId(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Retry
    // ------------------------------------------------------------------

    /**
     * Resume a Job that ended in a failure status.
     *
     * A Job that failed while pushing resumes the push; anything else
     * restarts from the fetch. The Job lands on FETCH_RETRY or PUSH_RETRY,
     * which are active, so a second concurrent retry sees JOB_ACTIVE.
     */
    public OperationResult<JobActionResult> retry(UUID jobId, Actor actor, String reason) {
        try {
            return tx.execute(status -> retryLocked(jobId, actor, reason));
        } catch (DataIntegrityViolationException e) {
            // A live Job for the same source slipped in between the check and the commit.
            log.info("Retry of job {} rejected by the database: another job for its source is live", jobId);
            return OperationResult.fail(JobErrorCode.JOB_ALREADY_EXISTS, "A job for this source is already in progress");
        } catch (SchedulerException e) {
            log.warn("Scheduler unavailable while retrying job {}: {}", jobId, e.getMessage());
            return OperationResult.fail(JobErrorCode.SCHEDULER_UNAVAILABLE, "Scheduler unavailable, try again later");
        }
    }

    private OperationResult<JobActionResult> retryLocked(UUID jobId, Actor actor, String reason) {
        OperationResult<Job> found = lockForActor(jobId, actor);
        if (!found.isSuccess()) {
            return found.asFailure();
        }
        Job job = found.value();
        JobStatus previous = job.getStatus();

        if (previous.isCompleted()) {
            return OperationResult.fail(JobErrorCode.JOB_COMPLETED, "Job " + jobId + " already completed");
        }
        if (previous.isCancelled()) {
            return OperationResult.fail(JobErrorCode.JOB_CANCELLED, "Job " + jobId + " was cancelled");
        }
        if (job.isRefunded()) {
            return OperationResult.fail(JobErrorCode.JOB_REFUNDED, "Job " + jobId + " was refunded");
        }
        if (previous.isActive()) {
            return OperationResult.fail(JobErrorCode.JOB_ACTIVE, "Job " + jobId + " is still " + previous);
        }
        StorageProfile destination = job.getStorageProfile();
        if (destination == null || !destination.isActive()) {
            return OperationResult.fail(JobErrorCode.DESTINATION_INACTIVE, "Destination of job " + jobId + " is not active");
        }
        Optional<Job> other = jobRepo.findBySourceAndOwnerInStatuses(
                        job.getSource().getId(), job.getOwnerId(), JobStatus.activeStatuses())
                .stream()
                .filter(j -> !j.getId().equals(jobId))
                .findFirst();
        if (other.isPresent()) {
            return OperationResult.fail(JobErrorCode.JOB_ALREADY_EXISTS,
                    "Job " + other.get().getId() + " for this source is already " + other.get().getStatus());
        }

        JobTypeHandler handler = handlers.jobType(job.getType());
        boolean resumePush = handler.isPushPhase(previous);
        cancelOutstandingTasks(job);

        String handle;
        JobStatus target;
        if (resumePush) {
            job.setPushHandle(null);
            handle = handlers.storageProvider(destination.getProviderType()).enqueuePush(job.getId());
            job.setPushHandle(handle);
            target = JobStatus.PUSH_RETRY;
        } else {
            if (previous.isFailed()) {
                job.setBytesFetched(0);
                job.setLocalPath(null);
            }
            job.setFetchHandle(null);
            job.setPushHandle(null);
            handle = handler.enqueueFetch(job.getId());
            job.setFetchHandle(handle);
            target = JobStatus.FETCH_RETRY;
        }

        job.clearError();
        job.setNextRetryAt(null);
        job.incrementRetryCount();
        statusService.transition(job, target, actor.source(), null, Metadata.of(
                "retriedFrom", previous,
                "retriedBy", actor.userId(),
                "retriedByRole", actor.role(),
                "reason", reason,
                "handle", handle));

        log.info("Job {} retried from {} by {} {} (attempt {})",
                jobId, previous, actor.role(), actor.userId(), job.getRetryCount());
        return OperationResult.ok(new JobActionResult(jobId, target));
    }

    // ------------------------------------------------------------------
    // Cancel
    // ------------------------------------------------------------------

    /**
     * Cancel a Job that has not reached the push phase.
     *
     * Once the cancellation has committed, workers are told to stop, the
     * destination lock is released and a paid charge is refunded. Each of
     * these is best effort: a failure is logged and leaves the Job CANCELLED.
     */
    public OperationResult<JobActionResult> cancel(UUID jobId, Actor actor, String reason) {
        OperationResult<Job> result = tx.execute(status -> cancelLocked(jobId, actor, reason));
        if (!result.isSuccess()) {
            return result.asFailure();
        }
        Job job = result.value();
        notifyWorkersAfterCancel(job);
        releaseLockAfterCancel(job);
        refundAfterCancel(jobId);
        return OperationResult.ok(new JobActionResult(jobId, JobStatus.CANCELLED));
    }

    private OperationResult<Job> cancelLocked(UUID jobId, Actor actor, String reason) {
        OperationResult<Job> found = lockForActor(jobId, actor);
        if (!found.isSuccess()) {
            return found.asFailure();
        }
        Job job = found.value();
        JobStatus current = job.getStatus();

        if (current.isCompleted()) {
            return OperationResult.fail(JobErrorCode.JOB_COMPLETED, "Job " + jobId + " already completed");
        }
        if (current.isCancelled()) {
            return OperationResult.fail(JobErrorCode.JOB_CANCELLED, "Job " + jobId + " was already cancelled");
        }
        if (handlers.jobType(job.getType()).isPushPhase(current)) {
            return OperationResult.fail(JobErrorCode.JOB_IN_PUSH_PHASE,
                    "Job " + jobId + " is uploading (" + current + ") and can no longer be cancelled");
        }
        if (current.isTerminal()) {
            return OperationResult.fail(JobErrorCode.JOB_NOT_CANCELLABLE, "Job " + jobId + " is " + current);
        }

        cancelOutstandingTasks(job);

        job.setFetchHandle(null);
        job.setPushHandle(null);
        job.setNextRetryAt(null);
        statusService.transition(job, JobStatus.CANCELLED, actor.source(), null, Metadata.of(
                "cancelledFrom", current,
                "cancelledBy", actor.userId(),
                "cancelledByRole", actor.role(),
                "reason", reason));

        log.info("Job {} cancelled from {} by {} {}", jobId, current, actor.role(), actor.userId());
        return OperationResult.ok(job);
    }

    private void notifyWorkersAfterCancel(Job job) {
        try {
            CancellationHandler cancellation = handlers.cancellation(job.getType());
            cancellation.cancel(job);
        } catch (RuntimeException e) {
            log.warn("Cancellation cleanup for job {} failed, workers may keep local data: {}", job.getId(), e.getMessage());
        }
    }

    private void releaseLockAfterCancel(Job job) {
        if (job.getStorageProfile() == null) {
            return;
        }
        try {
            handlers.storageProvider(job.getStorageProfile().getProviderType()).releaseLock(job.getId());
        } catch (RuntimeException e) {
            log.warn("Could not release destination lock of cancelled job {}: {}", job.getId(), e.getMessage());
        }
    }

    private void refundAfterCancel(UUID jobId) {
        try {
            if (invoiceRepo.findFirstByJobIdAndPaidAtIsNotNullAndRefundedAtIsNull(jobId).isEmpty()) {
                return;
            }
            OperationResult<RefundResult> refund = refundService.refund(jobId, Actor.system(), true);
            if (!refund.isSuccess()) {
                log.warn("Automatic refund for cancelled job {} failed: {} {}", jobId, refund.error(), refund.message());
            }
        } catch (RuntimeException e) {
            log.warn("Automatic refund for cancelled job {} failed: {}", jobId, e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    /**
     * Make sure a QUEUED Job has a live fetch task. Safe to call any number
     * of times; Jobs past QUEUED are left alone.
     *
     * @return true if a new fetch task was enqueued
     */
    public OperationResult<Boolean> ensureDispatched(UUID jobId) {
        try {
            return tx.execute(status -> {
                Optional<Job> found = jobRepo.findByIdForUpdate(jobId);
                if (found.isEmpty()) {
                    return OperationResult.<Boolean>fail(JobErrorCode.JOB_NOT_FOUND, "Job " + jobId + " not found");
                }
                Job job = found.get();
                if (job.getStatus() != JobStatus.QUEUED || hasLiveTask(job.getFetchHandle())) {
                    return OperationResult.ok(false);
                }
                String previous = job.getFetchHandle();
                String handle = handlers.jobType(job.getType()).enqueueFetch(jobId);
                job.setFetchHandle(handle);
                statusService.recordEvent(job, StatusChangeSource.SYSTEM, Metadata.of(
                        "redispatched", true,
                        "previousHandle", previous,
                        "handle", handle));
                log.info("Job {} had no live fetch task, enqueued {}", jobId, handle);
                return OperationResult.ok(true);
            });
        } catch (SchedulerException e) {
            log.warn("Scheduler unavailable while dispatching job {}: {}", jobId, e.getMessage());
            return OperationResult.fail(JobErrorCode.SCHEDULER_UNAVAILABLE, "Scheduler unavailable");
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private OperationResult<Job> lockForActor(UUID jobId, Actor actor) {
        Optional<Job> found = jobRepo.findByIdForUpdate(jobId);
        if (found.isEmpty()) {
            return OperationResult.fail(JobErrorCode.JOB_NOT_FOUND, "Job " + jobId + " not found");
        }
        if (!actor.mayActOn(found.get())) {
            return OperationResult.fail(JobErrorCode.UNAUTHORIZED, "Not allowed to act on job " + jobId);
        }
        return OperationResult.ok(found.get());
    }

    private boolean hasLiveTask(String handle) {
        if (handle == null) {
            return false;
        }
        Optional<TaskDetails> details = scheduler.details(handle);
        return details.isPresent()
                && details.get().state() != TaskState.FAILED
                && details.get().state() != TaskState.DELETED;
    }

    /**
     * Best-effort: tasks that already finished or vanished count as cancelled,
     * and a scheduler hiccup here must not block the caller.
     */
    private void cancelOutstandingTasks(Job job) {
        for (String handle : new String[] { job.getFetchHandle(), job.getPushHandle() }) {
            if (handle == null) {
                continue;
            }
            try {
                if (!scheduler.delete(handle)) {
                    log.warn("Scheduler refused to cancel task {} of job {}", handle, job.getId());
                }
            } catch (SchedulerException e) {
                log.warn("Could not cancel task {} of job {}: {}", handle, job.getId(), e.getMessage());
            }
        }
    }
}
