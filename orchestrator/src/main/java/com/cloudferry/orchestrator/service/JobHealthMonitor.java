package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.handler.HandlerRegistry;
import com.cloudferry.orchestrator.handler.RecoveryStrategy;
import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.Phase;
import com.cloudferry.orchestrator.model.StatusChangeSource;
import com.cloudferry.orchestrator.repository.JobRepository;
import com.cloudferry.orchestrator.scheduler.ExternalSchedulerQuery;
import com.cloudferry.orchestrator.scheduler.SchedulerException;
import com.cloudferry.orchestrator.scheduler.TaskDetails;
import com.cloudferry.orchestrator.scheduler.TaskState;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Detect and recover Jobs whose worker has silently died.
 *
 * A Job is stale when it sits in one of its strategy's monitored statuses
 * and its latest sign of life (heartbeat, start, last status change) is
 * older than the stale threshold. If its task is still waiting in the
 * queue, or was claimed within the threshold, nothing is done; otherwise
 * the strategy re-enqueues the work and the new handle replaces the old
 * one, so a zombie worker that wakes up finds its handle superseded.
 *
 * Runs once at startup and then every check interval.
 */
@Component
public class JobHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(JobHealthMonitor.class);

    enum Outcome { RECOVERED, SKIPPED, DECLINED }

    private final JobRepository          jobRepo;
    private final HandlerRegistry        handlers;
    private final ExternalSchedulerQuery scheduler;
    private final JobStatusService       statusService;
    private final TransactionTemplate    tx;
    private final MeterRegistry          meterRegistry;
    private final Duration               staleThreshold;

    public JobHealthMonitor(JobRepository jobRepo,
                            HandlerRegistry handlers,
                            ExternalSchedulerQuery scheduler,
                            JobStatusService statusService,
                            PlatformTransactionManager txManager,
                            MeterRegistry meterRegistry,
                            @Value("${cloudferry.recovery.stale-threshold:PT10M}") Duration staleThreshold) {
        this.jobRepo        = jobRepo;
        this.handlers       = handlers;
        this.scheduler      = scheduler;
        this.statusService  = statusService;
        this.tx             = new TransactionTemplate(txManager);
        this.meterRegistry  = meterRegistry;
        this.staleThreshold = staleThreshold;
    }

    @Scheduled(fixedDelayString = "${cloudferry.recovery.check-interval-ms:60000}")
    public void checkStaleJobs() {
        Instant cutoff = Instant.now().minus(staleThreshold);
        int recovered = 0;
        for (RecoveryStrategy strategy : handlers.recoveryStrategies()) {
            List<Job> stale = jobRepo.findStale(strategy.type(), strategy.monitoredStatuses(), cutoff);
            if (!stale.isEmpty()) {
                log.info("Found {} stale {} job(s) older than {}", stale.size(), strategy.type(), cutoff);
            }
            for (Job job : stale) {
                if (recoverOne(job.getId(), strategy, cutoff) == Outcome.RECOVERED) {
                    recovered++;
                }
            }
        }
        if (recovered > 0) {
            log.info("Recovery pass re-enqueued {} job(s)", recovered);
        }
    }

    /** Re-check and recover a single Job in its own transaction. Never throws. */
    Outcome recoverOne(UUID jobId, RecoveryStrategy strategy, Instant cutoff) {
        MDC.put("jobId", jobId.toString());
        try {
            Outcome outcome = tx.execute(status -> recoverLocked(jobId, strategy, cutoff));
            if (outcome == Outcome.RECOVERED) {
                meterRegistry.counter("cloudferry.recovery.recovered", "type", strategy.type().name()).increment();
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Recovery of job {} failed: {}", jobId, e.getMessage(), e);
            return Outcome.SKIPPED;
        } finally {
            MDC.remove("jobId");
        }
    }

    private Outcome recoverLocked(UUID jobId, RecoveryStrategy strategy, Instant cutoff) {
        Optional<Job> found = jobRepo.findByIdForUpdate(jobId);
        if (found.isEmpty()) {
            return Outcome.SKIPPED;
        }
        Job job = found.get();

        // The list was read without a lock; a worker or user may have moved on since.
        if (!strategy.monitoredStatuses().contains(job.getStatus()) || !isStale(job, cutoff)) {
            log.debug("Job {} is no longer stale ({})", jobId, job.getStatus());
            return Outcome.SKIPPED;
        }

        String previous = job.currentHandle();
        Optional<TaskDetails> task = previous == null ? Optional.empty() : scheduler.details(previous);
        if (task.isPresent() && task.get().state() == TaskState.ENQUEUED) {
            log.info("Job {} is stale but task {} is still enqueued, leaving it", jobId, previous);
            return Outcome.SKIPPED;
        }
        if (task.isPresent() && claimedSince(task.get(), cutoff)) {
            log.info("Job {} is stale but task {} was claimed at {}, leaving it",
                    jobId, previous, task.get().startedAt());
            return Outcome.SKIPPED;
        }

        Optional<String> handle = strategy.recover(job);
        if (handle.isEmpty()) {
            log.info("Recovery strategy declined job {} ({})", jobId, job.getStatus());
            return Outcome.DECLINED;
        }

        if (previous != null) {
            try {
                scheduler.delete(previous);
            } catch (SchedulerException e) {
                log.warn("Could not cancel superseded task {} of job {}: {}", previous, jobId, e.getMessage());
            }
        }
        if (job.getStatus().phase() == Phase.PUSH) {
            job.setPushHandle(handle.get());
        } else {
            job.setFetchHandle(handle.get());
        }
        job.clearError();
        statusService.recordEvent(job, StatusChangeSource.SYSTEM, Metadata.of(
                "recovered", true,
                "status", job.getStatus(),
                "lastHeartbeat", job.getLastHeartbeat(),
                "previousHandle", previous,
                "handle", handle.get()));

        log.warn("Recovered stale job {} in {} (last heartbeat {}): {} -> {}",
                jobId, job.getStatus(), job.getLastHeartbeat(), previous, handle.get());
        return Outcome.RECOVERED;
    }

    private static boolean claimedSince(TaskDetails task, Instant cutoff) {
        return task.state() == TaskState.PROCESSING
                && task.startedAt() != null
                && !task.startedAt().isBefore(cutoff);
    }

    static boolean isStale(Job job, Instant cutoff) {
        Instant latest = null;
        for (Instant signal : new Instant[] { job.getLastHeartbeat(), job.getStartedAt(), job.getLastTransitionAt() }) {
            if (signal != null && (latest == null || signal.isAfter(latest))) {
                latest = signal;
            }
        }
        if (latest == null) {
            latest = job.getCreatedAt();
        }
        return latest != null && latest.isBefore(cutoff);
    }
}
