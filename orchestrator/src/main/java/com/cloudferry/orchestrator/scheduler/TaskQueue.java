package com.cloudferry.orchestrator.scheduler;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database-backed task scheduler.
 *
 * The DB is the queue: SELECT FOR UPDATE SKIP LOCKED is the dequeue, so any
 * number of workers on any number of hosts can claim concurrently without
 * taking the same task twice. Delivery is at-least-once: a worker that dies
 * after claiming leaves the task PROCESSING until the Job's recovery monitor
 * enqueues a replacement.
 *
 * Failure handling mirrors a classic job scheduler: a failed attempt goes back
 * to ENQUEUED with growing backoff; the last allowed failure marks the task
 * FAILED and raises a {@link TaskFailedEvent}.
 */
@Service
public class TaskQueue implements ExternalSchedulerQuery {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    // Delay before attempt n+1, indexed by failures so far (1-based); the last one repeats.
    private static final List<Duration> BACKOFF = List.of(
            Duration.ofSeconds(60),
            Duration.ofSeconds(300),
            Duration.ofSeconds(900)
    );

    private final ScheduledTaskRepository    taskRepo;
    private final ApplicationEventPublisher  events;
    private final MeterRegistry              meterRegistry;
    private final int                        maxAttempts;

    public TaskQueue(ScheduledTaskRepository taskRepo,
                     ApplicationEventPublisher events,
                     MeterRegistry meterRegistry,
                     @Value("${cloudferry.scheduler.max-attempts:3}") int maxAttempts) {
        this.taskRepo      = taskRepo;
        this.events        = events;
        this.meterRegistry = meterRegistry;
        this.maxAttempts   = maxAttempts;
    }

    // ------------------------------------------------------------------
    // Producer side
    // ------------------------------------------------------------------

    /**
     * Queue a new task and return its handle. Joins the caller's transaction,
     * so the task only becomes visible if the caller commits.
     *
     * @throws SchedulerException if the task store is unavailable
     */
    @Transactional
    public String enqueue(UUID jobId, TaskKind kind, String target) {
        try {
            ScheduledTask task = taskRepo.save(new ScheduledTask(jobId, kind, target, maxAttempts));
            meterRegistry.counter("cloudferry.tasks.enqueued", "kind", kind.name()).increment();
            log.info("Enqueued {} task {} for job {} (target={})", kind, task.getHandle(), jobId, target);
            return task.getHandle();
        } catch (DataAccessException e) {
            throw new SchedulerException("Could not enqueue " + kind + " task for job " + jobId, e);
        }
    }

    // ------------------------------------------------------------------
    // Worker side
    // ------------------------------------------------------------------

    /**
     * Claim the next due task of one of {@code kinds}.
     *
     * The whole method is @Transactional: the row lock is held from the SELECT
     * until the UPDATE (state = PROCESSING) commits.
     */
    @Transactional
    public Optional<TaskDetails> claimNext(String workerId, Collection<TaskKind> kinds) {
        Optional<ScheduledTask> opt = taskRepo.claimNext(kinds, Instant.now());
        return opt.map(task -> {
            task.setState(TaskState.PROCESSING);
            task.setWorkerId(workerId);
            task.setStartedAt(Instant.now());
            taskRepo.save(task);
            log.info("Worker '{}' claimed {} task {} (job={}, attempt={})",
                    workerId, task.getKind(), task.getHandle(), task.getJobId(), task.getAttempt() + 1);
            return task.toDetails();
        });
    }

    /** Mark a PROCESSING task SUCCEEDED. Returns false if the task is not PROCESSING. */
    @Transactional
    public boolean complete(String handle) {
        Optional<ScheduledTask> opt = findForUpdate(handle);
        if (opt.isEmpty() || opt.get().getState() != TaskState.PROCESSING) {
            log.warn("Ignoring completion of task {}: not processing", handle);
            return false;
        }
        ScheduledTask task = opt.get();
        task.setState(TaskState.SUCCEEDED);
        task.setFinishedAt(Instant.now());
        task.setWorkerId(null);
        taskRepo.save(task);
        meterRegistry.counter("cloudferry.tasks.finished",
                "kind", task.getKind().name(), "outcome", "succeeded").increment();
        log.info("Task {} succeeded (job={})", handle, task.getJobId());
        return true;
    }

    /**
     * Record a failed attempt.
     *
     * If the task has been attempted fewer than max-attempts times, put it
     * back to ENQUEUED behind a backoff delay. Otherwise mark it FAILED.
     * Listeners receive the matching event after this transaction commits.
     *
     * @return false if the task is not PROCESSING
     */
    @Transactional
    public boolean fail(String handle, String error) {
        Optional<ScheduledTask> opt = findForUpdate(handle);
        if (opt.isEmpty() || opt.get().getState() != TaskState.PROCESSING) {
            log.warn("Ignoring failure of task {}: not processing", handle);
            return false;
        }
        ScheduledTask task = opt.get();
        task.incrementAttempt();
        task.setLastError(error);
        task.setWorkerId(null);

        if (task.hasAttemptsLeft()) {
            Instant nextRunAt = Instant.now().plus(backoffFor(task.getAttempt()));
            task.setState(TaskState.ENQUEUED);
            task.setNextRunAt(nextRunAt);
            task.setStartedAt(null);
            taskRepo.save(task);
            log.warn("Task {} failed (attempt {}/{}), will retry at {}. Reason: {}",
                    handle, task.getAttempt(), task.getMaxAttempts(), nextRunAt, error);
            events.publishEvent(new TaskRetryScheduledEvent(
                    handle, task.getJobId(), task.getKind(), error, task.getAttempt(), nextRunAt));
        } else {
            task.setState(TaskState.FAILED);
            task.setFinishedAt(Instant.now());
            taskRepo.save(task);
            meterRegistry.counter("cloudferry.tasks.finished",
                    "kind", task.getKind().name(), "outcome", "failed").increment();
            log.error("Task {} permanently failed after {} attempts (job={}). Reason: {}",
                    handle, task.getAttempt(), task.getJobId(), error);
            events.publishEvent(new TaskFailedEvent(handle, task.getJobId(), task.getKind(), error));
        }
        return true;
    }

    // ------------------------------------------------------------------
    // ExternalSchedulerQuery
    // ------------------------------------------------------------------

    // Callers treat scheduler errors as best-effort and keep their own transaction.
    @Override
    @Transactional(readOnly = true, noRollbackFor = SchedulerException.class)
    public Optional<TaskDetails> details(String handle) {
        UUID id = parse(handle);
        if (id == null) {
            return Optional.empty();
        }
        try {
            return taskRepo.findById(id).map(ScheduledTask::toDetails);
        } catch (DataAccessException e) {
            throw new SchedulerException("Could not read task " + handle, e);
        }
    }

    @Override
    @Transactional(noRollbackFor = SchedulerException.class)
    public boolean delete(String handle) {
        try {
            Optional<ScheduledTask> opt = findForUpdate(handle);
            if (opt.isEmpty()) {
                return true;   // gone already
            }
            ScheduledTask task = opt.get();
            if (task.getState().isTerminal()) {
                return true;
            }
            task.setState(TaskState.DELETED);
            task.setFinishedAt(Instant.now());
            task.setWorkerId(null);
            taskRepo.save(task);
            log.info("Deleted task {} (job={})", handle, task.getJobId());
            return true;
        } catch (DataAccessException e) {
            throw new SchedulerException("Could not delete task " + handle, e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static Duration backoffFor(int failures) {
        int idx = Math.min(Math.max(failures, 1), BACKOFF.size()) - 1;
        return BACKOFF.get(idx);
    }

    private Optional<ScheduledTask> findForUpdate(String handle) {
        UUID id = parse(handle);
        return id == null ? Optional.empty() : taskRepo.findByIdForUpdate(id);
    }

    private static UUID parse(String handle) {
        if (handle == null || handle.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(handle);
        } catch (IllegalArgumentException e) {
            log.debug("Handle '{}' is not a task id", handle);
            return null;
        }
    }
}
