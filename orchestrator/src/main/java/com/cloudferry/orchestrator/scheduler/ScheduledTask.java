package com.cloudferry.orchestrator.scheduler;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit of background work for a Job.
 *
 * The id doubles as the opaque handle stored on the Job. Workers claim an
 * ENQUEUED task via SELECT FOR UPDATE SKIP LOCKED, set state = PROCESSING
 * and worker_id, and later report completion or failure through TaskQueue.
 *
 * DB table: scheduled_tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "scheduled_tasks")
public class ScheduledTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TaskKind kind;

    // Job type name for fetch tasks, provider type name for push tasks.
    @Column(nullable = false, updatable = false)
    private String target;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskState state = TaskState.ENQUEUED;

    // How many times this task has failed so far (starts at 0).
    @Column(nullable = false)
    private int attempt = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    // Null unless state = PROCESSING.
    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // Not claimable before this instant; pushed forward by retry backoff.
    @Column(name = "next_run_at", nullable = false)
    private Instant nextRunAt = createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ScheduledTask() {}   // required by JPA

    public ScheduledTask(UUID jobId, TaskKind kind, String target, int maxAttempts) {
        this.jobId       = jobId;
        this.kind        = kind;
        this.target      = target;
        this.maxAttempts = maxAttempts;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()          { return id; }
    public String    getHandle()      { return id == null ? null : id.toString(); }
    public UUID      getJobId()       { return jobId; }
    public TaskKind  getKind()        { return kind; }
    public String    getTarget()      { return target; }
    public TaskState getState()       { return state; }
    public int       getAttempt()     { return attempt; }
    public int       getMaxAttempts() { return maxAttempts; }
    public String    getWorkerId()    { return workerId; }
    public String    getLastError()   { return lastError; }
    public Instant   getCreatedAt()   { return createdAt; }
    public Instant   getNextRunAt()   { return nextRunAt; }
    public Instant   getStartedAt()   { return startedAt; }
    public Instant   getFinishedAt()  { return finishedAt; }

    public void setState(TaskState state)       { this.state = state; }
    public void setWorkerId(String workerId)    { this.workerId = workerId; }
    public void setLastError(String lastError)  { this.lastError = lastError; }
    public void setNextRunAt(Instant t)         { this.nextRunAt = t; }
    public void setStartedAt(Instant t)         { this.startedAt = t; }
    public void setFinishedAt(Instant t)        { this.finishedAt = t; }
    public void incrementAttempt()              { this.attempt++; }

    public boolean hasAttemptsLeft() {
        return attempt < maxAttempts;
    }

    public TaskDetails toDetails() {
        return new TaskDetails(getHandle(), jobId, kind, target, state, attempt, lastError, nextRunAt, startedAt);
    }
}
