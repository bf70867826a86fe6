package com.cloudferry.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One transfer request: fetch a payload, stage it, push it to a destination.
 *
 * The status only changes through {@link #applyTransition}, which the
 * status service calls together with appending a {@link JobStatusHistory}
 * row. Progress fields (heartbeat, bytes) are written by the worker that
 * owns the current task handle via conditional bulk updates.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobType type;

    // Destination. Nullable: a Job may outlive the profile assignment.
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "storage_profile_id")
    private StorageProfile storageProfile;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "source_id", nullable = false)
    private RequestedSource source;

    // Stored as a plain string; the column type is TEXT in Postgres.
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.QUEUED;

    // Scheduler handles, one per phase that runs as a scheduled task.
    @Column(name = "fetch_handle")
    private String fetchHandle;

    @Column(name = "push_handle")
    private String pushHandle;

    // Updated by the owning worker to prove liveness; read by JobHealthMonitor.
    @Column(name = "last_heartbeat")
    private Instant lastHeartbeat;

    @Column(name = "started_at")
    private Instant startedAt;

    // Non-null iff status is terminal.
    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Free-text note from the worker, e.g. "Fetching 3/12 files".
    @Column(name = "current_state")
    private String currentState;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(nullable = false)
    private boolean refunded = false;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "selected_paths", columnDefinition = "jsonb")
    private List<String> selectedPaths = new ArrayList<>();

    @Column(name = "bytes_fetched", nullable = false)
    private long bytesFetched = 0;

    @Column(name = "total_bytes", nullable = false)
    private long totalBytes = 0;

    // Where the staged payload lives between the stage and push phases.
    @Column(name = "local_path")
    private String localPath;

    // Timestamp of the newest timeline entry; keeps the timeline strictly ascending.
    @Column(name = "last_transition_at")
    private Instant lastTransitionAt;

    // Microsecond precision to match the Postgres column.
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Called automatically by JPA before every UPDATE.
    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(Long ownerId, RequestedSource source, StorageProfile storageProfile, JobType type) {
        this.ownerId        = ownerId;
        this.source         = source;
        this.storageProfile = storageProfile;
        this.type           = type;
        this.totalBytes     = source.getTotalBytes();
    }

    // ------------------------------------------------------------------
    // State change
    // ------------------------------------------------------------------

    /**
     * Move to {@code newStatus}. Keeps completedAt in step with the terminal
     * flag. Only the status service should call this, inside the same
     * transaction that appends the timeline entry.
     */
    public void applyTransition(JobStatus newStatus, String error, Instant changedAt) {
        this.status = newStatus;
        if (error != null) {
            this.errorMessage = error;
        }
        this.completedAt      = newStatus.isTerminal() ? changedAt : null;
        this.lastTransitionAt = changedAt;
    }

    /** Record a timeline entry that leaves the status as it is. */
    public void markTimelineAt(Instant changedAt) {
        this.lastTransitionAt = changedAt;
    }

    /** The handle of the task currently responsible for this Job's phase. */
    public String currentHandle() {
        return status.phase() == Phase.PUSH ? pushHandle : fetchHandle;
    }

    /**
     * Whether {@code handle} belongs to the task running the current phase.
     * A fetch handle stops counting once the Job has moved to the push phase.
     */
    public boolean ownsHandle(String handle) {
        return handle != null && handle.equals(currentHandle());
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID            getId()               { return id; }
    public Long            getOwnerId()          { return ownerId; }
    public JobType         getType()             { return type; }
    public StorageProfile  getStorageProfile()   { return storageProfile; }
    public RequestedSource getSource()           { return source; }
    public JobStatus       getStatus()           { return status; }
    public String          getFetchHandle()      { return fetchHandle; }
    public String          getPushHandle()       { return pushHandle; }
    public Instant         getLastHeartbeat()    { return lastHeartbeat; }
    public Instant         getStartedAt()        { return startedAt; }
    public Instant         getCompletedAt()      { return completedAt; }
    public String          getErrorMessage()     { return errorMessage; }
    public String          getCurrentState()     { return currentState; }
    public int             getRetryCount()       { return retryCount; }
    public Instant         getNextRetryAt()      { return nextRetryAt; }
    public boolean         isRefunded()          { return refunded; }
    public List<String>    getSelectedPaths()    { return selectedPaths; }
    public long            getBytesFetched()     { return bytesFetched; }
    public long            getTotalBytes()       { return totalBytes; }
    public String          getLocalPath()        { return localPath; }
    public Instant         getLastTransitionAt() { return lastTransitionAt; }
    public Instant         getCreatedAt()        { return createdAt; }
    public Instant         getUpdatedAt()        { return updatedAt; }

    public void setFetchHandle(String fetchHandle)          { this.fetchHandle = fetchHandle; }
    public void setPushHandle(String pushHandle)            { this.pushHandle = pushHandle; }
    public void setLastHeartbeat(Instant t)                 { this.lastHeartbeat = t; }
    public void setStartedAt(Instant t)                     { this.startedAt = t; }
    public void setCurrentState(String currentState)        { this.currentState = currentState; }
    public void setNextRetryAt(Instant t)                   { this.nextRetryAt = t; }
    public void setRefunded(boolean refunded)               { this.refunded = refunded; }
    public void setBytesFetched(long bytesFetched)          { this.bytesFetched = bytesFetched; }
    public void setTotalBytes(long totalBytes)              { this.totalBytes = totalBytes; }
    public void setLocalPath(String localPath)              { this.localPath = localPath; }
    public void clearError()                                { this.errorMessage = null; }
    public void incrementRetryCount()                       { this.retryCount++; }

    public void setSelectedPaths(List<String> paths) {
        this.selectedPaths = paths == null ? new ArrayList<>() : new ArrayList<>(paths);
    }
}
