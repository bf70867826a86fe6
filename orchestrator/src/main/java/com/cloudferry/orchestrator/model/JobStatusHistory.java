package com.cloudferry.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One entry of a Job's timeline.
 *
 * Rows are append-only: no setters, never updated or deleted. Ordered by
 * changedAt they replay the full life of a Job.
 *
 * DB table: job_status_history  (indexed by job_id, changed_at)
 */
@Entity
@Table(name = "job_status_history")
public class JobStatusHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    // Null only for the first entry of a Job.
    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", updatable = false)
    private JobStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, updatable = false)
    private JobStatus toStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private StatusChangeSource source;

    @Column(name = "error_message", columnDefinition = "TEXT", updatable = false)
    private String errorMessage;

    // Actor, handles, retry origin... serialized by JobStatusService.
    @Column(name = "metadata_json", columnDefinition = "TEXT", updatable = false)
    private String metadataJson;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private Instant changedAt;

    protected JobStatusHistory() {}   // required by JPA

    public JobStatusHistory(UUID jobId,
                            JobStatus fromStatus,
                            JobStatus toStatus,
                            StatusChangeSource source,
                            String errorMessage,
                            String metadataJson,
                            Instant changedAt) {
        this.jobId        = jobId;
        this.fromStatus   = fromStatus;
        this.toStatus     = toStatus;
        this.source       = source;
        this.errorMessage = errorMessage;
        this.metadataJson = metadataJson;
        this.changedAt    = changedAt;
    }

    public UUID               getId()           { return id; }
    public UUID               getJobId()        { return jobId; }
    public JobStatus          getFromStatus()   { return fromStatus; }
    public JobStatus          getToStatus()     { return toStatus; }
    public StatusChangeSource getSource()       { return source; }
    public String             getErrorMessage() { return errorMessage; }
    public String             getMetadataJson() { return metadataJson; }
    public Instant            getChangedAt()    { return changedAt; }
}
