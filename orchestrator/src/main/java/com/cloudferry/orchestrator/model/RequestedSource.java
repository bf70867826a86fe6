package com.cloudferry.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A payload a user asked to transfer (e.g. an analysed torrent).
 *
 * Created and analysed by the intake collaborators; the orchestrator only
 * reads it to decide whether a Job may be created and which JobType to use.
 *
 * DB table: requested_sources
 */
@Entity
@Table(name = "requested_sources")
public class RequestedSource {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false)
    private JobType jobType = JobType.TORRENT;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SourceStatus status = SourceStatus.PENDING;

    @Column(name = "total_bytes", nullable = false)
    private long totalBytes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected RequestedSource() {}   // required by JPA

    public RequestedSource(Long ownerId, String displayName, JobType jobType, long totalBytes) {
        this.ownerId     = ownerId;
        this.displayName = displayName;
        this.jobType     = jobType;
        this.totalBytes  = totalBytes;
    }

    public UUID         getId()          { return id; }
    public Long         getOwnerId()     { return ownerId; }
    public String       getDisplayName() { return displayName; }
    public JobType      getJobType()     { return jobType; }
    public SourceStatus getStatus()      { return status; }
    public long         getTotalBytes()  { return totalBytes; }
    public Instant      getCreatedAt()   { return createdAt; }

    public void setStatus(SourceStatus status) { this.status = status; }

    public boolean isReady() {
        return status == SourceStatus.READY;
    }
}
