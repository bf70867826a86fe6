package com.cloudferry.orchestrator.repository;

import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.JobType;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + lifecycle queries for the jobs table.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Load a Job and hold its row lock until the surrounding transaction ends.
     * Every orchestrator mutation goes through here so two transitions for
     * the same Job never interleave.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    /** Non-terminal Jobs for one (owner, source) pair, newest first. */
    @Query("""
            SELECT j FROM Job j
            WHERE j.ownerId = :ownerId
              AND j.source.id = :sourceId
              AND j.status IN :statuses
            ORDER BY j.createdAt DESC
            """)
    List<Job> findBySourceAndOwnerInStatuses(@Param("sourceId") UUID sourceId,
                                             @Param("ownerId") Long ownerId,
                                             @Param("statuses") Collection<JobStatus> statuses);

    /**
     * Jobs of one type with no sign of life since {@code cutoff}: heartbeat,
     * startedAt and the last status change are all older (or unset). A Job
     * with none of the three is judged by createdAt.
     */
    @Query("""
            SELECT j FROM Job j
            WHERE j.type = :type
              AND j.status IN :statuses
              AND (j.lastHeartbeat IS NULL OR j.lastHeartbeat < :cutoff)
              AND (j.startedAt IS NULL OR j.startedAt < :cutoff)
              AND (j.lastTransitionAt IS NULL OR j.lastTransitionAt < :cutoff)
              AND (j.lastHeartbeat IS NOT NULL OR j.startedAt IS NOT NULL
                OR j.lastTransitionAt IS NOT NULL OR j.createdAt < :cutoff)
            ORDER BY j.createdAt ASC
            """)
    List<Job> findStale(@Param("type") JobType type,
                        @Param("statuses") Collection<JobStatus> statuses,
                        @Param("cutoff") Instant cutoff);

    /**
     * Heartbeat write by the worker holding {@code handle}. The handle must be
     * the push handle while the Job is in {@code pushPhase} and the fetch handle
     * otherwise. Returns 0 when the handle is not current or the Job is no
     * longer active; status is never touched.
     */
    @Modifying
    @Query("""
            UPDATE Job j
            SET j.lastHeartbeat = :now,
                j.currentState = COALESCE(:state, j.currentState)
            WHERE j.id = :id
              AND ((j.status IN :pushPhase AND j.pushHandle = :handle)
                OR (j.status NOT IN :pushPhase AND j.fetchHandle = :handle))
              AND j.status IN :active
            """)
    int touchHeartbeat(@Param("id") UUID id,
                       @Param("handle") String handle,
                       @Param("state") String state,
                       @Param("now") Instant now,
                       @Param("active") Collection<JobStatus> active,
                       @Param("pushPhase") Collection<JobStatus> pushPhase);

    /** Progress write; same ownership guard as {@link #touchHeartbeat}. */
    @Modifying
    @Query("""
            UPDATE Job j
            SET j.bytesFetched = :bytes,
                j.totalBytes = COALESCE(:totalBytes, j.totalBytes),
                j.lastHeartbeat = :now
            WHERE j.id = :id
              AND ((j.status IN :pushPhase AND j.pushHandle = :handle)
                OR (j.status NOT IN :pushPhase AND j.fetchHandle = :handle))
              AND j.status IN :active
            """)
    int updateProgress(@Param("id") UUID id,
                       @Param("handle") String handle,
                       @Param("bytes") long bytes,
                       @Param("totalBytes") Long totalBytes,
                       @Param("now") Instant now,
                       @Param("active") Collection<JobStatus> active,
                       @Param("pushPhase") Collection<JobStatus> pushPhase);

    Page<Job> findByOwnerId(Long ownerId, Pageable pageable);

    Page<Job> findByOwnerIdAndStatus(Long ownerId, JobStatus status, Pageable pageable);

    /** One row per status the owner has at least one Job in. */
    @Query("""
            SELECT j.status AS status, COUNT(j) AS total
            FROM Job j
            WHERE j.ownerId = :ownerId
            GROUP BY j.status
            """)
    List<StatusCountRow> countByStatusForOwner(@Param("ownerId") Long ownerId);

    interface StatusCountRow {
        JobStatus getStatus();
        Long      getTotal();
    }
}
