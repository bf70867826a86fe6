package com.cloudferry.orchestrator.repository;

import com.cloudferry.orchestrator.model.JobStatusHistory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only access to the job_status_history table.
 * Nothing here updates or deletes a row.
 */
public interface JobStatusHistoryRepository extends JpaRepository<JobStatusHistory, UUID> {

    List<JobStatusHistory> findByJobIdOrderByChangedAtAsc(UUID jobId);

    Page<JobStatusHistory> findByJobIdOrderByChangedAtAsc(UUID jobId, Pageable pageable);

    /** The entry just before {@code changedAt}, used for the first row of a page. */
    Optional<JobStatusHistory> findFirstByJobIdAndChangedAtBeforeOrderByChangedAtDesc(UUID jobId, Instant changedAt);
}
