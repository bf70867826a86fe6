package com.cloudferry.orchestrator.scheduler;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + claim query for the scheduled_tasks table.
 */
public interface ScheduledTaskRepository extends JpaRepository<ScheduledTask, UUID> {

    /**
     * Claim the oldest due ENQUEUED task of one of the given kinds.
     *
     * SELECT FOR UPDATE SKIP LOCKED means:
     *   - FOR UPDATE  : lock the row so no other transaction can see it as ENQUEUED
     *   - SKIP LOCKED : if the row is already locked by another worker, skip it
     *                   and try the next one. The lock timeout hint of -2 is how
     *                   Hibernate spells SKIP LOCKED.
     *
     * Must run inside a transaction; the caller sets state = PROCESSING
     * before it commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT t FROM ScheduledTask t
            WHERE t.state = com.cloudferry.orchestrator.scheduler.TaskState.ENQUEUED
              AND t.kind IN :kinds
              AND t.nextRunAt <= :now
            ORDER BY t.nextRunAt ASC
            LIMIT 1
            """)
    Optional<ScheduledTask> claimNext(@Param("kinds") Collection<TaskKind> kinds,
                                      @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM ScheduledTask t WHERE t.id = :id")
    Optional<ScheduledTask> findByIdForUpdate(@Param("id") UUID id);
}
