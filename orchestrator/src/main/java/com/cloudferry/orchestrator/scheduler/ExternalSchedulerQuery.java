package com.cloudferry.orchestrator.scheduler;

import java.util.Optional;

/**
 * What the orchestrator may ask of the scheduler about a handle it holds.
 *
 * Injected wherever task state is needed so the monitor and the orchestrator
 * never reach the scheduler's storage directly.
 */
public interface ExternalSchedulerQuery {

    /** Current state of the task, or empty when the handle is unknown. */
    Optional<TaskDetails> details(String handle);

    /**
     * Cancel the task. Already finished or unknown handles count as success.
     *
     * @return false only when the task could not be cancelled
     * @throws SchedulerException if the scheduler cannot be reached
     */
    boolean delete(String handle);
}
