package com.cloudferry.orchestrator.scheduler;

/**
 * Execution state of a single {@link ScheduledTask}.
 *
 * Transitions:
 *   ENQUEUED   → PROCESSING (claimed by a worker)
 *   PROCESSING → SUCCEEDED  (worker reported completion)
 *   PROCESSING → ENQUEUED   (worker reported failure, attempts remain)
 *   PROCESSING → FAILED     (attempts exhausted)
 *   any non-terminal → DELETED (cancelled by the orchestrator)
 */
public enum TaskState {
    ENQUEUED,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    DELETED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == DELETED;
    }
}
