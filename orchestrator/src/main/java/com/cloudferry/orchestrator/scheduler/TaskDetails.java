package com.cloudferry.orchestrator.scheduler;

import java.time.Instant;
import java.util.UUID;

/** Read-only snapshot of a task, as seen by the orchestrator and workers. */
public record TaskDetails(
        String handle,
        UUID jobId,
        TaskKind kind,
        String target,
        TaskState state,
        int attempt,
        String lastError,
        Instant nextRunAt,
        Instant startedAt
) {}
