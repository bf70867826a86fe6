package com.cloudferry.orchestrator.scheduler;

import java.time.Instant;
import java.util.UUID;

/** Published when a failed task goes back to the queue for another attempt. */
public record TaskRetryScheduledEvent(String handle, UUID jobId, TaskKind kind, String error,
                                      int attempt, Instant nextRunAt) {}
