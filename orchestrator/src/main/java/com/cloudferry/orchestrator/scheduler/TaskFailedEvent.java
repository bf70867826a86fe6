package com.cloudferry.orchestrator.scheduler;

import java.util.UUID;

/** Published once a task has used up its attempts. */
public record TaskFailedEvent(String handle, UUID jobId, TaskKind kind, String error) {}
