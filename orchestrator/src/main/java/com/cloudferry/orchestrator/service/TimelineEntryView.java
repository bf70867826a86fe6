package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.StatusChangeSource;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One timeline entry as returned to callers.
 * durationFromPrevious is null for the very first entry of a Job.
 */
public record TimelineEntryView(
        UUID id,
        JobStatus fromStatus,
        JobStatus toStatus,
        StatusChangeSource source,
        String errorMessage,
        JsonNode metadata,
        Instant changedAt,
        Duration durationFromPrevious
) {}
