package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.model.JobStatus;

import java.util.List;
import java.util.Map;

/**
 * Per-owner counts. statusFilters lists only statuses with at least one
 * Job, most common first, for building filter chips.
 */
public record JobStatistics(
        long total,
        long active,
        long completed,
        long failed,
        long retrying,
        long cancelled,
        Map<JobStatus, Long> byStatus,
        List<StatusCount> statusFilters
) {
    public record StatusCount(JobStatus status, long count) {}
}
