package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.JobType;
import com.cloudferry.orchestrator.model.Phase;
import com.cloudferry.orchestrator.model.StorageProfile;
import com.cloudferry.orchestrator.model.StorageProviderType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read projection of a Job with derived flags. The timeline is only filled
 * for single-job reads; list reads leave it empty.
 */
public record JobView(
        UUID id,
        Long ownerId,
        JobType type,
        JobStatus status,
        Phase phase,
        UUID sourceId,
        String sourceName,
        UUID destinationId,
        String destinationName,
        StorageProviderType providerType,
        List<String> selectedPaths,
        long bytesFetched,
        long totalBytes,
        double progressPercentage,
        String currentState,
        String errorMessage,
        int retryCount,
        Instant nextRetryAt,
        boolean refunded,
        Instant lastHeartbeat,
        Instant startedAt,
        Instant completedAt,
        Instant createdAt,
        Instant updatedAt,
        boolean active,
        boolean completed,
        boolean failed,
        boolean retrying,
        List<TimelineEntryView> timeline
) {

    public static JobView of(Job job, List<TimelineEntryView> timeline) {
        StorageProfile dest = job.getStorageProfile();
        JobStatus status = job.getStatus();
        return new JobView(
                job.getId(),
                job.getOwnerId(),
                job.getType(),
                status,
                status.phase(),
                job.getSource().getId(),
                job.getSource().getDisplayName(),
                dest == null ? null : dest.getId(),
                dest == null ? null : dest.getName(),
                dest == null ? null : dest.getProviderType(),
                List.copyOf(job.getSelectedPaths()),
                job.getBytesFetched(),
                job.getTotalBytes(),
                progress(job.getBytesFetched(), job.getTotalBytes()),
                job.getCurrentState(),
                job.getErrorMessage(),
                job.getRetryCount(),
                job.getNextRetryAt(),
                job.isRefunded(),
                job.getLastHeartbeat(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                status.isActive(),
                status.isCompleted(),
                status.isFailed(),
                status.isRetrying(),
                timeline
        );
    }

    // Two decimals; 0 while the total is unknown.
    static double progress(long bytes, long total) {
        if (total <= 0) {
            return 0.0;
        }
        double pct = Math.min(100.0, bytes * 100.0 / total);
        return Math.round(pct * 100.0) / 100.0;
    }
}
