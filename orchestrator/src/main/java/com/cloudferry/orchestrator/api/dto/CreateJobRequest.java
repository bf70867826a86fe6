package com.cloudferry.orchestrator.api.dto;

import java.util.List;
import java.util.UUID;

/**
 * Request body for POST /jobs.
 *
 * Required: sourceId
 * Optional: destinationId (defaults to the caller's default storage profile),
 *   selectedPaths (subset of the source to transfer; empty means everything)
 */
public record CreateJobRequest(UUID sourceId, UUID destinationId, List<String> selectedPaths) {

    public CreateJobRequest {
        if (selectedPaths == null) selectedPaths = List.of();
    }
}
