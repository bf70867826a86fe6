package com.cloudferry.orchestrator.api.dto;

import com.cloudferry.orchestrator.scheduler.TaskKind;

import java.util.List;

/**
 * Request body for POST /worker/tasks/claim.
 * kinds defaults to every kind when omitted.
 */
public record ClaimTaskRequest(String workerId, List<TaskKind> kinds) {

    public ClaimTaskRequest {
        if (kinds == null || kinds.isEmpty()) kinds = List.of(TaskKind.values());
    }
}
