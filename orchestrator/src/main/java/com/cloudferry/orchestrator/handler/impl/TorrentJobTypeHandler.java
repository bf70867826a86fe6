package com.cloudferry.orchestrator.handler.impl;

import com.cloudferry.orchestrator.handler.JobTypeHandler;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.JobType;
import com.cloudferry.orchestrator.model.Phase;
import com.cloudferry.orchestrator.scheduler.TaskKind;
import com.cloudferry.orchestrator.scheduler.TaskQueue;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Torrent downloads: the fetch task downloads and stages in one run.
 */
@Component
public class TorrentJobTypeHandler implements JobTypeHandler {

    private static final Set<JobStatus> FAILED = EnumSet.of(
            JobStatus.FETCH_FAILED,
            JobStatus.STAGE_FAILED,
            JobStatus.PUSH_FAILED,
            JobStatus.FAILED
    );

    private final TaskQueue taskQueue;

    public TorrentJobTypeHandler(TaskQueue taskQueue) {
        this.taskQueue = taskQueue;
    }

    @Override
    public JobType type() {
        return JobType.TORRENT;
    }

    @Override
    public String enqueueFetch(UUID jobId) {
        return taskQueue.enqueue(jobId, TaskKind.FETCH, type().name());
    }

    @Override
    public Set<JobStatus> failedStatuses() {
        return FAILED;
    }

    @Override
    public boolean isPushPhase(JobStatus status) {
        return status.phase() == Phase.PUSH;
    }
}
