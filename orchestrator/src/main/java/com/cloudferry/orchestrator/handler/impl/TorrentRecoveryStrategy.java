package com.cloudferry.orchestrator.handler.impl;

import com.cloudferry.orchestrator.handler.HandlerRegistry;
import com.cloudferry.orchestrator.handler.RecoveryStrategy;
import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.JobType;
import com.cloudferry.orchestrator.model.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Re-enqueues a stalled torrent Job where it left off: a push for Jobs in
 * the push phase, a fresh fetch otherwise (staging runs inside the fetch task).
 */
@Component
public class TorrentRecoveryStrategy implements RecoveryStrategy {

    private static final Logger log = LoggerFactory.getLogger(TorrentRecoveryStrategy.class);

    // Every active status: a worker can die between claiming a task and its first report.
    private static final Set<JobStatus> MONITORED = EnumSet.of(
            JobStatus.QUEUED,
            JobStatus.FETCH_RETRY,
            JobStatus.FETCHING,
            JobStatus.STAGE_RETRY,
            JobStatus.STAGING,
            JobStatus.PENDING_PUSH,
            JobStatus.PUSH_RETRY,
            JobStatus.PUSHING
    );

    // Lazy: the registry itself is built from the strategy beans.
    private final ObjectProvider<HandlerRegistry> registry;

    public TorrentRecoveryStrategy(ObjectProvider<HandlerRegistry> registry) {
        this.registry = registry;
    }

    @Override
    public JobType type() {
        return JobType.TORRENT;
    }

    @Override
    public Set<JobStatus> monitoredStatuses() {
        return MONITORED;
    }

    @Override
    public Optional<String> recover(Job job) {
        HandlerRegistry handlers = registry.getObject();
        if (job.getStatus().phase() == Phase.PUSH) {
            if (job.getStorageProfile() == null) {
                log.warn("Job {} is in {} without a destination, leaving it", job.getId(), job.getStatus());
                return Optional.empty();
            }
            return Optional.of(handlers.storageProvider(job.getStorageProfile().getProviderType())
                    .enqueuePush(job.getId()));
        }
        return Optional.of(handlers.jobType(job.getType()).enqueueFetch(job.getId()));
    }
}
