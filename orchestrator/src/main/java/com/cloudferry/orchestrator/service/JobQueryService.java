package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.model.Actor;
import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.repository.JobRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only projections of Jobs for users, admins and the REST layer.
 */
@Service
@Transactional(readOnly = true)
public class JobQueryService {

    private final JobRepository    jobRepo;
    private final JobStatusService statusService;

    public JobQueryService(JobRepository jobRepo, JobStatusService statusService) {
        this.jobRepo       = jobRepo;
        this.statusService = statusService;
    }

    /** One Job with its full timeline. */
    public OperationResult<JobView> getJob(UUID jobId, Actor actor) {
        OperationResult<Job> found = visibleJob(jobId, actor);
        if (!found.isSuccess()) {
            return found.asFailure();
        }
        return OperationResult.ok(JobView.of(found.value(), statusService.getTimeline(jobId)));
    }

    public OperationResult<Page<TimelineEntryView>> getTimeline(UUID jobId, Actor actor, Pageable pageable) {
        OperationResult<Job> found = visibleJob(jobId, actor);
        if (!found.isSuccess()) {
            return found.asFailure();
        }
        return OperationResult.ok(statusService.getTimeline(jobId, pageable));
    }

    /** The owner's Jobs, optionally filtered by status, without timelines. */
    public Page<JobView> getUserJobs(Long ownerId, JobStatus status, Pageable pageable) {
        Page<Job> jobs = status == null
                ? jobRepo.findByOwnerId(ownerId, pageable)
                : jobRepo.findByOwnerIdAndStatus(ownerId, status, pageable);
        return jobs.map(job -> JobView.of(job, List.of()));
    }

    public JobStatistics getStatistics(Long ownerId) {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            byStatus.put(s, 0L);
        }
        for (JobRepository.StatusCountRow row : jobRepo.countByStatusForOwner(ownerId)) {
            byStatus.put(row.getStatus(), row.getTotal());
        }

        long total = 0, active = 0, completed = 0, failed = 0, retrying = 0, cancelled = 0;
        List<JobStatistics.StatusCount> filters = new ArrayList<>();
        for (Map.Entry<JobStatus, Long> e : byStatus.entrySet()) {
            JobStatus s = e.getKey();
            long n = e.getValue();
            total += n;
            if (s.isActive())    active += n;
            if (s.isCompleted()) completed += n;
            if (s.isFailed())    failed += n;
            if (s.isRetrying())  retrying += n;
            if (s.isCancelled()) cancelled += n;
            if (n > 0) {
                filters.add(new JobStatistics.StatusCount(s, n));
            }
        }
        filters.sort(Comparator.comparingLong(JobStatistics.StatusCount::count).reversed());

        return new JobStatistics(total, active, completed, failed, retrying, cancelled, byStatus, filters);
    }

    private OperationResult<Job> visibleJob(UUID jobId, Actor actor) {
        Optional<Job> found = jobRepo.findById(jobId);
        if (found.isEmpty()) {
            return OperationResult.fail(JobErrorCode.JOB_NOT_FOUND, "Job " + jobId + " not found");
        }
        if (!actor.mayActOn(found.get())) {
            return OperationResult.fail(JobErrorCode.UNAUTHORIZED, "Not allowed to view job " + jobId);
        }
        return OperationResult.ok(found.get());
    }
}
