package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.JobStatusHistory;
import com.cloudferry.orchestrator.model.StatusChangeSource;
import com.cloudferry.orchestrator.repository.JobRepository;
import com.cloudferry.orchestrator.repository.JobStatusHistoryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The only writer of Job.status.
 *
 * Every status change updates the Job and appends a {@link JobStatusHistory}
 * row in the same transaction. Timeline timestamps are strictly ascending per
 * Job: when the clock has not moved past the previous entry, the new one is
 * stamped one microsecond after it.
 */
@Service
public class JobStatusService {

    private static final Logger log = LoggerFactory.getLogger(JobStatusService.class);

    private final JobRepository              jobRepo;
    private final JobStatusHistoryRepository historyRepo;
    private final ObjectMapper               objectMapper;
    private final MeterRegistry              meterRegistry;

    public JobStatusService(JobRepository jobRepo,
                            JobStatusHistoryRepository historyRepo,
                            ObjectMapper objectMapper,
                            MeterRegistry meterRegistry) {
        this.jobRepo       = jobRepo;
        this.historyRepo   = historyRepo;
        this.objectMapper  = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Move {@code job} to {@code newStatus} and record why.
     *
     * A call that names the current status and carries no error changes
     * nothing and appends nothing.
     *
     * @return true if a timeline entry was written
     */
    @Transactional
    public boolean transition(Job job,
                              JobStatus newStatus,
                              StatusChangeSource source,
                              String error,
                              Map<String, ?> metadata) {
        JobStatus from = job.getStatus();
        if (from == newStatus && error == null) {
            return false;
        }

        Instant at = nextTimestamp(job);
        job.applyTransition(newStatus, error, at);
        jobRepo.save(job);
        historyRepo.save(new JobStatusHistory(job.getId(), from, newStatus, source, error, toJson(metadata), at));

        meterRegistry.counter("cloudferry.job.transitions",
                "from", from.name(), "to", newStatus.name(), "source", source.name()).increment();
        if (error != null) {
            log.info("Job {} {} -> {} ({}): {}", job.getId(), from, newStatus, source, error);
        } else {
            log.info("Job {} {} -> {} ({})", job.getId(), from, newStatus, source);
        }
        return true;
    }

    /** First entry of a freshly saved Job, stamped with the Job's creation time. */
    @Transactional
    public void recordInitial(Job job, Map<String, ?> metadata) {
        Instant at = job.getCreatedAt();
        job.markTimelineAt(at);
        jobRepo.save(job);
        historyRepo.save(new JobStatusHistory(job.getId(), null, job.getStatus(),
                StatusChangeSource.SYSTEM, null, toJson(metadata), at));
    }

    /**
     * Audit an action that does not change the status (refund, recovery).
     * The entry has from = to = the current status.
     */
    @Transactional
    public void recordEvent(Job job, StatusChangeSource source, Map<String, ?> metadata) {
        Instant at = nextTimestamp(job);
        job.markTimelineAt(at);
        jobRepo.save(job);
        historyRepo.save(new JobStatusHistory(job.getId(), job.getStatus(), job.getStatus(),
                source, null, toJson(metadata), at));
        log.debug("Job {} event recorded ({}): {}", job.getId(), source, metadata);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<TimelineEntryView> getTimeline(UUID jobId) {
        return toViews(historyRepo.findByJobIdOrderByChangedAtAsc(jobId), null);
    }

    /**
     * One page of the timeline. The first entry on a later page gets its
     * duration from the last entry of the page before it.
     */
    @Transactional(readOnly = true)
    public Page<TimelineEntryView> getTimeline(UUID jobId, Pageable pageable) {
        Page<JobStatusHistory> page = historyRepo.findByJobIdOrderByChangedAtAsc(jobId, pageable);
        Instant previous = null;
        if (page.hasContent() && page.getNumber() > 0) {
            previous = historyRepo
                    .findFirstByJobIdAndChangedAtBeforeOrderByChangedAtDesc(jobId, page.getContent().get(0).getChangedAt())
                    .map(JobStatusHistory::getChangedAt)
                    .orElse(null);
        }
        return new PageImpl<>(toViews(page.getContent(), previous), pageable, page.getTotalElements());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Instant nextTimestamp(Job job) {
        Instant now  = Instant.now().truncatedTo(ChronoUnit.MICROS);
        Instant last = job.getLastTransitionAt();
        if (last != null && !now.isAfter(last)) {
            return last.plus(1, ChronoUnit.MICROS);
        }
        return now;
    }

    private List<TimelineEntryView> toViews(List<JobStatusHistory> entries, Instant previous) {
        List<TimelineEntryView> views = new ArrayList<>(entries.size());
        for (JobStatusHistory h : entries) {
            Duration sincePrevious = previous == null ? null : Duration.between(previous, h.getChangedAt());
            views.add(new TimelineEntryView(
                    h.getId(),
                    h.getFromStatus(),
                    h.getToStatus(),
                    h.getSource(),
                    h.getErrorMessage(),
                    fromJson(h.getMetadataJson()),
                    h.getChangedAt(),
                    sincePrevious));
            previous = h.getChangedAt();
        }
        return views;
    }

    private String toJson(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable transition metadata: " + metadata.keySet(), e);
        }
    }

    private JsonNode fromJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable timeline metadata, returning it as text: {}", e.getMessage());
            return objectMapper.getNodeFactory().textNode(json);
        }
    }
}
