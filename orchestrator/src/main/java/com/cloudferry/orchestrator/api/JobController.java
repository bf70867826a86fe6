package com.cloudferry.orchestrator.api;

import com.cloudferry.orchestrator.api.dto.ActionRequest;
import com.cloudferry.orchestrator.api.dto.CreateJobRequest;
import com.cloudferry.orchestrator.api.dto.PageResponse;
import com.cloudferry.orchestrator.model.ActorRole;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.service.*;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

import static com.cloudferry.orchestrator.api.Responses.ROLE_HEADER;
import static com.cloudferry.orchestrator.api.Responses.USER_ID_HEADER;

/**
 * REST API for users and admins.
 *
 * POST /jobs                    create a job for a ready source
 * GET  /jobs                    the caller's jobs, optionally by status
 * GET  /jobs/statistics         per-status counts for the caller
 * GET  /jobs/{id}               one job with its timeline
 * GET  /jobs/{id}/timeline      the timeline, paged
 * POST /jobs/{id}/retry         resume a failed job
 * POST /jobs/{id}/cancel        cancel a job before it starts uploading
 * POST /jobs/{id}/refund        refund a failed job's charge
 *
 * Identity travels in the X-User-Id / X-User-Role headers; authentication
 * happens in front of this service.
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private static final int MAX_PAGE_SIZE = 100;

    private final JobService      jobService;
    private final JobQueryService queryService;
    private final RefundService   refundService;

    public JobController(JobService jobService, JobQueryService queryService, RefundService refundService) {
        this.jobService    = jobService;
        this.queryService  = queryService;
        this.refundService = refundService;
    }

    /**
     * Create a job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" -H "X-User-Id: 42" \
     *     -d '{"sourceId":"6f1c...","selectedPaths":["Season 1/"]}'
     */
    @PostMapping
    public ResponseEntity<?> create(@RequestHeader(USER_ID_HEADER) Long userId,
                                    @RequestBody CreateJobRequest req) {
        if (req.sourceId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "sourceId is required");
        }
        return Responses.of(
                jobService.createAndDispatch(req.sourceId(), userId, req.destinationId(), req.selectedPaths()),
                HttpStatus.CREATED);
    }

    @GetMapping
    public PageResponse<JobView> list(@RequestHeader(USER_ID_HEADER) Long userId,
                                      @RequestParam(required = false) JobStatus status,
                                      @RequestParam(defaultValue = "0") int page,
                                      @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), clamp(size), Sort.by(Sort.Direction.DESC, "createdAt"));
        return PageResponse.from(queryService.getUserJobs(userId, status, pageable));
    }

    @GetMapping("/statistics")
    public JobStatistics statistics(@RequestHeader(USER_ID_HEADER) Long userId) {
        return queryService.getStatistics(userId);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable UUID id,
                                 @RequestHeader(USER_ID_HEADER) Long userId,
                                 @RequestHeader(value = ROLE_HEADER, defaultValue = "USER") ActorRole role) {
        return Responses.of(queryService.getJob(id, Responses.actor(userId, role)), HttpStatus.OK);
    }

    @GetMapping("/{id}/timeline")
    public ResponseEntity<?> timeline(@PathVariable UUID id,
                                      @RequestHeader(USER_ID_HEADER) Long userId,
                                      @RequestHeader(value = ROLE_HEADER, defaultValue = "USER") ActorRole role,
                                      @RequestParam(defaultValue = "0") int page,
                                      @RequestParam(defaultValue = "50") int size) {
        OperationResult<Page<TimelineEntryView>> result = queryService
                .getTimeline(id, Responses.actor(userId, role), PageRequest.of(Math.max(page, 0), clamp(size)));
        if (!result.isSuccess()) {
            return Responses.of(result, HttpStatus.OK);
        }
        return ResponseEntity.ok(PageResponse.from(result.value()));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<?> retry(@PathVariable UUID id,
                                   @RequestHeader(USER_ID_HEADER) Long userId,
                                   @RequestHeader(value = ROLE_HEADER, defaultValue = "USER") ActorRole role,
                                   @RequestBody(required = false) ActionRequest req) {
        return Responses.of(jobService.retry(id, Responses.actor(userId, role), reason(req)), HttpStatus.OK);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable UUID id,
                                    @RequestHeader(USER_ID_HEADER) Long userId,
                                    @RequestHeader(value = ROLE_HEADER, defaultValue = "USER") ActorRole role,
                                    @RequestBody(required = false) ActionRequest req) {
        return Responses.of(jobService.cancel(id, Responses.actor(userId, role), reason(req)), HttpStatus.OK);
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<?> refund(@PathVariable UUID id,
                                    @RequestHeader(USER_ID_HEADER) Long userId,
                                    @RequestHeader(value = ROLE_HEADER, defaultValue = "USER") ActorRole role) {
        return Responses.of(refundService.refund(id, Responses.actor(userId, role)), HttpStatus.OK);
    }

    private static String reason(ActionRequest req) {
        return req == null ? null : req.reason();
    }

    private static int clamp(int size) {
        return Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
    }
}
