package com.cloudferry.orchestrator.api;

import com.cloudferry.orchestrator.api.dto.ClaimTaskRequest;
import com.cloudferry.orchestrator.api.dto.ErrorResponse;
import com.cloudferry.orchestrator.api.dto.FailTaskRequest;
import com.cloudferry.orchestrator.api.dto.WorkerReport;
import com.cloudferry.orchestrator.scheduler.TaskDetails;
import com.cloudferry.orchestrator.scheduler.TaskQueue;
import com.cloudferry.orchestrator.service.WorkerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;
import java.util.UUID;

/**
 * REST API for fetch and push workers.
 *
 * POST /worker/tasks/claim              claim the next due task (204 when idle)
 * POST /worker/tasks/{handle}/complete  the task finished
 * POST /worker/tasks/{handle}/fail      the attempt failed; the queue decides on retry
 * POST /worker/jobs/{id}/started        the worker began running its task
 * POST /worker/jobs/{id}/heartbeat      liveness ping
 * POST /worker/jobs/{id}/progress       bytes transferred so far
 * POST /worker/jobs/{id}/phase          move the job forward
 *
 * A 409 on any /worker/jobs call means the handle is no longer current and
 * the worker should abandon the task.
 */
@RestController
@RequestMapping("/worker")
public class WorkerController {

    private final TaskQueue     taskQueue;
    private final WorkerService workerService;

    public WorkerController(TaskQueue taskQueue, WorkerService workerService) {
        this.taskQueue     = taskQueue;
        this.workerService = workerService;
    }

    // ------------------------------------------------------------------
    // Tasks
    // ------------------------------------------------------------------

    @PostMapping("/tasks/claim")
    public ResponseEntity<TaskDetails> claim(@RequestBody ClaimTaskRequest req) {
        if (req.workerId() == null || req.workerId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "workerId is required");
        }
        Optional<TaskDetails> claimed = taskQueue.claimNext(req.workerId(), req.kinds());
        return claimed.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/tasks/{handle}/complete")
    public ResponseEntity<?> complete(@PathVariable String handle) {
        return accepted(taskQueue.complete(handle), "Task " + handle + " is not being processed");
    }

    @PostMapping("/tasks/{handle}/fail")
    public ResponseEntity<?> fail(@PathVariable String handle,
                                  @RequestBody(required = false) FailTaskRequest req) {
        String error = req == null || req.error() == null ? "Worker reported failure" : req.error();
        return accepted(taskQueue.fail(handle, error), "Task " + handle + " is not being processed");
    }

    // ------------------------------------------------------------------
    // Job progress
    // ------------------------------------------------------------------

    @PostMapping("/jobs/{id}/started")
    public ResponseEntity<?> started(@PathVariable UUID id, @RequestBody WorkerReport report) {
        return accepted(workerService.markStarted(id, requireHandle(report)), superseded(id));
    }

    @PostMapping("/jobs/{id}/heartbeat")
    public ResponseEntity<?> heartbeat(@PathVariable UUID id, @RequestBody WorkerReport report) {
        return accepted(workerService.updateHeartbeat(id, requireHandle(report), report.state()), superseded(id));
    }

    @PostMapping("/jobs/{id}/progress")
    public ResponseEntity<?> progress(@PathVariable UUID id, @RequestBody WorkerReport report) {
        if (report.bytes() == null || report.bytes() < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "bytes must be >= 0");
        }
        return accepted(workerService.updateProgress(id, requireHandle(report), report.bytes(), report.totalBytes()),
                superseded(id));
    }

    @PostMapping("/jobs/{id}/phase")
    public ResponseEntity<?> phase(@PathVariable UUID id, @RequestBody WorkerReport report) {
        if (report.target() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "target is required");
        }
        return Responses.of(
                workerService.advancePhase(id, requireHandle(report), report.target(), report.localPath()),
                HttpStatus.OK);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ResponseEntity<?> accepted(boolean ok, String conflictMessage) {
        if (ok) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("HANDLE_SUPERSEDED", conflictMessage, false));
    }

    private static String requireHandle(WorkerReport report) {
        if (report.handle() == null || report.handle().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "handle is required");
        }
        return report.handle();
    }

    private static String superseded(UUID jobId) {
        return "Handle is not current for job " + jobId;
    }
}
