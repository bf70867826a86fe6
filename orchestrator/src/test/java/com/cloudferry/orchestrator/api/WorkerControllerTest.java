package com.cloudferry.orchestrator.api;

import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.scheduler.TaskDetails;
import com.cloudferry.orchestrator.scheduler.TaskKind;
import com.cloudferry.orchestrator.scheduler.TaskQueue;
import com.cloudferry.orchestrator.scheduler.TaskState;
import com.cloudferry.orchestrator.service.JobErrorCode;
import com.cloudferry.orchestrator.service.OperationResult;
import com.cloudferry.orchestrator.service.WorkerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkerController.class)
class WorkerControllerTest {

    @Autowired MockMvc mockMvc;

    @MockitoBean TaskQueue     taskQueue;
    @MockitoBean WorkerService workerService;

    @Test
    void claim_taskDue_returns200WithDetails() throws Exception {
        UUID jobId  = UUID.randomUUID();
        String handle = UUID.randomUUID().toString();
        when(taskQueue.claimNext("fetcher-1", List.of(TaskKind.FETCH))).thenReturn(Optional.of(
                new TaskDetails(handle, jobId, TaskKind.FETCH, "TORRENT", TaskState.PROCESSING, 0, null, Instant.now(), Instant.now())));

        mockMvc.perform(post("/worker/tasks/claim")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workerId\":\"fetcher-1\",\"kinds\":[\"FETCH\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.handle").value(handle))
                .andExpect(jsonPath("$.jobId").value(jobId.toString()))
                .andExpect(jsonPath("$.target").value("TORRENT"));
    }

    @Test
    void claim_nothingDue_returns204() throws Exception {
        when(taskQueue.claimNext(eq("w"), any())).thenReturn(Optional.empty());

        mockMvc.perform(post("/worker/tasks/claim")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workerId\":\"w\"}"))
                .andExpect(status().isNoContent());

        verify(taskQueue).claimNext("w", List.of(TaskKind.values()));
    }

    @Test
    void claim_missingWorkerId_returns400() throws Exception {
        mockMvc.perform(post("/worker/tasks/claim")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(taskQueue);
    }

    @Test
    void complete_taskNotProcessing_returns409() throws Exception {
        when(taskQueue.complete("abc")).thenReturn(false);

        mockMvc.perform(post("/worker/tasks/{handle}/complete", "abc"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("HANDLE_SUPERSEDED"));
    }

    @Test
    void fail_withoutBody_usesDefaultError() throws Exception {
        when(taskQueue.fail("abc", "Worker reported failure")).thenReturn(true);

        mockMvc.perform(post("/worker/tasks/{handle}/fail", "abc"))
                .andExpect(status().isNoContent());
    }

    @Test
    void heartbeat_currentHandle_returns204() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(workerService.updateHeartbeat(jobId, "h1", "downloading")).thenReturn(true);

        mockMvc.perform(post("/worker/jobs/{id}/heartbeat", jobId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"handle\":\"h1\",\"state\":\"downloading\"}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void heartbeat_staleHandle_returns409() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(workerService.updateHeartbeat(eq(jobId), anyString(), any())).thenReturn(false);

        mockMvc.perform(post("/worker/jobs/{id}/heartbeat", jobId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"handle\":\"old\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void heartbeat_missingHandle_returns400() throws Exception {
        mockMvc.perform(post("/worker/jobs/{id}/heartbeat", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"state\":\"x\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(workerService);
    }

    @Test
    void progress_negativeBytes_returns400() throws Exception {
        mockMvc.perform(post("/worker/jobs/{id}/progress", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"handle\":\"h1\",\"bytes\":-1}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void progress_valid_returns204() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(workerService.updateProgress(jobId, "h1", 1024L, 4096L)).thenReturn(true);

        mockMvc.perform(post("/worker/jobs/{id}/progress", jobId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"handle\":\"h1\",\"bytes\":1024,\"totalBytes\":4096}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void phase_advance_returnsNewStatus() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(workerService.advancePhase(jobId, "h1", JobStatus.PENDING_PUSH, "/data/staged/abc"))
                .thenReturn(OperationResult.ok(JobStatus.PENDING_PUSH));

        mockMvc.perform(post("/worker/jobs/{id}/phase", jobId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"handle\":\"h1\",\"target\":\"PENDING_PUSH\",\"localPath\":\"/data/staged/abc\"}"))
                .andExpect(status().isOk())
                .andExpect(content().string("\"PENDING_PUSH\""));
    }

    @Test
    void phase_backwardsMove_returns409() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(workerService.advancePhase(eq(jobId), eq("h1"), eq(JobStatus.FETCHING), any()))
                .thenReturn(OperationResult.fail(JobErrorCode.INVALID_TRANSITION, "Cannot move backwards"));

        mockMvc.perform(post("/worker/jobs/{id}/phase", jobId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"handle\":\"h1\",\"target\":\"FETCHING\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }
}
