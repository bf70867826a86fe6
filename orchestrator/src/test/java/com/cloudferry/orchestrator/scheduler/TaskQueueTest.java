package com.cloudferry.orchestrator.scheduler;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.cloudferry.orchestrator.TestData.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskQueueTest {

    @Mock ScheduledTaskRepository   taskRepo;
    @Mock ApplicationEventPublisher events;

    SimpleMeterRegistry meterRegistry;
    TaskQueue           queue;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queue = new TaskQueue(taskRepo, events, meterRegistry, 3);
    }

    // ------------------------------------------------------------------
    // enqueue
    // ------------------------------------------------------------------

    @Test
    void enqueue_savesTaskAndReturnsHandle() {
        UUID jobId = UUID.randomUUID();
        when(taskRepo.save(any(ScheduledTask.class))).thenAnswer(inv -> withId(inv.getArgument(0)));

        String handle = queue.enqueue(jobId, TaskKind.FETCH, "TORRENT");

        ArgumentCaptor<ScheduledTask> captor = ArgumentCaptor.forClass(ScheduledTask.class);
        verify(taskRepo).save(captor.capture());
        ScheduledTask saved = captor.getValue();
        assertThat(handle).isEqualTo(saved.getHandle());
        assertThat(saved.getJobId()).isEqualTo(jobId);
        assertThat(saved.getState()).isEqualTo(TaskState.ENQUEUED);
        assertThat(saved.getMaxAttempts()).isEqualTo(3);
        assertThat(meterRegistry.counter("cloudferry.tasks.enqueued", "kind", "FETCH").count()).isEqualTo(1.0);
    }

    @Test
    void enqueue_storeUnavailable_throwsSchedulerException() {
        when(taskRepo.save(any(ScheduledTask.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> queue.enqueue(UUID.randomUUID(), TaskKind.PUSH, "S3"))
                .isInstanceOf(SchedulerException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    // ------------------------------------------------------------------
    // claim / complete
    // ------------------------------------------------------------------

    @Test
    void claimNext_marksTaskProcessing() {
        ScheduledTask task = task(TaskKind.PUSH);
        when(taskRepo.claimNext(eq(List.of(TaskKind.PUSH)), any(Instant.class))).thenReturn(Optional.of(task));

        Optional<TaskDetails> claimed = queue.claimNext("worker-1", List.of(TaskKind.PUSH));

        assertThat(claimed).isPresent();
        assertThat(claimed.get().state()).isEqualTo(TaskState.PROCESSING);
        assertThat(task.getWorkerId()).isEqualTo("worker-1");
        assertThat(task.getStartedAt()).isNotNull();
        verify(taskRepo).save(task);
    }

    @Test
    void claimNext_nothingDue_returnsEmpty() {
        when(taskRepo.claimNext(any(), any(Instant.class))).thenReturn(Optional.empty());

        assertThat(queue.claimNext("worker-1", List.of(TaskKind.FETCH))).isEmpty();
        verify(taskRepo, never()).save(any());
    }

    @Test
    void complete_processingTask_succeeds() {
        ScheduledTask task = processing(TaskKind.FETCH);
        when(taskRepo.findByIdForUpdate(task.getId())).thenReturn(Optional.of(task));

        assertThat(queue.complete(task.getHandle())).isTrue();
        assertThat(task.getState()).isEqualTo(TaskState.SUCCEEDED);
        assertThat(task.getFinishedAt()).isNotNull();
        assertThat(task.getWorkerId()).isNull();
    }

    @Test
    void complete_taskNotProcessing_isIgnored() {
        ScheduledTask task = task(TaskKind.FETCH);
        when(taskRepo.findByIdForUpdate(task.getId())).thenReturn(Optional.of(task));

        assertThat(queue.complete(task.getHandle())).isFalse();
        assertThat(task.getState()).isEqualTo(TaskState.ENQUEUED);
        verify(taskRepo, never()).save(any());
    }

    @Test
    void complete_malformedHandle_isIgnored() {
        assertThat(queue.complete("not-a-handle")).isFalse();
        verifyNoInteractions(taskRepo);
    }

    // ------------------------------------------------------------------
    // fail
    // ------------------------------------------------------------------

    @Test
    void fail_attemptsLeft_reEnqueuesWithBackoffAndPublishesRetry() {
        ScheduledTask task = processing(TaskKind.FETCH);
        when(taskRepo.findByIdForUpdate(task.getId())).thenReturn(Optional.of(task));
        Instant before = Instant.now();

        assertThat(queue.fail(task.getHandle(), "tracker timeout")).isTrue();

        assertThat(task.getState()).isEqualTo(TaskState.ENQUEUED);
        assertThat(task.getAttempt()).isEqualTo(1);
        assertThat(task.getNextRunAt()).isAfterOrEqualTo(before.plusSeconds(60));
        assertThat(task.getStartedAt()).isNull();

        ArgumentCaptor<TaskRetryScheduledEvent> event = ArgumentCaptor.forClass(TaskRetryScheduledEvent.class);
        verify(events).publishEvent(event.capture());
        assertThat(event.getValue().jobId()).isEqualTo(task.getJobId());
        assertThat(event.getValue().attempt()).isEqualTo(1);
        assertThat(event.getValue().nextRunAt()).isEqualTo(task.getNextRunAt());
    }

    @Test
    void fail_lastAttempt_marksFailedAndPublishesFailure() {
        ScheduledTask task = processing(TaskKind.PUSH);
        task.incrementAttempt();
        task.incrementAttempt();
        when(taskRepo.findByIdForUpdate(task.getId())).thenReturn(Optional.of(task));

        assertThat(queue.fail(task.getHandle(), "quota exceeded")).isTrue();

        assertThat(task.getState()).isEqualTo(TaskState.FAILED);
        assertThat(task.getLastError()).isEqualTo("quota exceeded");
        ArgumentCaptor<TaskFailedEvent> event = ArgumentCaptor.forClass(TaskFailedEvent.class);
        verify(events).publishEvent(event.capture());
        assertThat(event.getValue().kind()).isEqualTo(TaskKind.PUSH);
        assertThat(event.getValue().error()).isEqualTo("quota exceeded");
        assertThat(meterRegistry.counter("cloudferry.tasks.finished", "kind", "PUSH", "outcome", "failed").count())
                .isEqualTo(1.0);
    }

    @Test
    void fail_taskAlreadyFinished_isIgnored() {
        ScheduledTask task = task(TaskKind.FETCH);
        task.setState(TaskState.SUCCEEDED);
        when(taskRepo.findByIdForUpdate(task.getId())).thenReturn(Optional.of(task));

        assertThat(queue.fail(task.getHandle(), "late")).isFalse();
        verifyNoInteractions(events);
    }

    @Test
    void backoff_growsThenRepeatsLastDelay() {
        assertThat(TaskQueue.backoffFor(1)).isEqualTo(Duration.ofSeconds(60));
        assertThat(TaskQueue.backoffFor(2)).isEqualTo(Duration.ofSeconds(300));
        assertThat(TaskQueue.backoffFor(3)).isEqualTo(Duration.ofSeconds(900));
        assertThat(TaskQueue.backoffFor(7)).isEqualTo(Duration.ofSeconds(900));
    }

    // ------------------------------------------------------------------
    // details / delete
    // ------------------------------------------------------------------

    @Test
    void details_unknownOrMalformedHandle_isEmpty() {
        assertThat(queue.details(null)).isEmpty();
        assertThat(queue.details("garbage")).isEmpty();
        verifyNoInteractions(taskRepo);
    }

    @Test
    void details_storeUnavailable_throwsSchedulerException() {
        UUID id = UUID.randomUUID();
        when(taskRepo.findById(id)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> queue.details(id.toString())).isInstanceOf(SchedulerException.class);
    }

    @Test
    void delete_liveTask_marksDeleted() {
        ScheduledTask task = processing(TaskKind.FETCH);
        when(taskRepo.findByIdForUpdate(task.getId())).thenReturn(Optional.of(task));

        assertThat(queue.delete(task.getHandle())).isTrue();
        assertThat(task.getState()).isEqualTo(TaskState.DELETED);
        assertThat(task.getWorkerId()).isNull();
    }

    @Test
    void delete_missingOrFinishedTask_isTreatedAsDone() {
        UUID missing = UUID.randomUUID();
        when(taskRepo.findByIdForUpdate(missing)).thenReturn(Optional.empty());
        ScheduledTask finished = task(TaskKind.PUSH);
        finished.setState(TaskState.FAILED);
        when(taskRepo.findByIdForUpdate(finished.getId())).thenReturn(Optional.of(finished));

        assertThat(queue.delete(missing.toString())).isTrue();
        assertThat(queue.delete(finished.getHandle())).isTrue();
        assertThat(finished.getState()).isEqualTo(TaskState.FAILED);
        verify(taskRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ScheduledTask task(TaskKind kind) {
        return withId(new ScheduledTask(UUID.randomUUID(), kind, kind == TaskKind.FETCH ? "TORRENT" : "S3", 3));
    }

    private static ScheduledTask processing(TaskKind kind) {
        ScheduledTask task = task(kind);
        task.setState(TaskState.PROCESSING);
        task.setWorkerId("worker-1");
        task.setStartedAt(Instant.now());
        return task;
    }
}
