package com.cloudferry.orchestrator.handler;

import com.cloudferry.orchestrator.TestData;
import com.cloudferry.orchestrator.dispatch.DispatchLog;
import com.cloudferry.orchestrator.handler.impl.GoogleDriveStorageHandler;
import com.cloudferry.orchestrator.handler.impl.TorrentCancellationHandler;
import com.cloudferry.orchestrator.handler.impl.TorrentJobTypeHandler;
import com.cloudferry.orchestrator.handler.impl.TorrentRecoveryStrategy;
import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobStatus;
import com.cloudferry.orchestrator.model.JobType;
import com.cloudferry.orchestrator.model.StorageProviderType;
import com.cloudferry.orchestrator.scheduler.TaskKind;
import com.cloudferry.orchestrator.scheduler.TaskQueue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TorrentHandlersTest {

    @Mock TaskQueue                       taskQueue;
    @Mock StringRedisTemplate             redis;
    @Mock DispatchLog                     dispatchLog;
    @Mock HandlerRegistry                 registry;
    @Mock ObjectProvider<HandlerRegistry> registryProvider;

    @Test
    void torrentHandler_enqueuesFetchTaskTargetingItsType() {
        Job job = TestData.job(JobStatus.QUEUED);
        when(taskQueue.enqueue(job.getId(), TaskKind.FETCH, "TORRENT")).thenReturn("fetch-1");

        assertThat(new TorrentJobTypeHandler(taskQueue).enqueueFetch(job.getId())).isEqualTo("fetch-1");
    }

    @Test
    void torrentHandler_pushPhaseAndFailureStatuses() {
        TorrentJobTypeHandler handler = new TorrentJobTypeHandler(taskQueue);

        assertThat(handler.isPushPhase(JobStatus.PENDING_PUSH)).isTrue();
        assertThat(handler.isPushPhase(JobStatus.PUSH_FAILED)).isTrue();
        assertThat(handler.isPushPhase(JobStatus.STAGE_FAILED)).isFalse();
        assertThat(handler.failureStatusFor(JobStatus.STAGE_RETRY)).isEqualTo(JobStatus.STAGE_FAILED);
        assertThat(handler.failedStatuses()).contains(JobStatus.FAILED).doesNotContain(JobStatus.CANCELLED);
    }

    @Test
    void storageHandler_releasesProviderScopedLockKey() {
        Job job = TestData.job(JobStatus.FETCHING);
        String key = "push:lock:google_drive:" + job.getId();
        when(redis.delete(key)).thenReturn(true);

        assertThat(new GoogleDriveStorageHandler(taskQueue, redis).releaseLock(job.getId())).isTrue();
    }

    @Test
    void storageHandler_redisDown_releaseReturnsFalse() {
        Job job = TestData.job(JobStatus.FETCHING);
        when(redis.delete(anyString()))
                .thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(new GoogleDriveStorageHandler(taskQueue, redis).releaseLock(job.getId())).isFalse();
    }

    @Test
    void cancellationHandler_publishesCancelNotice() {
        Job job = TestData.job(JobStatus.STAGING);
        job.setLocalPath("/data/abc");
        when(dispatchLog.publish(eq(DispatchLog.CANCEL_STREAM), anyMap())).thenReturn("1-0");

        new TorrentCancellationHandler(dispatchLog).cancel(job);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> fields = ArgumentCaptor.forClass(Map.class);
        verify(dispatchLog).publish(eq(DispatchLog.CANCEL_STREAM), fields.capture());
        assertThat(fields.getValue())
                .containsEntry("jobId", job.getId().toString())
                .containsEntry("jobType", "TORRENT")
                .containsEntry("localPath", "/data/abc");
    }

    @Test
    void recoveryStrategy_pushPhase_reEnqueuesPushOnDestination() {
        Job job = TestData.job(JobStatus.PUSHING);
        StorageProviderHandler drive = mock(StorageProviderHandler.class);
        when(registryProvider.getObject()).thenReturn(registry);
        when(registry.storageProvider(StorageProviderType.GOOGLE_DRIVE)).thenReturn(drive);
        when(drive.enqueuePush(job.getId())).thenReturn("push-2");

        assertThat(new TorrentRecoveryStrategy(registryProvider).recover(job)).contains("push-2");
    }

    @Test
    void recoveryStrategy_stagingJob_reEnqueuesFetch() {
        Job job = TestData.job(JobStatus.STAGING);
        JobTypeHandler torrent = mock(JobTypeHandler.class);
        when(registryProvider.getObject()).thenReturn(registry);
        when(registry.jobType(JobType.TORRENT)).thenReturn(torrent);
        when(torrent.enqueueFetch(job.getId())).thenReturn("fetch-2");

        assertThat(new TorrentRecoveryStrategy(registryProvider).recover(job)).contains("fetch-2");
    }

    @Test
    void recoveryStrategy_pushPhaseWithoutDestination_declines() {
        Job job = TestData.withId(new Job(TestData.OWNER, TestData.readySource(), null, JobType.TORRENT));
        job.applyTransition(JobStatus.PUSHING, null, Instant.now());
        when(registryProvider.getObject()).thenReturn(registry);

        assertThat(new TorrentRecoveryStrategy(registryProvider).recover(job)).isEqualTo(Optional.empty());
        verifyNoInteractions(registry);
    }

    @Test
    void recoveryStrategy_watchesEveryActiveStatus() {
        assertThat(new TorrentRecoveryStrategy(registryProvider).monitoredStatuses())
                .containsExactlyInAnyOrderElementsOf(JobStatus.activeStatuses());
    }

    @Test
    void recoveryStrategy_pendingPush_reEnqueuesPush() {
        Job job = TestData.job(JobStatus.PENDING_PUSH);
        StorageProviderHandler drive = mock(StorageProviderHandler.class);
        when(registryProvider.getObject()).thenReturn(registry);
        when(registry.storageProvider(StorageProviderType.GOOGLE_DRIVE)).thenReturn(drive);
        when(drive.enqueuePush(job.getId())).thenReturn("push-2");

        assertThat(new TorrentRecoveryStrategy(registryProvider).recover(job)).contains("push-2");
    }
}
