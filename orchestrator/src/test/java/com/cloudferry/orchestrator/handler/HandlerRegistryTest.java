package com.cloudferry.orchestrator.handler;

import com.cloudferry.orchestrator.handler.impl.GoogleDriveStorageHandler;
import com.cloudferry.orchestrator.handler.impl.S3StorageHandler;
import com.cloudferry.orchestrator.handler.impl.TorrentCancellationHandler;
import com.cloudferry.orchestrator.handler.impl.TorrentJobTypeHandler;
import com.cloudferry.orchestrator.handler.impl.TorrentRecoveryStrategy;
import com.cloudferry.orchestrator.dispatch.DispatchLog;
import com.cloudferry.orchestrator.model.JobType;
import com.cloudferry.orchestrator.model.StorageProviderType;
import com.cloudferry.orchestrator.scheduler.TaskQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * Tests for the handler layer: registry lookup and duplicate detection.
 * Handlers are real; their collaborators are mocks.
 */
class HandlerRegistryTest {

    TaskQueue           taskQueue = mock(TaskQueue.class);
    StringRedisTemplate redis     = mock(StringRedisTemplate.class);
    SimpleMeterRegistry meters    = new SimpleMeterRegistry();

    TorrentJobTypeHandler     torrent;
    GoogleDriveStorageHandler drive;
    S3StorageHandler          s3;
    TorrentCancellationHandler cancellation;
    TorrentRecoveryStrategy   recovery;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        torrent      = new TorrentJobTypeHandler(taskQueue);
        drive        = new GoogleDriveStorageHandler(taskQueue, redis);
        s3           = new S3StorageHandler(taskQueue, redis);
        cancellation = new TorrentCancellationHandler(mock(DispatchLog.class));
        recovery     = new TorrentRecoveryStrategy(mock(ObjectProvider.class));
    }

    @Test
    void lookup_returnsHandlerForEachKey() {
        HandlerRegistry registry = registry(List.of(drive, s3));

        assertThat(registry.jobType(JobType.TORRENT)).isSameAs(torrent);
        assertThat(registry.storageProvider(StorageProviderType.GOOGLE_DRIVE)).isSameAs(drive);
        assertThat(registry.storageProvider(StorageProviderType.AWS_S3)).isSameAs(s3);
        assertThat(registry.cancellation(JobType.TORRENT)).isSameAs(cancellation);
        assertThat(registry.recovery(JobType.TORRENT)).isSameAs(recovery);
        assertThat(registry.recoveryStrategies()).containsExactly(recovery);
    }

    @Test
    void lookup_unregisteredProvider_throwsHandlerNotFound() {
        HandlerRegistry registry = registry(List.of(drive));

        assertThatThrownBy(() -> registry.storageProvider(StorageProviderType.DROPBOX))
                .isInstanceOf(HandlerNotFoundException.class)
                .hasMessageContaining("DROPBOX");
    }

    @Test
    void duplicateKey_abortsStartup() {
        GoogleDriveStorageHandler second = new GoogleDriveStorageHandler(taskQueue, redis);

        assertThatThrownBy(() -> registry(List.of(drive, second)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GOOGLE_DRIVE");
    }

    @Test
    void registeredCounts_areExposedAsGauges() {
        HandlerRegistry registry = registry(List.of(drive, s3));

        assertThat(meters.get("cloudferry.handlers.registered").tag("axis", "storage_provider").gauge().value())
                .isEqualTo(2.0);
        assertThat(meters.get("cloudferry.handlers.registered").tag("axis", "job_type").gauge().value())
                .isEqualTo(1.0);
        // gauges hold their maps weakly
        assertThat(registry.recoveryStrategies()).hasSize(1);
    }

    private HandlerRegistry registry(List<StorageProviderHandler> storage) {
        return new HandlerRegistry(List.of(torrent), storage, List.of(cancellation), List.of(recovery), meters);
    }
}
