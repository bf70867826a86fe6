package com.cloudferry.orchestrator.lock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * RedisDistributedLock against a mocked template: SET NX for acquire,
 * owner-checked scripts for refresh and release.
 */
class RedisDistributedLockTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    StringRedisTemplate               redis;
    ValueOperations<String, String>   valueOps;
    RedisDistributedLock              lock;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis    = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(valueOps);
        lock = new RedisDistributedLock(redis);
    }

    @AfterEach
    void tearDown() {
        lock.shutdown();
    }

    @Test
    void acquire_freeKey_returnsHandle() {
        when(valueOps.setIfAbsent(eq("ledger:owner:42"), anyString(), eq(TTL))).thenReturn(true);

        Optional<LockHandle> handle = lock.acquire("ledger:owner:42", TTL);

        assertThat(handle).isPresent();
        assertThat(handle.get().key()).isEqualTo("ledger:owner:42");
    }

    @Test
    void acquire_heldKeyWithoutWait_failsImmediately() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertThat(lock.acquire("ledger:owner:42", TTL)).isEmpty();
        verify(valueOps, times(1)).setIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void acquire_keyFreedWhileWaiting_succeeds() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false, false, true);

        Optional<LockHandle> handle = lock.acquire("ledger:owner:42", TTL, Duration.ofSeconds(2));

        assertThat(handle).isPresent();
        verify(valueOps, times(3)).setIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void acquire_valuesAreUniquePerAcquisition() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);

        lock.acquire("a", TTL);
        lock.acquire("b", TTL);

        ArgumentCaptor<String> values = ArgumentCaptor.forClass(String.class);
        verify(valueOps, times(2)).setIfAbsent(anyString(), values.capture(), any(Duration.class));
        assertThat(values.getAllValues().get(0)).isNotEqualTo(values.getAllValues().get(1));
    }

    @Test
    void close_releasesOnlyOwnValueOnce() {
        when(valueOps.setIfAbsent(eq("k"), anyString(), eq(TTL))).thenReturn(true);
        when(redis.execute(eq(RedisDistributedLock.RELEASE_SCRIPT), eq(List.of("k")), any())).thenReturn(1L);

        LockHandle handle = lock.acquire("k", TTL).orElseThrow();
        handle.close();
        handle.close();

        ArgumentCaptor<String> value = ArgumentCaptor.forClass(String.class);
        verify(valueOps).setIfAbsent(eq("k"), value.capture(), eq(TTL));
        verify(redis, times(1)).execute(eq(RedisDistributedLock.RELEASE_SCRIPT), eq(List.of("k")), eq(value.getValue()));
    }

    @Test
    void refresh_lostLock_returnsFalse() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        when(redis.execute(eq(RedisDistributedLock.REFRESH_SCRIPT), eq(List.of("k")), any(), any())).thenReturn(0L);

        LockHandle handle = lock.acquire("k", TTL).orElseThrow();

        assertThat(handle.refresh()).isFalse();
    }

    @Test
    void refresh_afterRelease_returnsFalseWithoutCallingRedis() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);

        LockHandle handle = lock.acquire("k", TTL).orElseThrow();
        handle.release();

        assertThat(handle.refresh()).isFalse();
        verify(redis, never()).execute(eq(RedisDistributedLock.REFRESH_SCRIPT), eq(List.of("k")), any(), any());
    }

    @Test
    void heldLock_isRefreshedInBackgroundAtHalfTtl() {
        Duration shortTtl = Duration.ofMillis(200);
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        when(redis.execute(eq(RedisDistributedLock.REFRESH_SCRIPT), eq(List.of("k")), any(), any())).thenReturn(1L);

        LockHandle handle = lock.acquire("k", shortTtl).orElseThrow();

        verify(redis, timeout(2_000).atLeast(2))
                .execute(eq(RedisDistributedLock.REFRESH_SCRIPT), eq(List.of("k")), anyString(), eq("200"));
        handle.release();
    }

    @Test
    void backgroundRefresh_survivesUnexpectedException() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        when(redis.execute(eq(RedisDistributedLock.REFRESH_SCRIPT), eq(List.of("k")), any(), any()))
                .thenThrow(new IllegalStateException("connection reset"))
                .thenReturn(1L);

        lock.acquire("k", Duration.ofMillis(100)).orElseThrow();

        verify(redis, timeout(2_000).atLeast(3))
                .execute(eq(RedisDistributedLock.REFRESH_SCRIPT), eq(List.of("k")), any(), any());
    }
}
