package com.cloudferry.orchestrator.lock;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redis implementation of {@link DistributedLock}.
 *
 * Acquire is {@code SET key value NX PX ttl}. The value identifies the holder
 * ({@code host:uuid}); refresh and release go through Lua scripts that only
 * touch the key while it still holds that value, so a holder whose lock
 * expired can never extend or delete someone else's.
 *
 * Held locks refresh themselves every ttl/2 on one shared daemon thread.
 */
@Component
public class RedisDistributedLock implements DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(RedisDistributedLock.class);

    static final Duration POLL_INTERVAL = Duration.ofMillis(50);

    static final RedisScript<Long> REFRESH_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('pexpire', KEYS[1], ARGV[2])
            else
                return 0
            end
            """, Long.class);

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            else
                return 0
            end
            """, Long.class);

    private final StringRedisTemplate      redis;
    private final ScheduledExecutorService refresher;
    private final String                   hostId;

    public RedisDistributedLock(StringRedisTemplate redis) {
        this.redis     = redis;
        this.hostId    = hostName();
        this.refresher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lock-refresher");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Optional<LockHandle> acquire(String key, Duration ttl, Duration wait) {
        String value = hostId + ":" + UUID.randomUUID();
        long deadline = System.nanoTime() + wait.toNanos();

        while (true) {
            if (Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, value, ttl))) {
                log.debug("Acquired lock {} (ttl={})", key, ttl);
                RedisLockHandle handle = new RedisLockHandle(key, value, ttl);
                handle.startRefreshing();
                return Optional.of(handle);
            }
            if (System.nanoTime() >= deadline) {
                log.debug("Lock {} busy after waiting {}", key, wait);
                return Optional.empty();
            }
            try {
                Thread.sleep(POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    @PreDestroy
    void shutdown() {
        refresher.shutdownNow();
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    // ------------------------------------------------------------------
    // Handle
    // ------------------------------------------------------------------

    private final class RedisLockHandle implements LockHandle {

        private final String           key;
        private final String           value;
        private final Duration         ttl;
        private final AtomicBoolean    released = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> refreshTask;

        RedisLockHandle(String key, String value, Duration ttl) {
            this.key   = key;
            this.value = value;
            this.ttl   = ttl;
        }

        void startRefreshing() {
            long period = Math.max(1, ttl.toMillis() / 2);
            refreshTask = refresher.scheduleAtFixedRate(this::refreshQuietly,
                    period, period, TimeUnit.MILLISECONDS);
        }

        private void stopRefreshing() {
            ScheduledFuture<?> task = refreshTask;
            if (task != null) {
                task.cancel(false);
            }
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public boolean refresh() {
            if (released.get()) {
                return false;
            }
            Long result = redis.execute(REFRESH_SCRIPT, List.of(key), value, String.valueOf(ttl.toMillis()));
            boolean owned = result != null && result == 1L;
            if (!owned) {
                log.warn("Lock {} was lost before release", key);
                stopRefreshing();
            }
            return owned;
        }

        @Override
        public void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            stopRefreshing();
            Long result = redis.execute(RELEASE_SCRIPT, List.of(key), value);
            if (result == null || result == 0L) {
                log.warn("Lock {} had already expired or changed owner at release", key);
            } else {
                log.debug("Released lock {}", key);
            }
        }

        private void refreshQuietly() {
            try {
                refresh();
            } catch (RuntimeException e) {
                // An exception escaping here would cancel the schedule. The next tick tries again.
                log.warn("Could not refresh lock {}: {}", key, e.getMessage());
            }
        }
    }
}
