package com.cloudferry.orchestrator.handler;

import com.cloudferry.orchestrator.model.JobType;
import com.cloudferry.orchestrator.model.StorageProviderType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * In-process handler registry.
 *
 * Every handler bean declared as a Spring {@code @Component} is collected
 * once, at startup, via constructor injection and keyed by its
 * discriminator. Two beans claiming the same key abort startup; a lookup for
 * a key nobody claimed throws {@link HandlerNotFoundException}. There is no
 * fallback handler.
 */
@Component
public class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<JobType, JobTypeHandler>                         jobTypes;
    private final Map<StorageProviderType, StorageProviderHandler>     storageProviders;
    private final Map<JobType, CancellationHandler>                    cancellations;
    private final Map<JobType, RecoveryStrategy>                       recoveries;

    public HandlerRegistry(List<JobTypeHandler> jobTypeHandlers,
                           List<StorageProviderHandler> storageHandlers,
                           List<CancellationHandler> cancellationHandlers,
                           List<RecoveryStrategy> recoveryStrategies,
                           MeterRegistry meterRegistry) {
        this.jobTypes         = index("job type handler", JobType.class, jobTypeHandlers, JobTypeHandler::type);
        this.storageProviders = index("storage provider handler", StorageProviderType.class, storageHandlers, StorageProviderHandler::type);
        this.cancellations    = index("cancellation handler", JobType.class, cancellationHandlers, CancellationHandler::type);
        this.recoveries       = index("recovery strategy", JobType.class, recoveryStrategies, RecoveryStrategy::type);

        meterRegistry.gauge("cloudferry.handlers.registered", Tags.of("axis", "job_type"), jobTypes, Map::size);
        meterRegistry.gauge("cloudferry.handlers.registered", Tags.of("axis", "storage_provider"), storageProviders, Map::size);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public JobTypeHandler jobType(JobType type) {
        return require("job type handler", jobTypes, type);
    }

    public StorageProviderHandler storageProvider(StorageProviderType type) {
        return require("storage provider handler", storageProviders, type);
    }

    public CancellationHandler cancellation(JobType type) {
        return require("cancellation handler", cancellations, type);
    }

    public RecoveryStrategy recovery(JobType type) {
        return require("recovery strategy", recoveries, type);
    }

    /** All recovery strategies, one per job type that has one. */
    public Collection<RecoveryStrategy> recoveryStrategies() {
        return Collections.unmodifiableCollection(recoveries.values());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static <K extends Enum<K>, H> Map<K, H> index(String axis,
                                                          Class<K> keyType,
                                                          List<H> handlers,
                                                          Function<H, K> key) {
        Map<K, H> map = new EnumMap<>(keyType);
        for (H handler : handlers) {
            K k = key.apply(handler);
            H previous = map.putIfAbsent(k, handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate " + axis + " for '" + k + "': "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
            log.info("Registered {} '{}' -> {}", axis, k, handler.getClass().getSimpleName());
        }
        return Collections.unmodifiableMap(map);
    }

    private static <K extends Enum<K>, H> H require(String axis, Map<K, H> map, K key) {
        H handler = map.get(key);
        if (handler == null) {
            throw new HandlerNotFoundException(axis, key);
        }
        return handler;
    }
}
