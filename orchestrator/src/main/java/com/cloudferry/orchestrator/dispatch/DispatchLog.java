package com.cloudferry.orchestrator.dispatch;

import java.util.Map;

/**
 * Durable, ordered, multi-consumer log. Consumers must tolerate redelivery.
 */
public interface DispatchLog {

    /** Job creation events, consumed by {@link JobDispatchConsumer}. */
    String JOBS_STREAM  = "jobs:stream";

    /** Cancellation notices for fetch workers. */
    String CANCEL_STREAM = "jobs:cancel";

    /**
     * Append an entry.
     *
     * @return the id the log assigned to the entry
     */
    String publish(String streamKey, Map<String, String> fields);
}
