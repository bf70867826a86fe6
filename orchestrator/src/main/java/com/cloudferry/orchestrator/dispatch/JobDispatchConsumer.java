package com.cloudferry.orchestrator.dispatch;

import com.cloudferry.orchestrator.service.JobErrorCode;
import com.cloudferry.orchestrator.service.JobService;
import com.cloudferry.orchestrator.service.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.UUID;

/**
 * Consumes job creation events from {@link DispatchLog#JOBS_STREAM}.
 *
 * Reads through a consumer group so every instance shares the stream, and
 * acknowledges an entry only after {@link JobService#ensureDispatched} has
 * succeeded. Unacknowledged entries stay pending and are read again (offset
 * 0) before new ones (offset &gt;) on the next poll.
 */
@Component
public class JobDispatchConsumer {

    private static final Logger log = LoggerFactory.getLogger(JobDispatchConsumer.class);

    static final String GROUP = "orchestrator";

    private final StringRedisTemplate redis;
    private final JobService          jobService;
    private final String              consumerName;
    private final int                 batchSize;

    private volatile boolean groupReady = false;

    public JobDispatchConsumer(StringRedisTemplate redis,
                               JobService jobService,
                               @Value("${cloudferry.dispatch.batch-size:20}") int batchSize) {
        this.redis        = redis;
        this.jobService   = jobService;
        this.batchSize    = batchSize;
        this.consumerName = consumerName();
    }

    @Scheduled(fixedDelayString = "${cloudferry.dispatch.poll-interval-ms:1000}")
    public void poll() {
        try {
            ensureGroup();
            StreamOperations<String, Object, Object> ops = redis.opsForStream();
            // Own pending entries first, then anything new.
            int handled = consume(ops, ReadOffset.from("0"));
            handled += consume(ops, ReadOffset.lastConsumed());
            if (handled > 0) {
                log.debug("Dispatch poll handled {} entr(ies)", handled);
            }
        } catch (DataAccessException e) {
            log.warn("Dispatch stream unavailable, retrying next poll: {}", e.getMessage());
        }
    }

    int consume(StreamOperations<String, Object, Object> ops, ReadOffset offset) {
        List<MapRecord<String, Object, Object>> records = ops.read(
                Consumer.from(GROUP, consumerName),
                StreamReadOptions.empty().count(batchSize),
                StreamOffset.create(DispatchLog.JOBS_STREAM, offset));
        if (records == null) {
            return 0;
        }
        for (MapRecord<String, Object, Object> record : records) {
            if (handle(record)) {
                ops.acknowledge(DispatchLog.JOBS_STREAM, GROUP, record.getId());
            }
        }
        return records.size();
    }

    /** @return true if the entry may be acknowledged */
    boolean handle(MapRecord<String, Object, Object> record) {
        Object raw = record.getValue().get("jobId");
        UUID jobId;
        try {
            jobId = UUID.fromString(String.valueOf(raw));
        } catch (IllegalArgumentException e) {
            log.error("Dropping dispatch entry {} without a valid jobId: {}", record.getId(), record.getValue());
            return true;
        }

        MDC.put("jobId", jobId.toString());
        try {
            OperationResult<Boolean> result = jobService.ensureDispatched(jobId);
            if (result.isSuccess()) {
                return true;
            }
            if (result.error() == JobErrorCode.JOB_NOT_FOUND) {
                log.warn("Dispatch entry {} refers to unknown job {}, acknowledging", record.getId(), jobId);
                return true;
            }
            log.warn("Dispatch of job {} failed ({}), entry {} stays pending", jobId, result.error(), record.getId());
            return false;
        } catch (RuntimeException e) {
            log.error("Dispatch of job {} threw, entry {} stays pending: {}", jobId, record.getId(), e.getMessage(), e);
            return false;
        } finally {
            MDC.remove("jobId");
        }
    }

    private void ensureGroup() {
        if (groupReady) {
            return;
        }
        try {
            redis.opsForStream().createGroup(DispatchLog.JOBS_STREAM, ReadOffset.from("0"), GROUP);
            log.info("Created consumer group '{}' on {}", GROUP, DispatchLog.JOBS_STREAM);
        } catch (DataAccessException e) {
            String message = String.valueOf(NestedExceptionUtils.getMostSpecificCause(e).getMessage());
            if (!message.contains("BUSYGROUP")) {
                throw e;
            }
        }
        groupReady = true;
    }

    private static String consumerName() {
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + ProcessHandle.current().pid();
        } catch (UnknownHostException e) {
            return "orchestrator-" + ProcessHandle.current().pid();
        }
    }
}
