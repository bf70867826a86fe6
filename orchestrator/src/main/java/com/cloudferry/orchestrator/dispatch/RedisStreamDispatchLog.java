package com.cloudferry.orchestrator.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.connection.stream.StringRecord;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * {@link DispatchLog} on Redis Streams: one XADD per publish.
 */
@Component
public class RedisStreamDispatchLog implements DispatchLog {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamDispatchLog.class);

    private final StringRedisTemplate redis;

    public RedisStreamDispatchLog(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public String publish(String streamKey, Map<String, String> fields) {
        StringRecord record = StreamRecords.string(fields).withStreamKey(streamKey);
        RecordId id = redis.opsForStream().add(record);
        if (id == null) {
            throw new IllegalStateException("XADD to " + streamKey + " returned no id");
        }
        log.debug("Published {} to {}: {}", id.getValue(), streamKey, fields);
        return id.getValue();
    }
}
