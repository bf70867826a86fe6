package com.cloudferry.orchestrator.handler.impl;

import com.cloudferry.orchestrator.dispatch.DispatchLog;
import com.cloudferry.orchestrator.handler.CancellationHandler;
import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.model.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tells fetch workers to abort a torrent and delete its local data.
 * Workers subscribe to {@link DispatchLog#CANCEL_STREAM}.
 */
@Component
public class TorrentCancellationHandler implements CancellationHandler {

    private static final Logger log = LoggerFactory.getLogger(TorrentCancellationHandler.class);

    private final DispatchLog dispatchLog;

    public TorrentCancellationHandler(DispatchLog dispatchLog) {
        this.dispatchLog = dispatchLog;
    }

    @Override
    public JobType type() {
        return JobType.TORRENT;
    }

    @Override
    public void cancel(Job job) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("jobId", job.getId().toString());
        fields.put("jobType", job.getType().name());
        if (job.getLocalPath() != null) {
            fields.put("localPath", job.getLocalPath());
        }
        String id = dispatchLog.publish(DispatchLog.CANCEL_STREAM, fields);
        log.info("Published cancel notice {} for job {}", id, job.getId());
    }
}
