package com.cloudferry.orchestrator.model;

/**
 * Who caused a status change recorded in the timeline.
 */
public enum StatusChangeSource {
    USER,     // a user or admin acting through the API
    SYSTEM,   // the orchestrator itself: monitor, failure sync, auto-refund
    WORKER    // the worker currently executing the Job's task
}
