package com.cloudferry.orchestrator.scheduler;

/** Which phase of a Job a task runs. Staging happens inside the fetch task. */
public enum TaskKind {
    FETCH,
    PUSH
}
