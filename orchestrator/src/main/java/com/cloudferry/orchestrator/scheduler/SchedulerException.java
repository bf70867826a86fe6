package com.cloudferry.orchestrator.scheduler;

/**
 * Thrown when the task store cannot be reached or rejects an operation.
 * Callers treat it as transient.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
