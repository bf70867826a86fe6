package com.cloudferry.orchestrator.model;

/**
 * What a status means for the lifecycle, independent of its phase.
 *
 * RUNNING and RETRYING are the active kinds; the other three are terminal.
 */
public enum StatusKind {
    RUNNING,
    RETRYING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isActive() {
        return this == RUNNING || this == RETRYING;
    }

    public boolean isTerminal() {
        return !isActive();
    }
}
