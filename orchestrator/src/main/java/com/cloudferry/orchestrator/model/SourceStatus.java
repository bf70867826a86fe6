package com.cloudferry.orchestrator.model;

/**
 * Readiness of a payload source. Only READY sources can be turned into Jobs.
 */
public enum SourceStatus {
    PENDING,
    READY,
    CORRUPTED
}
