package com.cloudferry.orchestrator.model;

/**
 * Stage of work a {@link JobStatus} belongs to.
 *
 * Order matters: FETCH → STAGE → PUSH. Failed statuses keep the phase they
 * failed in, so a retry can tell where to resume. NONE covers the statuses
 * that are not tied to a phase (COMPLETED, CANCELLED, generic FAILED).
 */
public enum Phase {
    FETCH,
    STAGE,
    PUSH,
    NONE
}
