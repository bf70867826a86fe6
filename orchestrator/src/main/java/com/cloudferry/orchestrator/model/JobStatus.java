package com.cloudferry.orchestrator.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of states for a transfer Job.
 *
 * Happy path:
 *   QUEUED → FETCHING → STAGING → PENDING_PUSH → PUSHING → COMPLETED
 *
 * Each phase has a *_RETRY status (waiting for the scheduler to run the
 * task again) and a *_FAILED status (scheduler gave up). CANCELLED and the
 * generic FAILED sit outside any phase.
 *
 * Every constant declares its {@link Phase} and {@link StatusKind} exactly
 * once; all predicates below are derived from those two values, so a new
 * status cannot be forgotten by one of them.
 */
public enum JobStatus {

    QUEUED       (Phase.FETCH, StatusKind.RUNNING,   0),
    FETCHING     (Phase.FETCH, StatusKind.RUNNING,   1),
    FETCH_RETRY  (Phase.FETCH, StatusKind.RETRYING,  1),
    STAGING      (Phase.STAGE, StatusKind.RUNNING,   2),
    STAGE_RETRY  (Phase.STAGE, StatusKind.RETRYING,  2),
    PENDING_PUSH (Phase.PUSH,  StatusKind.RUNNING,   3),
    PUSH_RETRY   (Phase.PUSH,  StatusKind.RETRYING,  3),
    PUSHING      (Phase.PUSH,  StatusKind.RUNNING,   4),
    COMPLETED    (Phase.NONE,  StatusKind.COMPLETED, 5),
    CANCELLED    (Phase.NONE,  StatusKind.CANCELLED, -1),
    FETCH_FAILED (Phase.FETCH, StatusKind.FAILED,    -1),
    STAGE_FAILED (Phase.STAGE, StatusKind.FAILED,    -1),
    PUSH_FAILED  (Phase.PUSH,  StatusKind.FAILED,    -1),
    FAILED       (Phase.NONE,  StatusKind.FAILED,    -1);

    private final Phase      phase;
    private final StatusKind kind;
    // Position on the happy path; -1 for statuses a worker can never move to.
    private final int        rank;

    JobStatus(Phase phase, StatusKind kind, int rank) {
        this.phase = phase;
        this.kind  = kind;
        this.rank  = rank;
    }

    public Phase      phase() { return phase; }
    public StatusKind kind()  { return kind; }

    public boolean isActive()    { return kind.isActive(); }
    public boolean isTerminal()  { return kind.isTerminal(); }
    public boolean isRetrying()  { return kind == StatusKind.RETRYING; }
    public boolean isFailed()    { return kind == StatusKind.FAILED; }
    public boolean isCompleted() { return kind == StatusKind.COMPLETED; }
    public boolean isCancelled() { return kind == StatusKind.CANCELLED; }

    /**
     * Whether a worker may move a Job from this status to {@code target}.
     * Progression is forward-only; staying within the same rank is allowed
     * so that FETCH_RETRY → FETCHING and PUSHING → PUSHING work.
     */
    public boolean allowsWorkerTransitionTo(JobStatus target) {
        if (isTerminal() || target.rank < 0) {
            return false;
        }
        return target.rank >= this.rank;
    }

    /** The *_RETRY status of the given phase. */
    public static JobStatus retryStatusOf(Phase phase) {
        return switch (phase) {
            case FETCH -> FETCH_RETRY;
            case STAGE -> STAGE_RETRY;
            case PUSH  -> PUSH_RETRY;
            case NONE  -> throw new IllegalArgumentException("No retry status outside a phase");
        };
    }

    /** The *_FAILED status of the given phase, or the generic FAILED. */
    public static JobStatus failureStatusOf(Phase phase) {
        return switch (phase) {
            case FETCH -> FETCH_FAILED;
            case STAGE -> STAGE_FAILED;
            case PUSH  -> PUSH_FAILED;
            case NONE  -> FAILED;
        };
    }

    /** Every status of {@code phase}, whatever its kind. */
    public static Set<JobStatus> statusesOf(Phase phase) {
        EnumSet<JobStatus> set = EnumSet.noneOf(JobStatus.class);
        Arrays.stream(values())
                .filter(s -> s.phase == phase)
                .forEach(set::add);
        return set;
    }

    public static Set<JobStatus> terminalStatuses() {
        return matching(true);
    }

    public static Set<JobStatus> activeStatuses() {
        return matching(false);
    }

    private static Set<JobStatus> matching(boolean terminal) {
        EnumSet<JobStatus> set = EnumSet.noneOf(JobStatus.class);
        Arrays.stream(values())
                .filter(s -> s.isTerminal() == terminal)
                .forEach(set::add);
        return set;
    }
}
