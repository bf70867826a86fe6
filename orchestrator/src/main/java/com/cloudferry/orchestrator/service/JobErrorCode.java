package com.cloudferry.orchestrator.service;

/**
 * Expected, non-exceptional outcomes of orchestrator operations.
 *
 * Each code carries a {@link Category}; the REST layer maps categories to
 * HTTP statuses, and only {@link Category#TRANSIENT} codes are worth retrying.
 */
public enum JobErrorCode {

    JOB_NOT_FOUND         (Category.NOT_FOUND),
    SOURCE_NOT_FOUND      (Category.NOT_FOUND),
    UNAUTHORIZED          (Category.FORBIDDEN),

    SOURCE_NOT_READY      (Category.VALIDATION),
    NO_DESTINATION        (Category.VALIDATION),
    DESTINATION_INACTIVE  (Category.VALIDATION),
    NO_REFUNDABLE_CHARGE  (Category.VALIDATION),

    JOB_ALREADY_EXISTS    (Category.CONFLICT),
    JOB_RETRYING          (Category.CONFLICT),
    JOB_COMPLETED         (Category.CONFLICT),
    JOB_CANCELLED         (Category.CONFLICT),
    JOB_REFUNDED          (Category.CONFLICT),
    JOB_ACTIVE            (Category.CONFLICT),
    JOB_IN_PUSH_PHASE     (Category.CONFLICT),
    JOB_NOT_CANCELLABLE   (Category.CONFLICT),
    JOB_NOT_FAILED        (Category.CONFLICT),
    INVALID_TRANSITION    (Category.CONFLICT),
    // A worker called in with a handle the Job no longer holds.
    HANDLE_SUPERSEDED     (Category.CONFLICT),

    BUSY                  (Category.TRANSIENT),
    SCHEDULER_UNAVAILABLE (Category.TRANSIENT);

    public enum Category {
        NOT_FOUND,
        FORBIDDEN,
        VALIDATION,
        CONFLICT,
        TRANSIENT
    }

    private final Category category;

    JobErrorCode(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public boolean retryable() {
        return category == Category.TRANSIENT;
    }
}
