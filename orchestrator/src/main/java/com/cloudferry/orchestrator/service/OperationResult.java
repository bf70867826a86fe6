package com.cloudferry.orchestrator.service;

import java.util.Objects;

/**
 * Either a value or an expected failure. Orchestrator operations return this
 * instead of throwing for anything a caller can reasonably run into.
 */
public record OperationResult<T>(T value, JobErrorCode error, String message) {

    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(value, null, null);
    }

    public static <T> OperationResult<T> fail(JobErrorCode error, String message) {
        return new OperationResult<>(null, Objects.requireNonNull(error), message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** Re-type a failure; only valid when {@link #isSuccess()} is false. */
    public <U> OperationResult<U> asFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("Not a failure");
        }
        return new OperationResult<>(null, error, message);
    }
}
