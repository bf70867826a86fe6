package com.cloudferry.orchestrator.api;

import com.cloudferry.orchestrator.api.dto.ErrorResponse;
import com.cloudferry.orchestrator.model.Actor;
import com.cloudferry.orchestrator.model.ActorRole;
import com.cloudferry.orchestrator.service.JobErrorCode;
import com.cloudferry.orchestrator.service.OperationResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps {@link OperationResult} to HTTP.
 *
 * NOT_FOUND → 404, FORBIDDEN → 403, CONFLICT → 409, VALIDATION → 422,
 * TRANSIENT → 503 with a Retry-After header.
 */
final class Responses {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String ROLE_HEADER    = "X-User-Role";

    private Responses() {}

    static ResponseEntity<?> of(OperationResult<?> result, HttpStatus onSuccess) {
        if (result.isSuccess()) {
            return ResponseEntity.status(onSuccess).body(result.value());
        }
        return error(result.error(), result.message());
    }

    static ResponseEntity<ErrorResponse> error(JobErrorCode code, String message) {
        ErrorResponse body = new ErrorResponse(code.name(), message, code.retryable());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(statusOf(code));
        if (code.retryable()) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(code)));
        }
        return builder.body(body);
    }

    static HttpStatus statusOf(JobErrorCode code) {
        return switch (code.category()) {
            case NOT_FOUND  -> HttpStatus.NOT_FOUND;
            case FORBIDDEN  -> HttpStatus.FORBIDDEN;
            case CONFLICT   -> HttpStatus.CONFLICT;
            case VALIDATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSIENT  -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    /** Identity from the plain headers. SYSTEM is reserved for in-process callers. */
    static Actor actor(Long userId, ActorRole role) {
        if (role == ActorRole.SYSTEM) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Role SYSTEM cannot be claimed by a client");
        }
        return role == ActorRole.ADMIN ? Actor.admin(userId) : Actor.user(userId);
    }

    private static int retryAfterSeconds(JobErrorCode code) {
        return code == JobErrorCode.BUSY ? 2 : 30;
    }
}
