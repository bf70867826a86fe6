package com.cloudferry.orchestrator.api;

import com.cloudferry.orchestrator.api.dto.ErrorResponse;
import com.cloudferry.orchestrator.handler.HandlerNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Last line of defence for unexpected exceptions.
 *
 * Expected outcomes never get here: services return them as
 * OperationResult. Spring's own request errors (missing header, bad UUID,
 * ResponseStatusException) keep their 4xx statuses via the base class.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(HandlerNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlerMissing(HandlerNotFoundException e) {
        log.error("Handler configuration error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("HANDLER_NOT_FOUND", e.getMessage(), false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("Unhandled error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Unexpected error", false));
    }
}
