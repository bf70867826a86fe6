package com.cloudferry.orchestrator.api.dto;

/** Body of every non-2xx response. */
public record ErrorResponse(String code, String message, boolean retryable) {}
