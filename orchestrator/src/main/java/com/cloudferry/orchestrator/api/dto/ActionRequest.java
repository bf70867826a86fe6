package com.cloudferry.orchestrator.api.dto;

/** Optional body for retry and cancel. */
public record ActionRequest(String reason) {}
