package com.cloudferry.orchestrator.api.dto;

public record FailTaskRequest(String error) {}
