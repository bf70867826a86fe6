package com.cloudferry.orchestrator.service;

import java.util.UUID;

public record JobCreationResult(UUID jobId, UUID destinationId) {}
