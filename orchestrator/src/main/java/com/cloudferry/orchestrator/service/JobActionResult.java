package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.model.JobStatus;

import java.util.UUID;

/** Outcome of a retry or cancel: where the Job ended up. */
public record JobActionResult(UUID jobId, JobStatus status) {}
