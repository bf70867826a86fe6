package com.cloudferry.orchestrator.model;

/**
 * Discriminator that selects the {@code JobTypeHandler}, {@code CancellationHandler}
 * and {@code RecoveryStrategy} for a Job.
 */
public enum JobType {
    TORRENT
}
