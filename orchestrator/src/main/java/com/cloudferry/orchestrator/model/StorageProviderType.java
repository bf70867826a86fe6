package com.cloudferry.orchestrator.model;

/**
 * Discriminator that selects the {@code StorageProviderHandler} for a destination.
 */
public enum StorageProviderType {
    GOOGLE_DRIVE,
    AWS_S3,
    ONE_DRIVE,
    DROPBOX
}
