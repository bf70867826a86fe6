package com.cloudferry.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's configured push destination (a Drive folder, an S3 bucket, ...).
 *
 * Only the fields the orchestrator needs live here; credentials are owned
 * by the storage collaborators.
 *
 * DB table: storage_profiles
 */
@Entity
@Table(name = "storage_profiles")
public class StorageProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider_type", nullable = false)
    private StorageProviderType providerType;

    // Deactivated profiles keep existing Jobs readable but block retries.
    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "is_default", nullable = false)
    private boolean defaultProfile = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected StorageProfile() {}   // required by JPA

    public StorageProfile(Long ownerId, String name, StorageProviderType providerType) {
        this.ownerId      = ownerId;
        this.name         = name;
        this.providerType = providerType;
    }

    public UUID                getId()           { return id; }
    public Long                getOwnerId()      { return ownerId; }
    public String              getName()         { return name; }
    public StorageProviderType getProviderType() { return providerType; }
    public boolean             isActive()        { return active; }
    public boolean             isDefaultProfile(){ return defaultProfile; }
    public Instant             getCreatedAt()    { return createdAt; }

    public void setActive(boolean active)                 { this.active = active; }
    public void setDefaultProfile(boolean defaultProfile) { this.defaultProfile = defaultProfile; }

    public boolean isUsableBy(Long userId) {
        return active && ownerId != null && ownerId.equals(userId);
    }
}
