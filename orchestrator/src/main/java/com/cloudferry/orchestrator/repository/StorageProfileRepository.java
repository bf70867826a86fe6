package com.cloudferry.orchestrator.repository;

import com.cloudferry.orchestrator.model.StorageProfile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface StorageProfileRepository extends JpaRepository<StorageProfile, UUID> {

    /** The owner's default destination, if they have an active one. */
    Optional<StorageProfile> findFirstByOwnerIdAndDefaultProfileTrueAndActiveTrue(Long ownerId);
}
