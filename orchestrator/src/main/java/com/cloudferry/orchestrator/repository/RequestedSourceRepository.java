package com.cloudferry.orchestrator.repository;

import com.cloudferry.orchestrator.model.RequestedSource;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface RequestedSourceRepository extends JpaRepository<RequestedSource, UUID> {

    Optional<RequestedSource> findByIdAndOwnerId(UUID id, Long ownerId);
}
