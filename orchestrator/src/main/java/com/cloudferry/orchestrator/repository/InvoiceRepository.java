package com.cloudferry.orchestrator.repository;

import com.cloudferry.orchestrator.model.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

    /** The paid, not yet refunded charge for a Job. There is at most one. */
    Optional<Invoice> findFirstByJobIdAndPaidAtIsNotNullAndRefundedAtIsNull(UUID jobId);
}
