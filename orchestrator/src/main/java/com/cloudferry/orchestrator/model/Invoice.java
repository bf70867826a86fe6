package com.cloudferry.orchestrator.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The charge attached to a Job.
 *
 * Pricing and payment capture happen elsewhere; the orchestrator only
 * reads paidAt and writes refundedAt when it triggers a refund.
 *
 * DB table: invoices
 */
@Entity
@Table(name = "invoices")
public class Invoice {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Invoice() {}   // required by JPA

    public Invoice(UUID jobId, Long ownerId, BigDecimal amount) {
        this.jobId   = jobId;
        this.ownerId = ownerId;
        this.amount  = amount;
    }

    public UUID       getId()         { return id; }
    public UUID       getJobId()      { return jobId; }
    public Long       getOwnerId()    { return ownerId; }
    public BigDecimal getAmount()     { return amount; }
    public Instant    getPaidAt()     { return paidAt; }
    public Instant    getRefundedAt() { return refundedAt; }

    public void setPaidAt(Instant paidAt)         { this.paidAt = paidAt; }
    public void setRefundedAt(Instant refundedAt) { this.refundedAt = refundedAt; }

    public boolean isRefundable() {
        return paidAt != null && refundedAt == null;
    }
}
