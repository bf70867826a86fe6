package com.cloudferry.orchestrator.service;

import com.cloudferry.orchestrator.lock.DistributedLock;
import com.cloudferry.orchestrator.lock.LockHandle;
import com.cloudferry.orchestrator.model.Actor;
import com.cloudferry.orchestrator.model.Invoice;
import com.cloudferry.orchestrator.model.Job;
import com.cloudferry.orchestrator.repository.InvoiceRepository;
import com.cloudferry.orchestrator.repository.JobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Gives back the charge for a Job that did not deliver.
 *
 * Refunds touch the owner's ledger, so they are serialised per owner with
 * the distributed lock {@code ledger:owner:{ownerId}}. The invoice update,
 * the refunded flag and the audit entry commit together under that lock.
 */
@Service
public class RefundService {

    private static final Logger log = LoggerFactory.getLogger(RefundService.class);

    static final Duration LOCK_TTL  = Duration.ofSeconds(30);
    static final Duration LOCK_WAIT = Duration.ofSeconds(2);

    private final JobRepository       jobRepo;
    private final InvoiceRepository   invoiceRepo;
    private final JobStatusService    statusService;
    private final DistributedLock     lock;
    private final TransactionTemplate tx;
    private final MeterRegistry       meterRegistry;

    public RefundService(JobRepository jobRepo,
                         InvoiceRepository invoiceRepo,
                         JobStatusService statusService,
                         DistributedLock lock,
                         PlatformTransactionManager txManager,
                         MeterRegistry meterRegistry) {
        this.jobRepo       = jobRepo;
        this.invoiceRepo   = invoiceRepo;
        this.statusService = statusService;
        this.lock          = lock;
        this.tx            = new TransactionTemplate(txManager);
        this.meterRegistry = meterRegistry;
    }

    /** Refund requested by a user or admin. Only failed Jobs qualify. */
    public OperationResult<RefundResult> refund(UUID jobId, Actor actor) {
        return refund(jobId, actor, false);
    }

    /**
     * @param auto true when called by the system right after a cancellation;
     *             only then does a CANCELLED Job qualify
     */
    public OperationResult<RefundResult> refund(UUID jobId, Actor actor, boolean auto) {
        Optional<Job> found = jobRepo.findById(jobId);
        if (found.isEmpty()) {
            return OperationResult.fail(JobErrorCode.JOB_NOT_FOUND, "Job " + jobId + " not found");
        }
        Job job = found.get();
        if (!actor.mayActOn(job)) {
            return OperationResult.fail(JobErrorCode.UNAUTHORIZED, "Not allowed to refund job " + jobId);
        }
        OperationResult<RefundResult> rejected = check(job, auto);
        if (rejected != null) {
            return rejected;
        }

        String key = "ledger:owner:" + job.getOwnerId();
        Optional<LockHandle> held;
        try {
            held = lock.acquire(key, LOCK_TTL, LOCK_WAIT);
        } catch (DataAccessException e) {
            log.warn("Ledger lock {} unavailable: {}", key, e.getMessage());
            return OperationResult.fail(JobErrorCode.BUSY, "Ledger lock unavailable, try again later");
        }
        if (held.isEmpty()) {
            return OperationResult.fail(JobErrorCode.BUSY, "Another ledger operation is running for this account");
        }

        try (LockHandle ignored = held.get()) {
            return tx.execute(status -> refundLocked(jobId, actor, auto));
        }
    }

    // Runs with the ledger lock held; state may have moved since the first read.
    private OperationResult<RefundResult> refundLocked(UUID jobId, Actor actor, boolean auto) {
        Job job = jobRepo.findByIdForUpdate(jobId).orElse(null);
        if (job == null) {
            return OperationResult.fail(JobErrorCode.JOB_NOT_FOUND, "Job " + jobId + " not found");
        }
        OperationResult<RefundResult> rejected = check(job, auto);
        if (rejected != null) {
            return rejected;
        }
        Invoice invoice = invoiceRepo.findFirstByJobIdAndPaidAtIsNotNullAndRefundedAtIsNull(jobId).orElseThrow();

        invoice.setRefundedAt(Instant.now());
        invoiceRepo.save(invoice);
        job.setRefunded(true);
        statusService.recordEvent(job, actor.source(), Metadata.of(
                "refunded", true,
                "amount", invoice.getAmount(),
                "invoiceId", invoice.getId(),
                "refundedBy", actor.userId(),
                "refundedByRole", actor.role(),
                "auto", auto));

        meterRegistry.counter("cloudferry.refunds", "auto", String.valueOf(auto)).increment();
        log.info("Refunded {} for job {} (owner={}, auto={})",
                invoice.getAmount(), jobId, job.getOwnerId(), auto);
        return OperationResult.ok(new RefundResult(jobId, invoice.getId(), invoice.getAmount()));
    }

    private OperationResult<RefundResult> check(Job job, boolean auto) {
        boolean eligible = job.getStatus().isFailed() || (auto && job.getStatus().isCancelled());
        if (!eligible) {
            return OperationResult.fail(JobErrorCode.JOB_NOT_FAILED,
                    "Only failed jobs can be refunded (status " + job.getStatus() + ")");
        }
        if (job.isRefunded()) {
            return OperationResult.fail(JobErrorCode.JOB_REFUNDED, "Job " + job.getId() + " was already refunded");
        }
        if (invoiceRepo.findFirstByJobIdAndPaidAtIsNotNullAndRefundedAtIsNull(job.getId()).isEmpty()) {
            return OperationResult.fail(JobErrorCode.NO_REFUNDABLE_CHARGE, "No paid charge for job " + job.getId());
        }
        return null;
    }
}
