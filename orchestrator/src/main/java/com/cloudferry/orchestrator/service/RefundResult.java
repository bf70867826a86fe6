package com.cloudferry.orchestrator.service;

import java.math.BigDecimal;
import java.util.UUID;

public record RefundResult(UUID jobId, UUID invoiceId, BigDecimal amount) {}
