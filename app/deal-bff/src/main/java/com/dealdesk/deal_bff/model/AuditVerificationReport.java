package com.dealdesk.deal_bff.model;

import java.time.Instant;

public record AuditVerificationReport(
    String dealId,
    boolean overallValid,
    ChainVerification local,
    AuthorityChainVerification authority,
    Instant verifiedAt) {}
