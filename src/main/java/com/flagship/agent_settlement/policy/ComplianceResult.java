package com.flagship.agent_settlement.policy;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Verdict of the compliance checker.
 * Stored as JSON on the exchange record and returned with policy violations.
 */
@Value
@Builder
@Jacksonized
public class ComplianceResult {
    boolean acceptable;
    String rule;
    BigDecimal profit;
    String reason;
    BigDecimal referenceValueUsed;
    /** Whole percent of the reference value the counter-side represents; null when the reference is zero. */
    BigDecimal percentageOfReference;
}
