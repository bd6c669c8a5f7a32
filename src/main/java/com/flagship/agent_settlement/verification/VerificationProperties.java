package com.flagship.agent_settlement.verification;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Matching rules for inbound transfers.
 *
 * @param agentAddress       ledger wallet the counterparty pays into
 * @param agentAccountId     inventory account that receives items
 * @param toleranceRatio     a transfer matches when {@code amount >= expected * toleranceRatio}
 * @param maxPaymentAge      transfers older than this are never matched
 * @param clockSkewTolerance how far before the request a transfer may be timestamped
 */
@Validated
@ConfigurationProperties(prefix = "settlement.verification")
public record VerificationProperties(
        @NotBlank String agentAddress,
        @NotBlank String agentAccountId,
        BigDecimal toleranceRatio,
        Duration maxPaymentAge,
        Duration clockSkewTolerance
) {

    public VerificationProperties {
        toleranceRatio = toleranceRatio == null ? new BigDecimal("0.99") : toleranceRatio;
        maxPaymentAge = maxPaymentAge == null ? Duration.ofMinutes(10) : maxPaymentAge;
        clockSkewTolerance = clockSkewTolerance == null ? Duration.ofMinutes(2) : clockSkewTolerance;
    }
}
