package com.flagship.agent_settlement.verification;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * An expected inbound currency payment.
 *
 * @param recipient              wallet the payment must reach
 * @param amount                 nominal amount owed
 * @param earliestAcceptableTime transfers stamped before this are ignored
 * @param correlationTag         value the payer must put in the memo
 * @param purposeTag             what the payment settles, e.g. {@code exchange:<id>}
 * @param claimantId             who is paying
 */
public record CurrencyExpectation(
        String recipient,
        BigDecimal amount,
        Instant earliestAcceptableTime,
        String correlationTag,
        String purposeTag,
        String claimantId
) {

    public CurrencyExpectation {
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(earliestAcceptableTime, "earliestAcceptableTime");
        Objects.requireNonNull(correlationTag, "correlationTag");
        Objects.requireNonNull(purposeTag, "purposeTag");
        if (correlationTag.isBlank()) {
            throw new IllegalArgumentException("Correlation tag must not be blank");
        }
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Expected amount must be positive");
        }
    }
}
