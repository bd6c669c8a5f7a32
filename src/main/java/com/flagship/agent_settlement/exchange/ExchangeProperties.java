package com.flagship.agent_settlement.exchange;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * @param expiry how long a proposal stays open for acceptance and payment
 */
@Validated
@ConfigurationProperties(prefix = "settlement.exchange")
public record ExchangeProperties(Duration expiry) {

    public ExchangeProperties {
        expiry = expiry == null ? Duration.ofSeconds(120) : expiry;
        if (expiry.isZero() || expiry.isNegative()) {
            throw new IllegalArgumentException("settlement.exchange.expiry must be positive");
        }
    }
}
