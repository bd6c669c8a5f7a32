package com.flagship.agent_settlement.jackpot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * @param floor    pot size below which nothing is awarded
 * @param cooldown minimum time between two awards
 */
@Validated
@ConfigurationProperties(prefix = "settlement.jackpot")
public record JackpotProperties(BigDecimal floor, Duration cooldown) {

    public JackpotProperties {
        floor = floor == null ? new BigDecimal("100") : floor;
        cooldown = cooldown == null ? Duration.ofHours(24) : cooldown;
    }
}
