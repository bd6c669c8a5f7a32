package com.flagship.agent_settlement.policy;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Minimum-margin trading rules.
 *
 * @param buyMaxMultiplier  the agent pays at most this fraction of an item's reference value
 * @param sellMinMultiplier the agent receives at least this multiple of an item's reference value
 */
@Validated
@ConfigurationProperties(prefix = "settlement.policy")
public record PolicyProperties(
        @NotNull @DecimalMin("0.0") BigDecimal buyMaxMultiplier,
        @NotNull @DecimalMin("0.0") BigDecimal sellMinMultiplier
) {

    public PolicyProperties {
        buyMaxMultiplier = buyMaxMultiplier == null ? new BigDecimal("0.80") : buyMaxMultiplier;
        sellMinMultiplier = sellMinMultiplier == null ? new BigDecimal("1.15") : sellMinMultiplier;
    }
}
