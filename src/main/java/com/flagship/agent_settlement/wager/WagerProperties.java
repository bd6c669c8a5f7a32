package com.flagship.agent_settlement.wager;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Limits applied before a wager is accepted.
 *
 * @param minStake         smallest accepted stake
 * @param maxStakePercent  largest stake as a percentage of the treasury
 * @param minBankroll      treasury below this refuses all wagers
 * @param cooldown         minimum gap between two wagers of one requester
 * @param houseEdgePercent share of every stake credited to the jackpot
 * @param paymentWindow    how long a placed wager waits for its stake
 * @param rateLimit        attempts allowed per requester
 */
@Validated
@ConfigurationProperties(prefix = "settlement.wager")
public record WagerProperties(
        BigDecimal minStake,
        BigDecimal maxStakePercent,
        BigDecimal minBankroll,
        Duration cooldown,
        BigDecimal houseEdgePercent,
        Duration paymentWindow,
        RateLimit rateLimit
) {

    public WagerProperties {
        minStake = minStake == null ? new BigDecimal("0.1") : minStake;
        maxStakePercent = maxStakePercent == null ? new BigDecimal("5") : maxStakePercent;
        minBankroll = minBankroll == null ? new BigDecimal("10") : minBankroll;
        cooldown = cooldown == null ? Duration.ofSeconds(30) : cooldown;
        houseEdgePercent = houseEdgePercent == null ? new BigDecimal("5") : houseEdgePercent;
        paymentWindow = paymentWindow == null ? Duration.ofMinutes(5) : paymentWindow;
        rateLimit = rateLimit == null ? new RateLimit(null, null, null) : rateLimit;
    }

    /**
     * @param maxAttempts attempts allowed inside one window
     * @param window      fixed window length
     * @param blockFor    how long a requester is refused after exceeding the window
     */
    public record RateLimit(Integer maxAttempts, Duration window, Duration blockFor) {

        public RateLimit {
            maxAttempts = maxAttempts == null ? 5 : maxAttempts;
            window = window == null ? Duration.ofSeconds(60) : window;
            blockFor = blockFor == null ? Duration.ofSeconds(300) : blockFor;
        }
    }
}
