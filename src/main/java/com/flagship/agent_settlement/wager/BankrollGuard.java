package com.flagship.agent_settlement.wager;

import com.flagship.agent_settlement.gateway.LedgerGateway;
import com.flagship.agent_settlement.verification.VerificationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Keeps every stake small enough that the treasury can cover the game's
 * best payout.
 */
@Component
@Slf4j
public class BankrollGuard {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final LedgerGateway ledgerGateway;
    private final WagerProperties properties;
    private final String treasuryAddress;

    public BankrollGuard(LedgerGateway ledgerGateway,
                         WagerProperties properties,
                         VerificationProperties verificationProperties) {
        this.ledgerGateway = ledgerGateway;
        this.properties = properties;
        this.treasuryAddress = verificationProperties.agentAddress();
    }

    public GuardDecision check(WagerGame game, BigDecimal stake) {
        if (stake.compareTo(properties.minStake()) < 0) {
            return GuardDecision.deny("Minimum stake is " + properties.minStake().toPlainString());
        }

        BigDecimal balance = ledgerGateway.balanceOf(treasuryAddress);
        if (balance == null || balance.compareTo(properties.minBankroll()) < 0) {
            log.warn("Treasury balance {} is below the minimum bankroll {}", balance, properties.minBankroll());
            return GuardDecision.deny("Wagers are paused: treasury is below the minimum bankroll");
        }

        BigDecimal maxStake = maxStake(game, balance);
        if (stake.compareTo(maxStake) > 0) {
            return GuardDecision.deny("Maximum stake for " + game + " is " + maxStake.toPlainString());
        }
        return GuardDecision.allow();
    }

    /**
     * {@code min(balance * maxStakePercent / 100, balance / maxMultiplier)}, rounded down.
     */
    public BigDecimal maxStake(WagerGame game, BigDecimal balance) {
        BigDecimal byPercent = balance.multiply(properties.maxStakePercent())
                .divide(HUNDRED, 4, RoundingMode.DOWN);
        BigDecimal byPayout = balance.divide(game.maxMultiplier(), 4, RoundingMode.DOWN);
        return byPercent.min(byPayout);
    }
}
