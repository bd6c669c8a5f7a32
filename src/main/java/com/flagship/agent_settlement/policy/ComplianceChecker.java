package com.flagship.agent_settlement.policy;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Evaluates a proposed exchange against the minimum-margin rules.
 *
 * <ul>
 *   <li>Buy (agent gives currency, gets an item): pay at most
 *       {@code reference * buyMaxMultiplier}.</li>
 *   <li>Sell (agent gives an item, gets currency): receive at least
 *       {@code reference * sellMinMultiplier}.</li>
 *   <li>Item for item: the received item is worth at least the given one.</li>
 *   <li>Currency for currency: receive at least what is given.</li>
 * </ul>
 *
 * Pure and deterministic: no I/O and no clock. Profit is always computed,
 * accepted or not, so admins can see how far off a rejected proposal was.
 */
@Component
public class ComplianceChecker {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal buyMaxMultiplier;
    private final BigDecimal sellMinMultiplier;

    public ComplianceChecker(BigDecimal buyMaxMultiplier, BigDecimal sellMinMultiplier) {
        this.buyMaxMultiplier = Objects.requireNonNull(buyMaxMultiplier, "buyMaxMultiplier");
        this.sellMinMultiplier = Objects.requireNonNull(sellMinMultiplier, "sellMinMultiplier");
    }

    @Autowired
    public ComplianceChecker(PolicyProperties properties) {
        this(properties.buyMaxMultiplier(), properties.sellMinMultiplier());
    }

    public ComplianceResult check(AssetValue offered, AssetValue requested) {
        Objects.requireNonNull(offered, "offered");
        Objects.requireNonNull(requested, "requested");

        BigDecimal profit = requested.referenceValue().subtract(offered.referenceValue());

        if (offered.isCurrency() && requested.isItem()) {
            return checkBuy(offered, requested, profit);
        }
        if (offered.isItem() && requested.isCurrency()) {
            return checkSell(offered, requested, profit);
        }
        if (offered.isItem()) {
            return checkNoLoss("SWAP: no value loss", offered.referenceValue(), requested.referenceValue(), profit);
        }
        return checkNoLoss("CURRENCY: no value loss", offered.getQuantity(), requested.getQuantity(), profit);
    }

    private ComplianceResult checkBuy(AssetValue offered, AssetValue requested, BigDecimal profit) {
        BigDecimal reference = requested.referenceValue();
        BigDecimal cap = reference.multiply(buyMaxMultiplier);
        BigDecimal paid = offered.getQuantity();
        BigDecimal percentage = percentage(paid, reference);
        String rule = "BUY: pay at most " + asPercent(buyMaxMultiplier) + "% of reference value";

        ComplianceResult.ComplianceResultBuilder result = ComplianceResult.builder()
                .rule(rule)
                .profit(profit)
                .referenceValueUsed(reference)
                .percentageOfReference(percentage);

        if (paid.compareTo(cap) <= 0) {
            return result.acceptable(true).build();
        }
        String reason = percentage == null
                ? String.format("Agent would pay %s for an item with no reference value; cap is %s%%",
                        plain(paid), asPercent(buyMaxMultiplier))
                : String.format("Agent would pay %s%% of reference value %s; cap is %s%% (%s)",
                        percentage.toPlainString(), plain(reference), asPercent(buyMaxMultiplier), plain(cap));
        return result.acceptable(false).reason(reason).build();
    }

    private ComplianceResult checkSell(AssetValue offered, AssetValue requested, BigDecimal profit) {
        BigDecimal reference = offered.referenceValue();
        BigDecimal floor = reference.multiply(sellMinMultiplier);
        BigDecimal received = requested.getQuantity();
        BigDecimal percentage = percentage(received, reference);
        String rule = "SELL: receive at least " + asPercent(sellMinMultiplier) + "% of reference value";

        ComplianceResult.ComplianceResultBuilder result = ComplianceResult.builder()
                .rule(rule)
                .profit(profit)
                .referenceValueUsed(reference)
                .percentageOfReference(percentage);

        if (received.compareTo(floor) >= 0) {
            return result.acceptable(true).build();
        }
        return result.acceptable(false)
                .reason(String.format("Agent would receive %s%% of reference value %s; floor is %s%% (%s)",
                        percentage.toPlainString(), plain(reference), asPercent(sellMinMultiplier), plain(floor)))
                .build();
    }

    private ComplianceResult checkNoLoss(String rule, BigDecimal given, BigDecimal received, BigDecimal profit) {
        ComplianceResult.ComplianceResultBuilder result = ComplianceResult.builder()
                .rule(rule)
                .profit(profit)
                .referenceValueUsed(given)
                .percentageOfReference(percentage(received, given));

        if (received.compareTo(given) >= 0) {
            return result.acceptable(true).build();
        }
        return result.acceptable(false)
                .reason(String.format("Agent would receive %s for %s given", plain(received), plain(given)))
                .build();
    }

    private static BigDecimal percentage(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return null;
        }
        return part.multiply(HUNDRED).divide(whole, 0, RoundingMode.HALF_UP);
    }

    private static String asPercent(BigDecimal multiplier) {
        return multiplier.multiply(HUNDRED).stripTrailingZeros().toPlainString();
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
