package com.flagship.agent_settlement.settlement;

import com.flagship.agent_settlement.policy.AssetKind;
import lombok.Value;

import java.math.BigDecimal;

/**
 * The agent's outbound obligation: what to send, and where.
 */
@Value
public class SettlementInstruction {
    AssetKind kind;
    BigDecimal amount;
    String itemRef;
    String destination;
    String memo;

    public static SettlementInstruction currency(BigDecimal amount, String destination, String memo) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payout amount must be positive");
        }
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("No destination address known for currency payout");
        }
        return new SettlementInstruction(AssetKind.CURRENCY, amount, null, destination, memo);
    }

    public static SettlementInstruction item(String itemRef, String destination) {
        if (itemRef == null || itemRef.isBlank()) {
            throw new IllegalArgumentException("Item reference is required");
        }
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("No destination known for item transfer");
        }
        return new SettlementInstruction(AssetKind.ITEM, null, itemRef, destination, null);
    }

    public String describe() {
        return kind == AssetKind.CURRENCY
                ? amount.stripTrailingZeros().toPlainString()
                : "item:" + itemRef;
    }
}
