package com.flagship.agent_settlement.exchange;

import com.flagship.agent_settlement.policy.AssetKind;

import java.math.BigDecimal;

/**
 * One side of a proposal before valuation. An item's reference value may be
 * left out and is then looked up from the value oracle.
 */
public record AssetDraft(AssetKind kind, BigDecimal quantity, String itemRef, BigDecimal referenceValue) {

    public static AssetDraft currency(BigDecimal quantity) {
        return new AssetDraft(AssetKind.CURRENCY, quantity, null, null);
    }

    public static AssetDraft item(String itemRef, BigDecimal referenceValue) {
        return new AssetDraft(AssetKind.ITEM, null, itemRef, referenceValue);
    }
}
