package com.flagship.agent_settlement.policy;

public enum AssetKind {
    CURRENCY,
    ITEM
}
