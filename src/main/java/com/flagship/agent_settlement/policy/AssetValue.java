package com.flagship.agent_settlement.policy;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * What one side of an exchange gives.
 *
 * A currency amount is valued at its own quantity. A unique item is valued
 * at the best-effort estimate supplied by the caller or the value oracle.
 * Instances are validated on construction and are immutable once attached
 * to a record.
 */
@Value
public class AssetValue {
    AssetKind kind;
    BigDecimal quantity;
    String itemRef;
    BigDecimal estimatedReferenceValue;

    private AssetValue(AssetKind kind, BigDecimal quantity, String itemRef, BigDecimal estimatedReferenceValue) {
        this.kind = kind;
        this.quantity = quantity;
        this.itemRef = itemRef;
        this.estimatedReferenceValue = estimatedReferenceValue;
    }

    public static AssetValue currency(BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Currency quantity must be positive");
        }
        return new AssetValue(AssetKind.CURRENCY, quantity, null, quantity);
    }

    public static AssetValue item(String itemRef, BigDecimal estimatedReferenceValue) {
        if (itemRef == null || itemRef.isBlank()) {
            throw new IllegalArgumentException("Item reference is required");
        }
        if (estimatedReferenceValue == null || estimatedReferenceValue.signum() < 0) {
            throw new IllegalArgumentException("Item reference value must be zero or positive");
        }
        return new AssetValue(AssetKind.ITEM, null, itemRef, estimatedReferenceValue);
    }

    /**
     * Rebuilds a value from its stored columns.
     */
    public static AssetValue of(AssetKind kind, BigDecimal quantity, String itemRef, BigDecimal referenceValue) {
        Objects.requireNonNull(kind, "kind");
        return kind == AssetKind.CURRENCY ? currency(quantity) : item(itemRef, referenceValue);
    }

    public boolean isCurrency() {
        return kind == AssetKind.CURRENCY;
    }

    public boolean isItem() {
        return kind == AssetKind.ITEM;
    }

    /**
     * Value in the common reference unit.
     */
    public BigDecimal referenceValue() {
        return estimatedReferenceValue;
    }

    /**
     * Short label used in journal rows and notifications, e.g. {@code 9.5} or {@code item:plush-pepe-17}.
     */
    public String describe() {
        return isCurrency() ? quantity.stripTrailingZeros().toPlainString() : "item:" + itemRef;
    }
}
