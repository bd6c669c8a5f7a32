package com.flagship.agent_settlement.exchange.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agent_settlement.exchange.AssetDraft;
import com.flagship.agent_settlement.policy.AssetKind;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One side of a proposed exchange. Currency needs {@code quantity}; an item
 * needs {@code item_ref} and may omit {@code reference_value} to have it
 * estimated.
 */
@Value
public class AssetRequest {

    @NotNull(message = "Asset kind is required")
    @JsonProperty("kind")
    AssetKind kind;

    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("item_ref")
    String itemRef;

    @DecimalMin(value = "0", message = "Reference value cannot be negative")
    @JsonProperty("reference_value")
    BigDecimal referenceValue;

    public AssetDraft toDraft() {
        return new AssetDraft(kind, quantity, itemRef, referenceValue);
    }
}
