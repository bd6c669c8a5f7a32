package com.flagship.agent_settlement.exchange.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Operator note explaining how the failed transfer was reconciled.
 */
@Value
public class ReopenExchangeRequest {

    @NotBlank(message = "A reconciliation note is required")
    @Size(max = 500, message = "Note must be at most 500 characters")
    @JsonProperty("note")
    String note;
}
