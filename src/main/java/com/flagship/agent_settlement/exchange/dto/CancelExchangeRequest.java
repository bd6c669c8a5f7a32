package com.flagship.agent_settlement.exchange.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CancelExchangeRequest {

    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;
}
