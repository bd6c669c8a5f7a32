package com.flagship.agent_settlement.exchange.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agent_settlement.exchange.ProposalCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ProposeExchangeRequest {

    @NotBlank(message = "Initiator channel is required")
    @JsonProperty("initiator_channel")
    String initiatorChannel;

    @NotBlank(message = "Counterparty id is required")
    @JsonProperty("counterparty_id")
    String counterpartyId;

    @JsonProperty("counterparty_address")
    String counterpartyAddress;

    @NotNull(message = "Offered asset is required")
    @Valid
    @JsonProperty("offered")
    AssetRequest offered;

    @NotNull(message = "Requested asset is required")
    @Valid
    @JsonProperty("requested")
    AssetRequest requested;

    public ProposalCommand toCommand() {
        return new ProposalCommand(initiatorChannel, counterpartyId, counterpartyAddress,
                offered.toDraft(), requested.toDraft());
    }
}
