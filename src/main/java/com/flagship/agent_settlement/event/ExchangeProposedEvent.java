package com.flagship.agent_settlement.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class ExchangeProposedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "ExchangeProposed";

    UUID eventId;
    UUID subjectId;
    String channel;
    String counterpartyId;
    String offered;
    String requested;
    BigDecimal expectedProfit;
    Instant expiresAt;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
