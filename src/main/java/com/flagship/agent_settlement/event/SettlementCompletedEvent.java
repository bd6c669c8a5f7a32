package com.flagship.agent_settlement.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The agent's side of an exchange or a wager payout reached the
 * counterparty.
 */
@Value
public class SettlementCompletedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "SettlementCompleted";

    UUID eventId;
    UUID subjectId;
    String subjectType;
    String channel;
    String delivered;
    String destination;
    String externalTransferId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
