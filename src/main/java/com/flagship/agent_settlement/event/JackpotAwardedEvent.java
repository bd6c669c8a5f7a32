package com.flagship.agent_settlement.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class JackpotAwardedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "JackpotAwarded";

    UUID eventId;
    /** Id of the award; the jackpot row itself is a singleton. */
    UUID subjectId;
    String channel;
    String winnerId;
    BigDecimal amount;
    String externalTransferId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
