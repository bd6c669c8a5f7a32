package com.flagship.agent_settlement.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SettlementFailedEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "SettlementFailed";

    UUID eventId;
    UUID subjectId;
    String subjectType;
    String channel;
    String failureNote;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
