package com.flagship.agent_settlement.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an exchange is cancelled. {@code wasAccepted} tells the
 * consumer whether the counterparty had already agreed and needs telling.
 */
@Value
public class ExchangeCancelledEvent implements SettlementEvent {
    public static final String EVENT_TYPE = "ExchangeCancelled";

    UUID eventId;
    UUID subjectId;
    String channel;
    String reason;
    boolean wasAccepted;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
