package com.flagship.agent_settlement.gateway;

import java.time.Instant;

public record ReceivedItem(String itemId, String itemRef, String senderId, Instant receivedAt) {
}
