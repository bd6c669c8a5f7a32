package com.flagship.agent_settlement.verification;

import java.time.Instant;
import java.util.Objects;

/**
 * An expected inbound item.
 *
 * @param agentAccountId account whose inbound feed is polled
 * @param itemRef        reference of the item the counterparty promised
 * @param senderId       counterparty expected to send it
 * @param receivedAfter  receipts at or before this instant are ignored
 * @param purposeTag     what the receipt settles
 */
public record ItemExpectation(
        String agentAccountId,
        String itemRef,
        String senderId,
        Instant receivedAfter,
        String purposeTag
) {

    public ItemExpectation {
        Objects.requireNonNull(agentAccountId, "agentAccountId");
        Objects.requireNonNull(itemRef, "itemRef");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(receivedAfter, "receivedAfter");
        Objects.requireNonNull(purposeTag, "purposeTag");
    }
}
