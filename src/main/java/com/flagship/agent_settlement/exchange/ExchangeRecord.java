package com.flagship.agent_settlement.exchange;

import com.flagship.agent_settlement.policy.AssetValue;
import com.flagship.agent_settlement.policy.ComplianceResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A negotiated exchange between the agent and one counterparty.
 *
 * {@code offered} is what the agent gives and {@code requested} is what the
 * counterparty gives. Records are never deleted; terminal states are kept
 * for audit.
 */
@Value
@Builder(toBuilder = true)
public class ExchangeRecord {
    UUID id;
    ExchangeStatus status;
    String initiatorChannel;
    String counterpartyId;
    /** Counterparty wallet for currency the agent sends, when not learned from a payment. */
    String counterpartyAddress;
    AssetValue offered;
    AssetValue requested;
    ComplianceResult complianceResult;
    boolean proposalDelivered;

    // verification
    String matchedTransferId;
    String payerAddress;
    Instant verifiedAt;

    // execution
    Instant claimedAt;
    Instant completedAt;
    String externalTransferId;
    String failureNote;

    Instant createdAt;
    Instant expiresAt;
    Instant updatedAt;
    String notes;

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isClaimed() {
        return claimedAt != null;
    }

    public String purposeTag() {
        return "exchange:" + id;
    }
}
