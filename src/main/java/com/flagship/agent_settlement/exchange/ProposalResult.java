package com.flagship.agent_settlement.exchange;

import com.flagship.agent_settlement.policy.ComplianceResult;
import lombok.Value;

/**
 * Compliance verdict of a proposal, plus the record when one was created.
 */
@Value
public class ProposalResult {
    ExchangeRecord record;
    ComplianceResult compliance;
}
