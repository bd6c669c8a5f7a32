package com.flagship.agent_settlement.exchange;

/**
 * @param initiatorChannel    chat channel the negotiation happens on
 * @param counterpartyId      who the agent is dealing with
 * @param counterpartyAddress optional wallet for currency the agent pays out
 * @param offered             what the agent gives
 * @param requested           what the counterparty gives
 */
public record ProposalCommand(
        String initiatorChannel,
        String counterpartyId,
        String counterpartyAddress,
        AssetDraft offered,
        AssetDraft requested
) {
}
