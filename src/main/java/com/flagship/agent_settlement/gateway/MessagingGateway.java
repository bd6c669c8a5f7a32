package com.flagship.agent_settlement.gateway;

import java.util.UUID;

/**
 * Chat transport used to reach the counterparty.
 */
public interface MessagingGateway {

    /**
     * @return whether the interactive proposal card reached the channel
     */
    boolean deliverProposalCard(String channel, UUID recordId);

    void notify(String channel, String text);
}
