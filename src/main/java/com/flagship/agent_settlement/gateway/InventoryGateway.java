package com.flagship.agent_settlement.gateway;

import java.util.List;

/**
 * The platform holding the agent's unique items.
 */
public interface InventoryGateway {

    List<ReceivedItem> listRecentlyReceivedItems(String accountId);

    /**
     * Sends an owned item. The platform may refuse until a transfer fee is
     * paid, in which case the result carries the fee quote instead of a
     * transfer id.
     */
    ItemTransferResult transferItem(String itemRef, String destinationId);

    /**
     * Pays the fee quoted in a payment-required response.
     */
    void payTransferFee(ItemTransferResult.FeeQuote quote);
}
