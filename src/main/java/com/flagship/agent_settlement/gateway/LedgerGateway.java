package com.flagship.agent_settlement.gateway;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Public ledger used to move and observe currency.
 *
 * Implementations wrap the ledger SDK and must apply their own bounded
 * timeouts. A failed submission is reported with {@link ExternalTransferException}.
 */
public interface LedgerGateway {

    /**
     * Broadcasts a transfer from the agent's wallet.
     *
     * @return the ledger's id for the submitted transfer
     */
    String submitTransfer(String destination, BigDecimal amount, String memo);

    /**
     * Lists inbound transfers to {@code address} no older than {@code since}.
     */
    List<ObservedTransfer> queryTransfers(String address, Instant since);

    BigDecimal balanceOf(String address);
}
