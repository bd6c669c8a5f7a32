package com.flagship.agent_settlement.settlement;

import com.flagship.agent_settlement.gateway.ExternalTransferException;
import com.flagship.agent_settlement.gateway.InventoryGateway;
import com.flagship.agent_settlement.gateway.ItemTransferResult;
import com.flagship.agent_settlement.gateway.LedgerGateway;
import com.flagship.agent_settlement.policy.AssetKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Performs the external half of a settlement.
 *
 * Item transfers may come back "payment required": the platform wants a
 * fee first. The fee is paid and the transfer resubmitted exactly once; a
 * second demand is treated as a failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssetMover {

    private final LedgerGateway ledgerGateway;
    private final InventoryGateway inventoryGateway;

    /**
     * @return external id of the completed transfer
     * @throws ExternalTransferException when the transfer did not happen
     */
    public String move(SettlementInstruction instruction) {
        return instruction.getKind() == AssetKind.CURRENCY
                ? sendCurrency(instruction)
                : sendItem(instruction);
    }

    private String sendCurrency(SettlementInstruction instruction) {
        String transferId = ledgerGateway.submitTransfer(
                instruction.getDestination(), instruction.getAmount(), instruction.getMemo());
        if (transferId == null || transferId.isBlank()) {
            throw new ExternalTransferException("Ledger accepted the transfer but returned no transfer id");
        }
        log.info("Sent {} to {}: transferId={}", instruction.getAmount(), instruction.getDestination(), transferId);
        return transferId;
    }

    private String sendItem(SettlementInstruction instruction) {
        ItemTransferResult result = inventoryGateway.transferItem(instruction.getItemRef(), instruction.getDestination());
        if (result == null) {
            throw new ExternalTransferException("Inventory returned no result for item " + instruction.getItemRef());
        }

        if (result.isPaymentRequired()) {
            ItemTransferResult.FeeQuote quote = result.getFeeQuote();
            log.info("Item {} requires a transfer fee of {} (quote {}), paying and resubmitting",
                    instruction.getItemRef(), quote.amount(), quote.quoteId());
            inventoryGateway.payTransferFee(quote);

            result = inventoryGateway.transferItem(instruction.getItemRef(), instruction.getDestination());
            if (result != null && result.isPaymentRequired()) {
                throw new ExternalTransferException(
                        "Item " + instruction.getItemRef() + " still requires payment after fee quote " + quote.quoteId());
            }
        }

        String transferId = result == null ? null : result.getTransferId();
        if (transferId == null || transferId.isBlank()) {
            throw new ExternalTransferException(
                    "Inventory accepted item " + instruction.getItemRef() + " but returned no transfer id");
        }
        log.info("Sent item {} to {}: transferId={}", instruction.getItemRef(), instruction.getDestination(), transferId);
        return transferId;
    }
}
