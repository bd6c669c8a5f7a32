package com.flagship.agent_settlement.gateway;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Either a completed item transfer or a demand for a fee payment.
 */
public final class ItemTransferResult {

    private final String transferId;
    private final FeeQuote feeQuote;

    private ItemTransferResult(String transferId, FeeQuote feeQuote) {
        this.transferId = transferId;
        this.feeQuote = feeQuote;
    }

    public static ItemTransferResult transferred(String transferId) {
        return new ItemTransferResult(Objects.requireNonNull(transferId, "transferId"), null);
    }

    public static ItemTransferResult paymentRequired(FeeQuote quote) {
        return new ItemTransferResult(null, Objects.requireNonNull(quote, "quote"));
    }

    public boolean isPaymentRequired() {
        return feeQuote != null;
    }

    public String getTransferId() {
        return transferId;
    }

    public FeeQuote getFeeQuote() {
        return feeQuote;
    }

    /**
     * Platform fee demanded before an item can move.
     */
    public record FeeQuote(String quoteId, BigDecimal amount, String itemRef) {
    }
}
