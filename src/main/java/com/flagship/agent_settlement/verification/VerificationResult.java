package com.flagship.agent_settlement.verification;

import java.util.Objects;

/**
 * Result of one verification attempt.
 */
public final class VerificationResult {

    private final VerifiedTransfer transfer;
    private final VerificationFailure failure;
    private final String detail;

    private VerificationResult(VerifiedTransfer transfer, VerificationFailure failure, String detail) {
        this.transfer = transfer;
        this.failure = failure;
        this.detail = detail;
    }

    public static VerificationResult verified(VerifiedTransfer transfer) {
        return new VerificationResult(Objects.requireNonNull(transfer, "transfer"), null, null);
    }

    public static VerificationResult failed(VerificationFailure failure, String detail) {
        return new VerificationResult(null, Objects.requireNonNull(failure, "failure"), detail);
    }

    public boolean isVerified() {
        return transfer != null;
    }

    public VerifiedTransfer getTransfer() {
        return transfer;
    }

    public VerificationFailure getFailure() {
        return failure;
    }

    public String getDetail() {
        return detail;
    }
}
