package com.flagship.agent_settlement.verification;

public enum VerificationFailure {
    /** Nothing matched yet; retry until the obligation expires. */
    NOT_FOUND,
    AMBIGUOUS_MULTIPLE_MATCHES,
    /** The only matching transfer already settled a different obligation. */
    ALREADY_CONSUMED
}
