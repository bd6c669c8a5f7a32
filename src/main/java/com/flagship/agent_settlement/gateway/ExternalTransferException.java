package com.flagship.agent_settlement.gateway;

/**
 * Raised by a gateway when an outbound transfer was rejected or could not
 * be confirmed.
 */
public class ExternalTransferException extends RuntimeException {

    public ExternalTransferException(String message) {
        super(message);
    }

    public ExternalTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
