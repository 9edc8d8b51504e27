package io.brokerguard.service.approval;

/**
 * A decision transport could not deliver a notification.
 */
public class DecisionTransportException extends RuntimeException {
    public DecisionTransportException(String message) {
        super(message);
    }

    public DecisionTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
