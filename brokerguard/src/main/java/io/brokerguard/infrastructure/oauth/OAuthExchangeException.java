package io.brokerguard.infrastructure.oauth;

/**
 * Failure talking to the brokerage OAuth endpoint.
 *
 * Transient failures (network, HTTP 429, 5xx) may be retried; the rest mean the grant was rejected.
 */
public class OAuthExchangeException extends RuntimeException {

    private final boolean transientFailure;
    private final int httpStatus;

    public OAuthExchangeException(String message, boolean transientFailure, int httpStatus) {
        super(message);
        this.transientFailure = transientFailure;
        this.httpStatus = httpStatus;
    }

    public OAuthExchangeException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.httpStatus = -1;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * HTTP status returned by the endpoint, or -1 when no response was received.
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    @Override
    public String toString() {
        return String.format("[%s:%d] %s", transientFailure ? "TRANSIENT" : "REJECTED", httpStatus, getMessage());
    }
}
