package io.brokerguard.service.token;

/**
 * Refresh failed for a retryable reason and the retry budget ran out.
 */
public class RefreshTransientException extends TokenLifecycleException {
    public RefreshTransientException(String accountKey, String message) {
        super(accountKey, message);
    }

    public RefreshTransientException(String accountKey, String message, Throwable cause) {
        super(accountKey, message, cause);
    }
}
