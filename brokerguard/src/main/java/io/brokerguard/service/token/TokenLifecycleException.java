package io.brokerguard.service.token;

/**
 * Base class for failures serving a valid brokerage access token.
 */
public class TokenLifecycleException extends RuntimeException {
    private final String accountKey;

    public TokenLifecycleException(String accountKey, String message) {
        super(String.format("[TOKEN:%s] %s", accountKey, message));
        this.accountKey = accountKey;
    }

    public TokenLifecycleException(String accountKey, String message, Throwable cause) {
        super(String.format("[TOKEN:%s] %s", accountKey, message), cause);
        this.accountKey = accountKey;
    }

    public String getAccountKey() {
        return accountKey;
    }
}
