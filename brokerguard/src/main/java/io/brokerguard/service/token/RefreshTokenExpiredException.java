package io.brokerguard.service.token;

import java.time.Instant;

/**
 * The refresh token is past its expiry. Terminal until an operator re-authenticates.
 */
public class RefreshTokenExpiredException extends TokenLifecycleException {
    private final Instant refreshExpiresAt;

    public RefreshTokenExpiredException(String accountKey, Instant refreshExpiresAt) {
        super(accountKey, "Refresh token expired at " + refreshExpiresAt + "; re-authentication required");
        this.refreshExpiresAt = refreshExpiresAt;
    }

    public Instant getRefreshExpiresAt() {
        return refreshExpiresAt;
    }
}
