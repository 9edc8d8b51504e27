package io.brokerguard.domain.credential;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a token exchange with the brokerage OAuth endpoint.
 *
 * @param refreshToken may be null when the endpoint does not rotate refresh tokens
 * @param refreshExpiresIn null when the endpoint does not report refresh-token lifetime
 */
public record OAuthTokens(
    String accessToken,
    String refreshToken,
    Duration expiresIn,
    Duration refreshExpiresIn
) {
    public OAuthTokens {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(expiresIn, "expiresIn");
    }

    @Override
    public String toString() {
        return "OAuthTokens[expiresIn=" + expiresIn + ", rotated=" + (refreshToken != null) + "]";
    }
}
