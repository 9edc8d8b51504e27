package io.brokerguard.domain.credential;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Domain model for broker_credentials table.
 * One current row per brokerage account; every write produces a new version
 * and supersedes the previous one (rows are never deleted).
 *
 * version 0 is reserved for "no credential yet" in compare-and-swap calls.
 */
public record Credential(
    String accountKey,
    String accessToken,
    String refreshToken,
    Instant issuedAt,
    Instant accessExpiresAt,
    Instant refreshExpiresAt,
    long version,

    // Audit trail
    String writtenBy
) {
    public Credential {
        Objects.requireNonNull(accountKey, "accountKey");
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(refreshToken, "refreshToken");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(accessExpiresAt, "accessExpiresAt");
        Objects.requireNonNull(refreshExpiresAt, "refreshExpiresAt");
    }

    /**
     * True when the access token is expired or will expire within the margin.
     */
    public boolean needsRefresh(Instant now, Duration safetyMargin) {
        return !now.isBefore(accessExpiresAt.minus(safetyMargin));
    }

    public boolean isRefreshExpired(Instant now) {
        return !now.isBefore(refreshExpiresAt);
    }

    public Duration accessRemaining(Instant now) {
        return Duration.between(now, accessExpiresAt);
    }

    public Duration refreshRemaining(Instant now) {
        return Duration.between(now, refreshExpiresAt);
    }

    /**
     * First credential after an interactive OAuth completion. Version is assigned by the caller
     * (previous version + 1, or 1 when nothing was stored).
     */
    public static Credential seeded(
        String accountKey,
        OAuthTokens tokens,
        Instant now,
        Duration refreshTokenLifetime,
        long version,
        String writtenBy
    ) {
        Instant refreshExpiresAt = tokens.refreshExpiresIn() != null
            ? now.plus(tokens.refreshExpiresIn())
            : now.plus(refreshTokenLifetime);
        return new Credential(
            accountKey,
            tokens.accessToken(),
            tokens.refreshToken(),
            now,
            now.plus(tokens.expiresIn()),
            refreshExpiresAt,
            version,
            writtenBy
        );
    }

    /**
     * Create the next version after a refresh-token exchange (for immutable updates).
     * The refresh window is carried over unless the endpoint reported a new one.
     */
    public Credential refreshedWith(OAuthTokens tokens, Instant now, String writer) {
        String nextRefreshToken = tokens.refreshToken() != null ? tokens.refreshToken() : refreshToken;
        Instant nextRefreshExpiresAt = tokens.refreshExpiresIn() != null
            ? now.plus(tokens.refreshExpiresIn())
            : refreshExpiresAt;
        return new Credential(
            accountKey,
            tokens.accessToken(),
            nextRefreshToken,
            now,
            now.plus(tokens.expiresIn()),
            nextRefreshExpiresAt,
            version + 1,
            writer
        );
    }

    @Override
    public String toString() {
        return "Credential[accountKey=" + accountKey
            + ", version=" + version
            + ", accessExpiresAt=" + accessExpiresAt
            + ", refreshExpiresAt=" + refreshExpiresAt
            + ", writtenBy=" + writtenBy + "]";
    }
}
