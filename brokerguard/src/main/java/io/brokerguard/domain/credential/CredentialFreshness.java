package io.brokerguard.domain.credential;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Read-only freshness report for status endpoints. Never carries token values.
 */
public record CredentialFreshness(
    String accountKey,
    CredentialState state,
    Long version,
    Instant issuedAt,
    Instant accessExpiresAt,
    Instant refreshExpiresAt,
    Long accessSecondsRemaining,
    Long refreshSecondsRemaining,
    boolean refreshTokenLikelyExpired,
    boolean refreshExpiringSoon
) {
    private static final Duration EXPIRING_SOON = Duration.ofDays(1);

    public static CredentialFreshness of(String accountKey, Optional<Credential> credential, Instant now) {
        if (credential.isEmpty()) {
            return new CredentialFreshness(accountKey, CredentialState.UNSEEDED,
                null, null, null, null, null, null, false, false);
        }

        Credential c = credential.get();
        boolean refreshExpired = c.isRefreshExpired(now);
        return new CredentialFreshness(
            accountKey,
            refreshExpired ? CredentialState.REFRESH_EXPIRED : CredentialState.LIVE,
            c.version(),
            c.issuedAt(),
            c.accessExpiresAt(),
            c.refreshExpiresAt(),
            c.accessRemaining(now).getSeconds(),
            c.refreshRemaining(now).getSeconds(),
            refreshExpired,
            !refreshExpired && c.refreshRemaining(now).compareTo(EXPIRING_SOON) < 0
        );
    }
}
