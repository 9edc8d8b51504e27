package io.brokerguard.domain.model;

import java.time.Instant;

/**
 * OAuth state parameter for the admin re-authentication callback.
 *
 * Purpose:
 * - CSRF protection (state must match between authorize redirect and callback)
 * - Survives admin replica restarts (DB-backed, not in-memory)
 * - Idempotency (used_at prevents duplicate code exchanges)
 * - Auto-expiry
 */
public record OAuthState(
        String state,
        String accountKey,
        Instant createdAt,
        Instant expiresAt,
        Instant usedAt,     // null = not used yet
        Instant deletedAt   // soft delete
) {
    public boolean isValid(Instant now) {
        return deletedAt == null
                && usedAt == null
                && expiresAt.isAfter(now);
    }

    public boolean isAlreadyUsed() {
        return usedAt != null;
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
