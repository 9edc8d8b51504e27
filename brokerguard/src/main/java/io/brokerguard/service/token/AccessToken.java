package io.brokerguard.service.token;

import io.brokerguard.domain.credential.Credential;

import java.time.Instant;

/**
 * Access token handed to brokerage callers.
 */
public record AccessToken(String value, Instant expiresAt, long credentialVersion) {

    static AccessToken from(Credential credential) {
        return new AccessToken(credential.accessToken(), credential.accessExpiresAt(), credential.version());
    }

    @Override
    public String toString() {
        return "AccessToken[version=" + credentialVersion + ", expiresAt=" + expiresAt + "]";
    }
}
