package io.brokerguard.domain.credential;

/**
 * Externally observable credential states. REFRESHING is internal to the
 * token manager and never reported.
 */
public enum CredentialState {
    UNSEEDED,
    LIVE,
    REFRESH_EXPIRED
}
