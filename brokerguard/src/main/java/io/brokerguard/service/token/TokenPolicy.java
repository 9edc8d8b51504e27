package io.brokerguard.service.token;

import io.brokerguard.config.BrokerGuardConfig;
import io.brokerguard.infrastructure.common.RetryPolicy;

import java.time.Duration;

/**
 * Refresh policy knobs for {@link TokenLifecycleManager}.
 *
 * @param safetyMargin refresh when the access token has this much life left or less
 * @param refreshTokenLifetime assumed refresh-token lifetime when the endpoint does not report one
 * @param leaseTtl how long a replica may hold the refresh lease before others may take over
 * @param leasePollInterval how often a waiting replica re-reads the store while another holds the lease
 * @param proactiveInterval period of the background freshness check
 * @param credentialCacheTtl how long a fresh credential read from the store is served without re-reading; zero disables
 */
public record TokenPolicy(
    Duration safetyMargin,
    Duration refreshTokenLifetime,
    Duration leaseTtl,
    Duration leasePollInterval,
    RetryPolicy retryPolicy,
    Duration proactiveInterval,
    Duration credentialCacheTtl
) {
    public static TokenPolicy fromConfig(BrokerGuardConfig config) {
        RetryPolicy retry = RetryPolicy.builder()
            .initialDelay(config.refreshInitialBackoff())
            .maxDelay(config.refreshMaxBackoff())
            .multiplier(2.0)
            .maxAttempts(config.refreshMaxAttempts())
            .build();
        return new TokenPolicy(
            config.tokenSafetyMargin(),
            config.refreshTokenLifetime(),
            config.refreshLeaseTtl(),
            Duration.ofMillis(250),
            retry,
            config.proactiveRefreshInterval(),
            config.credentialCacheTtl()
        );
    }
}
