package io.brokerguard.config;

import io.brokerguard.util.Env;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Immutable runtime configuration for both the trading and the admin service.
 *
 * All operational policy (timeouts, retry/backoff, approvers, bypass) is named here
 * and loaded from the environment; nothing below is meant to be hard-coded elsewhere.
 */
public record BrokerGuardConfig(
    RunMode runMode,
    int port,

    // Database (shared by every replica)
    String dbUrl,
    String dbUser,
    String dbPassword,
    int dbPoolSize,

    // Brokerage OAuth
    String accountKey,
    String clientId,
    String clientSecret,
    String callbackUrl,
    String brokerBaseUrl,
    Duration tokenSafetyMargin,
    Duration refreshTokenLifetime,
    Duration refreshLeaseTtl,
    int refreshMaxAttempts,
    Duration refreshInitialBackoff,
    Duration refreshMaxBackoff,
    Duration proactiveRefreshInterval,
    Duration oauthStateTtl,
    Duration oauthConnectTimeout,
    Duration oauthRequestTimeout,
    Duration credentialCacheTtl,

    // Approval gate
    Duration approvalTimeout,
    Duration approvalPollInterval,
    Duration approvalSweepInterval,
    Set<String> approverIds,
    boolean approvalBypass,
    boolean approvalBypassAcknowledged,

    // Discord transport (optional)
    String discordBotToken,
    String discordChannelId,
    String discordPublicKey,

    // Admin
    String adminApiToken,
    boolean productionMode
) {

    public enum RunMode {
        TRADING,
        ADMIN;

        public static RunMode parse(String value) {
            if (value == null || value.isBlank()) {
                return TRADING;
            }
            return RunMode.valueOf(value.trim().toUpperCase());
        }
    }

    /**
     * Load configuration from environment variables (or system properties).
     */
    public static BrokerGuardConfig fromEnv() {
        return new BrokerGuardConfig(
            RunMode.parse(Env.get("RUN_MODE", "TRADING")),
            Env.getInt("PORT", 8080),

            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/brokerguard"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", ""),
            Env.getInt("DB_POOL_SIZE", 10),

            Env.get("BROKER_ACCOUNT_KEY", "default"),
            Env.get("SCHWAB_CLIENT_ID", ""),
            Env.get("SCHWAB_CLIENT_SECRET", ""),
            Env.get("SCHWAB_CALLBACK_URL", ""),
            Env.get("SCHWAB_BASE_URL", "https://api.schwabapi.com"),
            Env.getSeconds("TOKEN_SAFETY_MARGIN_SECONDS", 60),
            Duration.ofHours(Env.getLong("REFRESH_TOKEN_LIFETIME_HOURS", 168)),
            Env.getSeconds("REFRESH_LEASE_SECONDS", 30),
            Env.getInt("REFRESH_MAX_ATTEMPTS", 4),
            Env.getMillis("REFRESH_INITIAL_BACKOFF_MS", 500),
            Env.getMillis("REFRESH_MAX_BACKOFF_MS", 8000),
            Env.getSeconds("PROACTIVE_REFRESH_INTERVAL_SECONDS", 60),
            Duration.ofMinutes(Env.getLong("OAUTH_STATE_TTL_MINUTES", 15)),
            Env.getSeconds("OAUTH_CONNECT_TIMEOUT_SECONDS", 10),
            Env.getSeconds("OAUTH_REQUEST_TIMEOUT_SECONDS", 15),
            Env.getSeconds("TOKEN_CACHE_TTL_SECONDS", 5),

            Env.getSeconds("APPROVAL_TIMEOUT_SECONDS", 600),
            Env.getSeconds("APPROVAL_POLL_INTERVAL_SECONDS", 5),
            Env.getSeconds("APPROVAL_SWEEP_INTERVAL_SECONDS", 30),
            Env.getSet("APPROVAL_APPROVERS"),
            Env.getBool("APPROVAL_BYPASS", false),
            Env.getBool("APPROVAL_BYPASS_ACKNOWLEDGED", false),

            Env.get("DISCORD_BOT_TOKEN", ""),
            Env.get("DISCORD_CHANNEL_ID", ""),
            Env.get("DISCORD_PUBLIC_KEY", ""),

            Env.get("ADMIN_API_TOKEN", ""),
            Env.getBool("PRODUCTION_MODE", false)
        );
    }

    public boolean discordEnabled() {
        return !discordBotToken.isBlank() && !discordChannelId.isBlank();
    }

    /**
     * Return a list of validation errors, empty if valid.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (clientId.isBlank()) {
            errors.add("SCHWAB_CLIENT_ID is required");
        }
        if (clientSecret.isBlank()) {
            errors.add("SCHWAB_CLIENT_SECRET is required");
        }
        if (dbUrl.isBlank()) {
            errors.add("DB_URL is required");
        }
        if (accountKey.isBlank()) {
            errors.add("BROKER_ACCOUNT_KEY must not be blank");
        }
        if (tokenSafetyMargin.isNegative()) {
            errors.add("TOKEN_SAFETY_MARGIN_SECONDS must not be negative");
        }
        if (refreshMaxAttempts <= 0) {
            errors.add("REFRESH_MAX_ATTEMPTS must be positive");
        }
        if (oauthConnectTimeout.isZero() || oauthConnectTimeout.isNegative()
            || oauthRequestTimeout.isZero() || oauthRequestTimeout.isNegative()) {
            errors.add("OAUTH_CONNECT_TIMEOUT_SECONDS and OAUTH_REQUEST_TIMEOUT_SECONDS must be positive");
        }
        // The lease must outlive the slowest OAuth exchange made under it.
        Duration slowestExchange = oauthConnectTimeout.plus(oauthRequestTimeout);
        if (refreshLeaseTtl.compareTo(slowestExchange) <= 0) {
            errors.add("REFRESH_LEASE_SECONDS (" + refreshLeaseTtl.toSeconds() + "s) must be greater than "
                + "OAUTH_CONNECT_TIMEOUT_SECONDS + OAUTH_REQUEST_TIMEOUT_SECONDS (" + slowestExchange.toSeconds() + "s)");
        }
        if (credentialCacheTtl.isNegative()) {
            errors.add("TOKEN_CACHE_TTL_SECONDS must not be negative");
        }
        if (approvalTimeout.isZero() || approvalTimeout.isNegative()) {
            errors.add("APPROVAL_TIMEOUT_SECONDS must be positive");
        }
        if (approvalPollInterval.isZero() || approvalPollInterval.isNegative()) {
            errors.add("APPROVAL_POLL_INTERVAL_SECONDS must be positive");
        }

        switch (runMode) {
            case TRADING -> {
                if (!approvalBypass && approverIds.isEmpty()) {
                    errors.add("APPROVAL_APPROVERS must name at least one approver unless APPROVAL_BYPASS=true");
                }
                if (approvalBypass && productionMode && !approvalBypassAcknowledged) {
                    errors.add("APPROVAL_BYPASS in PRODUCTION_MODE requires APPROVAL_BYPASS_ACKNOWLEDGED=true");
                }
                if (!approvalBypass && !discordEnabled() && adminApiToken.isBlank()) {
                    errors.add("ADMIN_API_TOKEN is required to accept decisions over HTTP when Discord is not configured");
                }
                if (!discordBotToken.isBlank() && discordPublicKey.isBlank()) {
                    errors.add("DISCORD_PUBLIC_KEY is required to verify Discord interactions");
                }
            }
            case ADMIN -> {
                if (callbackUrl.isBlank()) {
                    errors.add("SCHWAB_CALLBACK_URL is required (admin service callback URL)");
                }
                if (adminApiToken.isBlank()) {
                    errors.add("ADMIN_API_TOKEN is required for the admin service");
                }
            }
        }
        return errors;
    }
}
