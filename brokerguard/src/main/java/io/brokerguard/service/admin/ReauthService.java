package io.brokerguard.service.admin;

import io.brokerguard.domain.credential.Credential;
import io.brokerguard.domain.credential.OAuthTokens;
import io.brokerguard.domain.model.OAuthState;
import io.brokerguard.infrastructure.oauth.OAuthEndpoint;
import io.brokerguard.infrastructure.oauth.OAuthExchangeException;
import io.brokerguard.repository.OAuthStateRepository;
import io.brokerguard.service.token.TokenLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Interactive re-authentication run by the admin service.
 *
 * 1. {@link #startLogin()} stores a single-use, expiring state and returns the broker authorize URL.
 * 2. The broker redirects back with code + state; {@link #completeLogin} validates the state, marks it used
 *    BEFORE exchanging (a page refresh cannot exchange twice), exchanges the code and force-seeds the credential.
 */
public class ReauthService {
    private static final Logger log = LoggerFactory.getLogger(ReauthService.class);

    private final OAuthStateRepository stateRepo;
    private final OAuthEndpoint oauth;
    private final TokenLifecycleManager tokens;
    private final String callbackUrl;
    private final Duration stateTtl;

    public ReauthService(OAuthStateRepository stateRepo, OAuthEndpoint oauth, TokenLifecycleManager tokens,
                         String callbackUrl, Duration stateTtl) {
        this.stateRepo = stateRepo;
        this.oauth = oauth;
        this.tokens = tokens;
        this.callbackUrl = callbackUrl;
        this.stateTtl = stateTtl;
    }

    /**
     * @return the broker authorize URL to redirect the operator to
     */
    public String startLogin() {
        String state = stateRepo.generateState(tokens.getAccountKey(), stateTtl);
        log.info("[OAUTH] Starting re-authentication for account={}", tokens.getAccountKey());
        return oauth.authorizeUrl(callbackUrl, state);
    }

    public ExchangeResult completeLogin(String code, String state) {
        log.info("[OAUTH] Received callback: state={}", state);

        if (code == null || code.isBlank() || state == null || state.isBlank()) {
            return ExchangeResult.failure("Missing code or state", "MISSING_PARAMS");
        }

        // 1. Validate state exists
        Optional<OAuthState> stateOpt = stateRepo.findByState(state);
        if (stateOpt.isEmpty()) {
            log.error("[OAUTH] State not found: {}", state);
            return ExchangeResult.failure("Invalid state parameter", "STATE_NOT_FOUND");
        }
        OAuthState oauthState = stateOpt.get();

        // 2. Expired or used
        if (oauthState.isExpired(Instant.now())) {
            log.error("[OAUTH] State expired: {} (expiresAt={})", state, oauthState.expiresAt());
            return ExchangeResult.failure("State expired", "STATE_EXPIRED");
        }
        if (oauthState.isAlreadyUsed()) {
            log.warn("[OAUTH] State already used: {}", state);
            return ExchangeResult.failure("State already used", "STATE_ALREADY_USED");
        }
        if (!tokens.getAccountKey().equals(oauthState.accountKey())) {
            log.error("[OAUTH] State {} was issued for account={}, not {}", state, oauthState.accountKey(), tokens.getAccountKey());
            return ExchangeResult.failure("State issued for another account", "STATE_ACCOUNT_MISMATCH");
        }

        // 3. Mark used BEFORE exchange
        if (!stateRepo.markUsed(state)) {
            log.warn("[OAUTH] Failed to mark state as used (concurrent callback?): {}", state);
            return ExchangeResult.failure("State already used", "STATE_ALREADY_USED");
        }

        // 4. Exchange code
        OAuthTokens exchanged;
        try {
            exchanged = oauth.exchangeAuthorizationCode(code, callbackUrl);
        } catch (OAuthExchangeException e) {
            log.error("[OAUTH] Code exchange failed: {}", e.getMessage());
            return ExchangeResult.failure("Token exchange failed: " + e.getMessage(), "TOKEN_EXCHANGE_FAILED");
        }
        if (exchanged.refreshToken() == null) {
            return ExchangeResult.failure("Token response carried no refresh token", "TOKEN_EXCHANGE_FAILED");
        }

        // 5. Seed (force: re-auth always replaces whatever is stored)
        Credential seeded = tokens.seed(exchanged, true, "admin-oauth");
        log.info("[OAUTH] ✅ Re-authenticated account={}, credential version {}, refresh token valid till {}",
            seeded.accountKey(), seeded.version(), seeded.refreshExpiresAt());
        return ExchangeResult.success(seeded);
    }

    public int cleanupExpiredStates() {
        return stateRepo.cleanupExpired();
    }

    /**
     * Result of the callback exchange. Never carries token values.
     */
    public record ExchangeResult(
        boolean success,
        String errorMessage,
        String errorCode,
        String accountKey,
        Long version,
        Instant accessExpiresAt,
        Instant refreshExpiresAt
    ) {
        public static ExchangeResult success(Credential credential) {
            return new ExchangeResult(true, null, null, credential.accountKey(), credential.version(),
                credential.accessExpiresAt(), credential.refreshExpiresAt());
        }

        public static ExchangeResult failure(String errorMessage, String errorCode) {
            return new ExchangeResult(false, errorMessage, errorCode, null, null, null, null);
        }
    }
}
