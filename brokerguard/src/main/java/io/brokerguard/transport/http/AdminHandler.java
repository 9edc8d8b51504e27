package io.brokerguard.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.brokerguard.domain.credential.Credential;
import io.brokerguard.service.admin.ReauthService;
import io.brokerguard.service.token.TokenLifecycleException;
import io.brokerguard.service.token.TokenLifecycleManager;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.brokerguard.transport.http.JsonResponses.queryParam;
import static io.brokerguard.transport.http.JsonResponses.sendError;
import static io.brokerguard.transport.http.JsonResponses.sendJson;

/**
 * Admin service endpoints:
 * - GET  /admin/schwab/auth          - Start re-authentication (302 to the broker)
 * - GET  /admin/oauth/callback       - Broker redirect target (?code=...&state=...)
 * - POST /admin/credential/refresh   - Force a refresh now
 *
 * The callback is protected by the single-use state; the others sit behind {@code AdminTokenGuard}.
 */
public final class AdminHandler {
    private static final Logger log = LoggerFactory.getLogger(AdminHandler.class);

    private final ReauthService reauth;
    private final TokenLifecycleManager tokens;
    private final ObjectMapper mapper;

    public AdminHandler(ReauthService reauth, TokenLifecycleManager tokens, ObjectMapper mapper) {
        this.reauth = reauth;
        this.tokens = tokens;
        this.mapper = mapper;
    }

    /**
     * GET /admin/schwab/auth
     */
    public void startAuth(HttpServerExchange exchange) {
        try {
            String authorizeUrl = reauth.startLogin();
            exchange.setStatusCode(StatusCodes.FOUND);
            exchange.getResponseHeaders().put(Headers.LOCATION, authorizeUrl);
            exchange.endExchange();
        } catch (Exception e) {
            log.error("Failed to start OAuth login: {}", e.getMessage(), e);
            sendError(exchange, mapper, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to start OAuth login");
        }
    }

    /**
     * GET /admin/oauth/callback?code=xxx&state=yyy
     */
    public void callback(HttpServerExchange exchange) {
        String code = queryParam(exchange, "code");
        String state = queryParam(exchange, "state");
        if (code == null || code.isBlank() || state == null || state.isBlank()) {
            sendError(exchange, mapper, StatusCodes.BAD_REQUEST, "Missing 'code' or 'state' parameter");
            return;
        }

        try {
            ReauthService.ExchangeResult result = reauth.completeLogin(code, state);
            if (result.success()) {
                sendJson(exchange, mapper, result);
                return;
            }
            int status = switch (result.errorCode()) {
                case "MISSING_PARAMS", "STATE_NOT_FOUND", "STATE_EXPIRED", "STATE_ALREADY_USED",
                     "STATE_ACCOUNT_MISMATCH" -> StatusCodes.BAD_REQUEST;
                case "TOKEN_EXCHANGE_FAILED" -> StatusCodes.BAD_GATEWAY;
                default -> StatusCodes.INTERNAL_SERVER_ERROR;
            };
            sendJson(exchange, mapper, status, result);
        } catch (Exception e) {
            log.error("OAuth callback failed: {}", e.getMessage(), e);
            sendError(exchange, mapper, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to complete OAuth flow");
        }
    }

    /**
     * POST /admin/credential/refresh
     */
    public void forceRefresh(HttpServerExchange exchange) {
        try {
            Credential refreshed = tokens.refresh();
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("accountKey", refreshed.accountKey());
            response.put("version", refreshed.version());
            response.put("accessExpiresAt", refreshed.accessExpiresAt().toString());
            response.put("refreshExpiresAt", refreshed.refreshExpiresAt().toString());
            sendJson(exchange, mapper, response);
        } catch (TokenLifecycleException e) {
            sendError(exchange, mapper, StatusCodes.SERVICE_UNAVAILABLE, e.getMessage());
        } catch (Exception e) {
            log.error("Forced refresh failed: {}", e.getMessage(), e);
            sendError(exchange, mapper, StatusCodes.INTERNAL_SERVER_ERROR, "Refresh failed");
        }
    }
}
