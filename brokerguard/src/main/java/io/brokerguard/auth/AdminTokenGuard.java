package io.brokerguard.auth;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Bearer-token check for operator endpoints.
 *
 * Compares {@code Authorization: Bearer <token>} against the configured admin token in constant time.
 * A blank configured token rejects every request.
 */
public final class AdminTokenGuard {
    private static final Logger log = LoggerFactory.getLogger(AdminTokenGuard.class);
    private static final String BEARER = "Bearer ";

    private final byte[] expected;

    public AdminTokenGuard(String adminToken) {
        this.expected = adminToken == null ? new byte[0] : adminToken.getBytes(StandardCharsets.UTF_8);
    }

    public boolean isAuthorized(String authorizationHeader) {
        if (expected.length == 0 || authorizationHeader == null || !authorizationHeader.startsWith(BEARER)) {
            return false;
        }
        byte[] presented = authorizationHeader.substring(BEARER.length()).trim().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, presented);
    }

    /**
     * Wrap a handler so it only runs for authorized callers; others get 401.
     */
    public HttpHandler protect(HttpHandler next) {
        return exchange -> {
            if (isAuthorized(exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION))) {
                next.handleRequest(exchange);
            } else {
                reject(exchange);
            }
        };
    }

    private static void reject(HttpServerExchange exchange) {
        log.warn("[AUTH] Rejected unauthenticated request: {} {}", exchange.getRequestMethod(), exchange.getRequestPath());
        exchange.setStatusCode(StatusCodes.UNAUTHORIZED);
        exchange.getResponseHeaders().put(Headers.WWW_AUTHENTICATE, "Bearer");
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send("{\"error\":\"Unauthorized\"}", StandardCharsets.UTF_8);
    }
}
