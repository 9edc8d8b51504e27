package io.brokerguard.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.domain.approval.ApprovalStatus;
import io.brokerguard.domain.credential.Credential;
import io.brokerguard.domain.credential.CredentialFreshness;
import io.brokerguard.repository.ApprovalStore;
import io.brokerguard.service.approval.ApprovalGate;
import io.brokerguard.service.token.TokenLifecycleManager;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.brokerguard.transport.http.JsonResponses.queryParam;
import static io.brokerguard.transport.http.JsonResponses.sendError;
import static io.brokerguard.transport.http.JsonResponses.sendJson;

/**
 * Read-only status endpoints:
 * - GET /api/health
 * - GET /api/status/credential - Credential freshness (never token values)
 * - GET /api/status/credential/history?limit=N - Stored credential versions, token values omitted
 * - GET /api/status/approvals  - Counts by status and recent outcomes
 */
public final class StatusHandler {
    private static final Logger log = LoggerFactory.getLogger(StatusHandler.class);
    private static final int RECENT_LIMIT = 20;
    private static final int MAX_HISTORY_LIMIT = 100;

    private final TokenLifecycleManager tokens;
    private final ApprovalStore approvalStore;
    private final ApprovalGate gate;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String runMode;

    public StatusHandler(TokenLifecycleManager tokens, ApprovalStore approvalStore, ApprovalGate gate,
                         ObjectMapper mapper, Clock clock, String runMode) {
        this.tokens = tokens;
        this.approvalStore = approvalStore;
        this.gate = gate;
        this.mapper = mapper;
        this.clock = clock;
        this.runMode = runMode;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "ok");
        health.put("runMode", runMode);
        health.put("time", clock.instant().toString());
        sendJson(exchange, mapper, health);
    }

    /**
     * GET /api/status/credential
     */
    public void credential(HttpServerExchange exchange) {
        try {
            CredentialFreshness freshness = tokens.freshness();
            sendJson(exchange, mapper, freshness);
        } catch (Exception e) {
            log.error("Failed to read credential status: {}", e.getMessage(), e);
            sendError(exchange, mapper, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to read credential status");
        }
    }

    /**
     * GET /api/status/credential/history
     */
    public void credentialHistory(HttpServerExchange exchange) {
        int limit;
        try {
            String raw = queryParam(exchange, "limit");
            limit = raw == null ? RECENT_LIMIT : Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            sendError(exchange, mapper, StatusCodes.BAD_REQUEST, "limit must be an integer");
            return;
        }
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            sendError(exchange, mapper, StatusCodes.BAD_REQUEST, "limit must be between 1 and " + MAX_HISTORY_LIMIT);
            return;
        }

        try {
            Map<String, Object> history = new LinkedHashMap<>();
            history.put("accountKey", tokens.getAccountKey());
            history.put("versions", tokens.history(limit).stream().map(StatusHandler::toVersionView).toList());
            sendJson(exchange, mapper, history);
        } catch (Exception e) {
            log.error("Failed to read credential history: {}", e.getMessage(), e);
            sendError(exchange, mapper, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to read credential history");
        }
    }

    static Map<String, Object> toVersionView(Credential credential) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("version", credential.version());
        view.put("issuedAt", credential.issuedAt().toString());
        view.put("accessExpiresAt", credential.accessExpiresAt().toString());
        view.put("refreshExpiresAt", credential.refreshExpiresAt().toString());
        view.put("writtenBy", credential.writtenBy());
        return view;
    }

    /**
     * GET /api/status/approvals
     */
    public void approvals(HttpServerExchange exchange) {
        try {
            Map<String, Object> status = new LinkedHashMap<>();

            Map<String, Long> counts = new LinkedHashMap<>();
            for (Map.Entry<ApprovalStatus, Long> entry : approvalStore.countByStatus().entrySet()) {
                counts.put(entry.getKey().name(), entry.getValue());
            }
            status.put("counts", counts);

            List<ApprovalRequest> recent = approvalStore.findRecent(RECENT_LIMIT);
            status.put("recent", recent.stream().map(ApprovalHandler::toView).toList());
            status.put("localWaiters", gate.pendingWaiterCount());
            status.put("bypass", gate.getPolicy().bypass());

            sendJson(exchange, mapper, status);
        } catch (Exception e) {
            log.error("Failed to read approval status: {}", e.getMessage(), e);
            sendError(exchange, mapper, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to read approval status");
        }
    }
}
