package io.brokerguard.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.brokerguard.domain.approval.ApprovalDecision;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.service.approval.AlreadyDecidedException;
import io.brokerguard.service.approval.ApprovalGate;
import io.brokerguard.service.approval.ApprovalNotFoundException;
import io.brokerguard.service.approval.UnauthorizedApproverException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.brokerguard.transport.http.JsonResponses.pathParam;
import static io.brokerguard.transport.http.JsonResponses.sendError;
import static io.brokerguard.transport.http.JsonResponses.sendJson;

/**
 * HTTP handler for approval requests.
 *
 * - GET  /api/approvals/{id}           - Current state of one request
 * - POST /api/approvals/{id}/decision  - Record a decision: {"decision":"APPROVE|DENY","decidedBy":"..."}
 *
 * Must run on a worker thread (wrap in BlockingHandler).
 */
public final class ApprovalHandler {
    private static final Logger log = LoggerFactory.getLogger(ApprovalHandler.class);

    private final ApprovalGate gate;
    private final ObjectMapper mapper;

    public ApprovalHandler(ApprovalGate gate, ObjectMapper mapper) {
        this.gate = gate;
        this.mapper = mapper;
    }

    /**
     * GET /api/approvals/{id}
     */
    public void getApproval(HttpServerExchange exchange) {
        String id = pathParam(exchange, "id");
        try {
            gate.findRequest(id).ifPresentOrElse(
                request -> sendJson(exchange, mapper, toView(request)),
                () -> sendError(exchange, mapper, StatusCodes.NOT_FOUND, "Unknown approval request: " + id)
            );
        } catch (Exception e) {
            log.error("Failed to load approval {}: {}", id, e.getMessage(), e);
            sendError(exchange, mapper, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to load approval request");
        }
    }

    /**
     * POST /api/approvals/{id}/decision
     */
    public void postDecision(HttpServerExchange exchange) {
        String id = pathParam(exchange, "id");

        ApprovalDecision decision;
        String decidedBy;
        try {
            String body = new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            JsonNode json = mapper.readTree(body);
            decision = ApprovalDecision.parse(json.path("decision").asText(null));
            decidedBy = json.path("decidedBy").asText("");
            if (decidedBy.isBlank()) {
                sendError(exchange, mapper, StatusCodes.BAD_REQUEST, "decidedBy is required");
                return;
            }
        } catch (Exception e) {
            sendError(exchange, mapper, StatusCodes.BAD_REQUEST, "Invalid decision body: " + e.getMessage());
            return;
        }

        try {
            ApprovalRequest decided = gate.recordDecision(id, decision, decidedBy);
            sendJson(exchange, mapper, toView(decided));
        } catch (UnauthorizedApproverException e) {
            sendError(exchange, mapper, StatusCodes.FORBIDDEN, e.getMessage());
        } catch (ApprovalNotFoundException e) {
            sendError(exchange, mapper, StatusCodes.NOT_FOUND, e.getMessage());
        } catch (AlreadyDecidedException e) {
            Map<String, Object> conflict = new LinkedHashMap<>();
            conflict.put("error", e.getMessage());
            conflict.put("status", StatusCodes.CONFLICT);
            conflict.put("currentStatus", e.getCurrentStatus().name());
            sendJson(exchange, mapper, StatusCodes.CONFLICT, conflict);
        } catch (Exception e) {
            log.error("Failed to record decision on {}: {}", id, e.getMessage(), e);
            sendError(exchange, mapper, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to record decision");
        }
    }

    static Map<String, Object> toView(ApprovalRequest request) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", request.id());
        view.put("status", request.status().name());
        view.put("toolName", request.actionDescriptor().toolName());
        view.put("requestId", request.actionDescriptor().requestId());
        view.put("clientId", request.actionDescriptor().clientId());
        view.put("requestedBy", request.requestedBy());
        view.put("createdAt", request.createdAt().toString());
        view.put("expiresAt", request.expiresAt().toString());
        view.put("decidedBy", request.decidedBy());
        view.put("decidedAt", request.decidedAt() == null ? null : request.decidedAt().toString());
        return view;
    }
}
