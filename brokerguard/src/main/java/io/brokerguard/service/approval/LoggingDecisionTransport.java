package io.brokerguard.service.approval;

import io.brokerguard.domain.approval.ApprovalRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport used when no chat integration is configured: the request is logged and an operator decides
 * through POST /api/approvals/{id}/decision.
 */
public class LoggingDecisionTransport implements DecisionTransport {
    private static final Logger log = LoggerFactory.getLogger(LoggingDecisionTransport.class);

    @Override
    public String notify(ApprovalRequest request) {
        log.warn("[APPROVAL] ⚠️ Approval needed: id={}, tool={}, requested_by={}, expires_at={}. "
                + "Decide with POST /api/approvals/{}/decision",
            request.id(), request.actionDescriptor().toolName(), request.requestedBy(),
            request.expiresAt(), request.id());
        return null;
    }

    @Override
    public void onResolved(ApprovalRequest request) {
        log.info("[APPROVAL] Request {} resolved: {} (by {})", request.id(), request.status(), request.decidedBy());
    }

    @Override
    public String name() {
        return "log";
    }
}
