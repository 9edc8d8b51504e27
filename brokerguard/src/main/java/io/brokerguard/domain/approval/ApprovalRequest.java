package io.brokerguard.domain.approval;

import java.time.Instant;
import java.util.Objects;

/**
 * Domain model for approval_requests table.
 * Created PENDING; transitions exactly once to a terminal status and is then retained for audit.
 */
public record ApprovalRequest(
    String id,
    ActionDescriptor actionDescriptor,
    String requestedBy,
    Instant createdAt,
    Instant expiresAt,
    ApprovalStatus status,
    String decidedBy,
    Instant decidedAt,
    String transportRef   // where the decision transport posted it (e.g. a chat message id), may be null
) {
    public ApprovalRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(actionDescriptor, "actionDescriptor");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(status, "status");
    }

    /**
     * Create a new PENDING request.
     */
    public static ApprovalRequest pending(
        String id,
        ActionDescriptor actionDescriptor,
        String requestedBy,
        Instant createdAt,
        Instant expiresAt
    ) {
        return new ApprovalRequest(id, actionDescriptor, requestedBy, createdAt, expiresAt,
            ApprovalStatus.PENDING, null, null, null);
    }

    public boolean isPastDeadline(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Copy with a terminal status applied (for immutable updates).
     */
    public ApprovalRequest withTerminalStatus(ApprovalStatus newStatus, String decider, Instant when) {
        if (!newStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + newStatus);
        }
        return new ApprovalRequest(id, actionDescriptor, requestedBy, createdAt, expiresAt,
            newStatus, decider, when, transportRef);
    }

    public ApprovalRequest withTransportRef(String ref) {
        return new ApprovalRequest(id, actionDescriptor, requestedBy, createdAt, expiresAt,
            status, decidedBy, decidedAt, ref);
    }
}
