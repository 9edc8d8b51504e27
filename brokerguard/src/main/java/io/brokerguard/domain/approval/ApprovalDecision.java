package io.brokerguard.domain.approval;

/**
 * A human decision delivered by a decision transport.
 */
public enum ApprovalDecision {
    APPROVE(ApprovalStatus.APPROVED),
    DENY(ApprovalStatus.DENIED);

    private final ApprovalStatus resultingStatus;

    ApprovalDecision(ApprovalStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public ApprovalStatus resultingStatus() {
        return resultingStatus;
    }

    /**
     * Lenient parse: accepts APPROVE/APPROVED/DENY/DENIED in any case.
     */
    public static ApprovalDecision parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("decision is required");
        }
        return switch (value.trim().toUpperCase()) {
            case "APPROVE", "APPROVED" -> APPROVE;
            case "DENY", "DENIED" -> DENY;
            default -> throw new IllegalArgumentException("Unknown decision: " + value);
        };
    }
}
