package io.brokerguard.service.approval;

/**
 * Base class for approval gate failures. Carries the approval id.
 */
public class ApprovalGateException extends RuntimeException {
    private final String approvalId;

    public ApprovalGateException(String approvalId, String message) {
        super(String.format("[APPROVAL:%s] %s", approvalId, message));
        this.approvalId = approvalId;
    }

    public ApprovalGateException(String approvalId, String message, Throwable cause) {
        super(String.format("[APPROVAL:%s] %s", approvalId, message), cause);
        this.approvalId = approvalId;
    }

    public String getApprovalId() {
        return approvalId;
    }
}
