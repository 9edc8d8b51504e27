package io.brokerguard.service.approval;

/**
 * No decision arrived before the request expired. The action was not executed.
 */
public class ApprovalExpiredException extends ApprovalGateException {
    public ApprovalExpiredException(String approvalId, String toolName) {
        super(approvalId, "Approval for " + toolName + " timed out");
    }
}
