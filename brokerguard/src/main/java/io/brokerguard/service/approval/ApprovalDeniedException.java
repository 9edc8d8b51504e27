package io.brokerguard.service.approval;

/**
 * A human denied the action. It was not executed.
 */
public class ApprovalDeniedException extends ApprovalGateException {
    public ApprovalDeniedException(String approvalId, String toolName) {
        super(approvalId, "Action " + toolName + " was denied");
    }
}
