package io.brokerguard.service.approval;

/**
 * The waiting caller went away. The action must not run even if a decision arrives later.
 */
public class ApprovalCancelledException extends ApprovalGateException {
    public ApprovalCancelledException(String approvalId) {
        super(approvalId, "Approval wait cancelled");
    }

    public ApprovalCancelledException(String approvalId, Throwable cause) {
        super(approvalId, "Approval wait cancelled", cause);
    }
}
