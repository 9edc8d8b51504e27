package io.brokerguard.service.approval;

public class ApprovalNotFoundException extends ApprovalGateException {
    public ApprovalNotFoundException(String approvalId) {
        super(approvalId, "No such approval request");
    }
}
