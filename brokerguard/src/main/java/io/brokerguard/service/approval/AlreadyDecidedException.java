package io.brokerguard.service.approval;

import io.brokerguard.domain.approval.ApprovalStatus;

/**
 * The request already reached a terminal status (double click, decision after timeout, lost race).
 */
public class AlreadyDecidedException extends ApprovalGateException {
    private final ApprovalStatus currentStatus;

    public AlreadyDecidedException(String approvalId, ApprovalStatus currentStatus) {
        super(approvalId, "Already " + currentStatus);
        this.currentStatus = currentStatus;
    }

    public ApprovalStatus getCurrentStatus() {
        return currentStatus;
    }
}
