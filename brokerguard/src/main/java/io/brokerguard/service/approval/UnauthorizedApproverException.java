package io.brokerguard.service.approval;

/**
 * Decision from an identity that is not a configured approver. State is unchanged.
 */
public class UnauthorizedApproverException extends ApprovalGateException {
    private final String identity;

    public UnauthorizedApproverException(String approvalId, String identity) {
        super(approvalId, "Identity " + identity + " is not an authorized approver");
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }
}
