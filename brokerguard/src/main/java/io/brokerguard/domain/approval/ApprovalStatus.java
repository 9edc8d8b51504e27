package io.brokerguard.domain.approval;

/**
 * Lifecycle of an approval request. Terminal states are write-once.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    DENIED,
    EXPIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
