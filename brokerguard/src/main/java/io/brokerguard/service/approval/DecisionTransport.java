package io.brokerguard.service.approval;

import io.brokerguard.domain.approval.ApprovalRequest;

/**
 * Out-of-band channel that shows approval requests to a human.
 * Decisions come back through {@link ApprovalGate#recordDecision}.
 */
public interface DecisionTransport {

    /**
     * Deliver a new PENDING request. Called off the requesting thread; failures are logged, not fatal.
     *
     * @return a reference to what was posted (stored on the request so any replica can update it), or null
     * @throws DecisionTransportException when delivery failed
     */
    String notify(ApprovalRequest request);

    /**
     * Called best-effort after the request reached a terminal status, on whichever replica performed
     * the transition. {@link ApprovalRequest#transportRef()} carries the reference returned by notify.
     */
    default void onResolved(ApprovalRequest request) {
    }

    String name();
}
