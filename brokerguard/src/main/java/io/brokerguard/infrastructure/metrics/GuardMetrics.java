package io.brokerguard.infrastructure.metrics;

import io.brokerguard.domain.approval.ApprovalStatus;

import java.time.Duration;

/**
 * Metrics for the token lifecycle and the approval gate.
 *
 * Implementations can publish to Prometheus, CloudWatch, etc.
 */
public interface GuardMetrics {

    /**
     * Record the outcome of a refresh call.
     *
     * @param outcome EXCHANGED, ADOPTED, REJECTED, TRANSIENT_FAILURE, REFRESH_EXPIRED
     */
    void recordRefresh(String outcome);

    /**
     * Record one call to the OAuth token endpoint.
     *
     * @param outcome SUCCESS, TRANSIENT, REJECTED
     */
    void recordOAuthExchange(String outcome, Duration latency);

    void recordApprovalRequested();

    void recordApprovalOutcome(ApprovalStatus status);

    /**
     * @param reason UNAUTHORIZED, ALREADY_DECIDED, NOT_FOUND
     */
    void recordRejectedDecision(String reason);

    void recordNotifyFailure();

    void recordBypass();

    void setPendingWaiters(int count);

    /**
     * Metrics sink that discards everything.
     */
    static GuardMetrics noop() {
        return NoopGuardMetrics.INSTANCE;
    }

    final class NoopGuardMetrics implements GuardMetrics {
        private static final NoopGuardMetrics INSTANCE = new NoopGuardMetrics();

        private NoopGuardMetrics() {
        }

        @Override public void recordRefresh(String outcome) { }
        @Override public void recordOAuthExchange(String outcome, Duration latency) { }
        @Override public void recordApprovalRequested() { }
        @Override public void recordApprovalOutcome(ApprovalStatus status) { }
        @Override public void recordRejectedDecision(String reason) { }
        @Override public void recordNotifyFailure() { }
        @Override public void recordBypass() { }
        @Override public void setPendingWaiters(int count) { }
    }
}
