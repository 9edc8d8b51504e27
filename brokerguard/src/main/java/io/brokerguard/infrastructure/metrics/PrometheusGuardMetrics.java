package io.brokerguard.infrastructure.metrics;

import io.brokerguard.domain.approval.ApprovalStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of GuardMetrics.
 *
 * Key Metrics:
 * - brokerguard_token_refresh_total{outcome}
 * - brokerguard_oauth_exchange_total{outcome}, brokerguard_oauth_exchange_latency_seconds
 * - brokerguard_approval_requests_total
 * - brokerguard_approval_outcomes_total{status}
 * - brokerguard_approval_rejected_decisions_total{reason}
 * - brokerguard_decision_notify_failures_total
 * - brokerguard_approval_bypass_total
 * - brokerguard_approval_pending_waiters
 */
public class PrometheusGuardMetrics implements GuardMetrics {

    private final CollectorRegistry registry;

    private final Counter refreshCounter;
    private final Counter oauthExchangeCounter;
    private final Histogram oauthExchangeLatency;
    private final Counter approvalRequestCounter;
    private final Counter approvalOutcomeCounter;
    private final Counter rejectedDecisionCounter;
    private final Counter notifyFailureCounter;
    private final Counter bypassCounter;
    private final Gauge pendingWaiters;

    public PrometheusGuardMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusGuardMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.refreshCounter = Counter.build()
            .name("brokerguard_token_refresh_total")
            .help("Token refresh calls by outcome")
            .labelNames("outcome")
            .register(registry);

        this.oauthExchangeCounter = Counter.build()
            .name("brokerguard_oauth_exchange_total")
            .help("Calls to the brokerage OAuth token endpoint by outcome")
            .labelNames("outcome")
            .register(registry);

        this.oauthExchangeLatency = Histogram.build()
            .name("brokerguard_oauth_exchange_latency_seconds")
            .help("OAuth token endpoint latency in seconds")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        this.approvalRequestCounter = Counter.build()
            .name("brokerguard_approval_requests_total")
            .help("Approval requests created")
            .register(registry);

        this.approvalOutcomeCounter = Counter.build()
            .name("brokerguard_approval_outcomes_total")
            .help("Terminal approval transitions won by this replica")
            .labelNames("status")
            .register(registry);

        this.rejectedDecisionCounter = Counter.build()
            .name("brokerguard_approval_rejected_decisions_total")
            .help("Decisions rejected without changing state")
            .labelNames("reason")
            .register(registry);

        this.notifyFailureCounter = Counter.build()
            .name("brokerguard_decision_notify_failures_total")
            .help("Decision transport notifications that failed")
            .register(registry);

        this.bypassCounter = Counter.build()
            .name("brokerguard_approval_bypass_total")
            .help("Actions approved by the operator bypass switch")
            .register(registry);

        this.pendingWaiters = Gauge.build()
            .name("brokerguard_approval_pending_waiters")
            .help("Approval waits currently suspended in this replica")
            .register(registry);
    }

    @Override
    public void recordRefresh(String outcome) {
        refreshCounter.labels(outcome).inc();
    }

    @Override
    public void recordOAuthExchange(String outcome, Duration latency) {
        oauthExchangeCounter.labels(outcome).inc();
        oauthExchangeLatency.observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordApprovalRequested() {
        approvalRequestCounter.inc();
    }

    @Override
    public void recordApprovalOutcome(ApprovalStatus status) {
        approvalOutcomeCounter.labels(status.name()).inc();
    }

    @Override
    public void recordRejectedDecision(String reason) {
        rejectedDecisionCounter.labels(reason).inc();
    }

    @Override
    public void recordNotifyFailure() {
        notifyFailureCounter.inc();
    }

    @Override
    public void recordBypass() {
        bypassCounter.inc();
    }

    @Override
    public void setPendingWaiters(int count) {
        pendingWaiters.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
