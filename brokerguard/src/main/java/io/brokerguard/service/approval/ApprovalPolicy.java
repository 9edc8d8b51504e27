package io.brokerguard.service.approval;

import io.brokerguard.config.BrokerGuardConfig;

import java.time.Duration;
import java.util.Set;

/**
 * Who may decide, how long requests wait, and the operator bypass switch.
 * Any single configured approver decides a request.
 */
public record ApprovalPolicy(
    Set<String> approverIds,
    Duration defaultTimeout,
    Duration pollInterval,
    boolean bypass
) {
    public ApprovalPolicy {
        approverIds = Set.copyOf(approverIds);
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    public static ApprovalPolicy fromConfig(BrokerGuardConfig config) {
        return new ApprovalPolicy(
            config.approverIds(),
            config.approvalTimeout(),
            config.approvalPollInterval(),
            config.approvalBypass()
        );
    }

    public boolean isApprover(String identity) {
        return identity != null && approverIds.contains(identity);
    }
}
