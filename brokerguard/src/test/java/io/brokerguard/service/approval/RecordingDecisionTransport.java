package io.brokerguard.service.approval;

import io.brokerguard.domain.approval.ApprovalRequest;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

/**
 * DecisionTransport for tests: remembers what it was asked to deliver.
 */
class RecordingDecisionTransport implements DecisionTransport {
    final List<ApprovalRequest> notified = new CopyOnWriteArrayList<>();
    final List<ApprovalRequest> resolved = new CopyOnWriteArrayList<>();
    volatile boolean failNotify;
    volatile String ref;
    volatile CountDownLatch holdNotify;

    @Override
    public String notify(ApprovalRequest request) {
        CountDownLatch hold = holdNotify;
        if (hold != null) {
            try {
                hold.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DecisionTransportException("interrupted", e);
            }
        }
        if (failNotify) {
            throw new DecisionTransportException("channel unavailable");
        }
        notified.add(request);
        return ref;
    }

    @Override
    public void onResolved(ApprovalRequest request) {
        resolved.add(request);
    }

    @Override
    public String name() {
        return "recording";
    }
}
