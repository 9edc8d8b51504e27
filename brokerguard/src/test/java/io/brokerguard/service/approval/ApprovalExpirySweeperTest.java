package io.brokerguard.service.approval;

import io.brokerguard.domain.approval.ActionDescriptor;
import io.brokerguard.domain.approval.ApprovalDecision;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.domain.approval.ApprovalStatus;
import io.brokerguard.infrastructure.metrics.GuardMetrics;
import io.brokerguard.repository.InMemoryApprovalStore;
import io.brokerguard.security.SecureAuditLogger;
import io.brokerguard.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The sweeper expires overdue requests whose waiting replica is gone.
 */
class ApprovalExpirySweeperTest {

    private static final Instant T0 = Instant.parse("2026-03-02T15:30:00Z");

    private MutableClock clock;
    private InMemoryApprovalStore store;
    private ApprovalGate gate;
    private ApprovalExpirySweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryApprovalStore();
        ApprovalPolicy policy = new ApprovalPolicy(Set.of("ops"), Duration.ofMinutes(10), Duration.ofSeconds(5), false);
        gate = new ApprovalGate(store, new RecordingDecisionTransport(), policy, clock, GuardMetrics.noop(),
            new SecureAuditLogger("test"));
        sweeper = new ApprovalExpirySweeper(store, gate, clock, Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        sweeper.stop();
        gate.shutdown();
    }

    private ApprovalRequest orphan(String id, Duration timeout) {
        // Inserted directly: nobody on this replica waits for it.
        ApprovalRequest request = ApprovalRequest.pending(id, ActionDescriptor.of("cancel_order", Map.of("orderId", id)),
            "crashed-replica", clock.instant(), clock.instant().plus(timeout));
        store.insert(request);
        return request;
    }

    @Test
    void testSweepExpiresOnlyOverdueRequests() {
        orphan("a", Duration.ofMinutes(1));
        orphan("b", Duration.ofMinutes(5));
        orphan("c", Duration.ofMinutes(20));

        clock.advance(Duration.ofMinutes(5));
        assertEquals(2, sweeper.sweep());

        assertEquals(ApprovalStatus.EXPIRED, store.findById("a").orElseThrow().status());
        assertEquals(ApprovalStatus.EXPIRED, store.findById("b").orElseThrow().status());
        assertEquals(ApprovalStatus.PENDING, store.findById("c").orElseThrow().status());
        assertEquals(ApprovalGate.SYSTEM_TIMEOUT, store.findById("a").orElseThrow().decidedBy());
    }

    @Test
    void testSweepLeavesDecidedRequestsAlone() {
        orphan("a", Duration.ofMinutes(1));
        gate.recordDecision("a", ApprovalDecision.APPROVE, "ops");

        clock.advance(Duration.ofMinutes(2));
        assertEquals(0, sweeper.sweep());
        assertEquals(ApprovalStatus.APPROVED, store.findById("a").orElseThrow().status());
    }

    @Test
    void testRepeatedSweepIsIdempotent() {
        orphan("a", Duration.ofMinutes(1));
        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, sweeper.sweep());
        assertEquals(0, sweeper.sweep());
    }
}
