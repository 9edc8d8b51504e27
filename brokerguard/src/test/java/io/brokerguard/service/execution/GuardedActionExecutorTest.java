package io.brokerguard.service.execution;

import io.brokerguard.domain.approval.ActionDescriptor;
import io.brokerguard.domain.approval.ApprovalDecision;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.domain.approval.ApprovalStatus;
import io.brokerguard.infrastructure.metrics.GuardMetrics;
import io.brokerguard.repository.InMemoryApprovalStore;
import io.brokerguard.security.SecureAuditLogger;
import io.brokerguard.service.approval.AlreadyDecidedException;
import io.brokerguard.service.approval.ApprovalDeniedException;
import io.brokerguard.service.approval.ApprovalExpiredException;
import io.brokerguard.service.approval.ApprovalGate;
import io.brokerguard.service.approval.ApprovalPolicy;
import io.brokerguard.service.approval.LoggingDecisionTransport;
import io.brokerguard.service.token.AccessToken;
import io.brokerguard.service.token.TokenLifecycleManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GuardedActionExecutor: the action runs only after approval, with a valid token.
 */
class GuardedActionExecutorTest {

    private static final String APPROVER = "ops-1";

    private InMemoryApprovalStore store;
    private TokenLifecycleManager tokens;
    private ExecutorService pool;
    private ApprovalGate gate;
    private final AtomicInteger executions = new AtomicInteger();

    @BeforeEach
    void setUp() {
        store = new InMemoryApprovalStore();
        tokens = mock(TokenLifecycleManager.class);
        when(tokens.getValidToken()).thenReturn(
            new AccessToken("live-token", Instant.now().plus(Duration.ofMinutes(20)), 7));
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        if (gate != null) {
            gate.shutdown();
        }
        pool.shutdownNow();
    }

    private GuardedActionExecutor executor(Duration timeout, boolean bypass) {
        ApprovalPolicy policy = new ApprovalPolicy(Set.of(APPROVER), timeout, Duration.ofMillis(20), bypass);
        gate = new ApprovalGate(store, new LoggingDecisionTransport(), policy, Clock.systemUTC(),
            GuardMetrics.noop(), new SecureAuditLogger("test"));
        return new GuardedActionExecutor(gate, tokens, pool);
    }

    private static ActionDescriptor order() {
        return ActionDescriptor.of("place_equity_order", Map.of("symbol", "MSFT", "quantity", 5));
    }

    private ActionExecutor<String> placeOrder() {
        return (action, token) -> {
            executions.incrementAndGet();
            return "order-for-" + token.value();
        };
    }

    private ApprovalRequest awaitPendingRequest() throws InterruptedException {
        waitUntil(() -> gate.pendingWaiterCount() == 1);
        List<ApprovalRequest> recent = store.findRecent(1);
        assertEquals(ApprovalStatus.PENDING, recent.get(0).status());
        return recent.get(0);
    }

    @Test
    void testApprovedActionRunsWithValidToken() throws Exception {
        GuardedActionExecutor guarded = executor(Duration.ofMinutes(5), false);

        CompletableFuture<String> result = guarded.executeAsync(order(), "mcp-client", placeOrder());
        assertEquals(0, executions.get(), "nothing runs before a decision");

        ApprovalRequest request = awaitPendingRequest();
        gate.recordDecision(request.id(), ApprovalDecision.APPROVE, APPROVER);

        assertEquals("order-for-live-token", result.get(2, TimeUnit.SECONDS));
        assertEquals(1, executions.get());
        verify(tokens, times(1)).getValidToken();
    }

    @Test
    void testBlockingExecuteRunsAfterApproval() throws Exception {
        GuardedActionExecutor guarded = executor(Duration.ofMinutes(5), false);

        CompletableFuture<String> result = CompletableFuture.supplyAsync(
            () -> guarded.execute(order(), "mcp-client", placeOrder()), pool);
        ApprovalRequest request = awaitPendingRequest();
        gate.recordDecision(request.id(), ApprovalDecision.APPROVE, APPROVER);

        assertEquals("order-for-live-token", result.get(2, TimeUnit.SECONDS));
    }

    @Test
    void testDeniedActionNeverRuns() throws Exception {
        GuardedActionExecutor guarded = executor(Duration.ofMinutes(5), false);

        CompletableFuture<String> result = guarded.executeAsync(order(), "mcp-client", placeOrder());
        ApprovalRequest request = awaitPendingRequest();
        gate.recordDecision(request.id(), ApprovalDecision.DENY, APPROVER);

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertInstanceOf(ApprovalDeniedException.class, e.getCause());
        assertTrue(e.getCause().getMessage().contains(request.id()));
        assertEquals(0, executions.get());
        verify(tokens, never()).getValidToken();
    }

    @Test
    void testExpiredActionNeverRuns() {
        GuardedActionExecutor guarded = executor(Duration.ofMillis(200), false);

        assertThrows(ApprovalExpiredException.class, () -> guarded.execute(order(), "mcp-client", placeOrder()));

        assertEquals(0, executions.get());
        assertEquals(ApprovalStatus.EXPIRED, store.findRecent(1).get(0).status());
    }

    @Test
    void testCancelledCallerNeverRuns() throws Exception {
        GuardedActionExecutor guarded = executor(Duration.ofMinutes(5), false);

        CompletableFuture<String> result = guarded.executeAsync(order(), "mcp-client", placeOrder());
        ApprovalRequest request = awaitPendingRequest();
        result.cancel(true);

        assertEquals(ApprovalStatus.CANCELLED, store.findById(request.id()).orElseThrow().status());
        assertThrows(AlreadyDecidedException.class,
            () -> gate.recordDecision(request.id(), ApprovalDecision.APPROVE, APPROVER));
        Thread.sleep(100);
        assertEquals(0, executions.get());
    }

    @Test
    void testBypassRunsImmediately() throws Exception {
        GuardedActionExecutor guarded = executor(Duration.ofMinutes(5), true);

        assertEquals("order-for-live-token", guarded.execute(order(), "mcp-client", placeOrder()));
        assertEquals("order-for-live-token",
            guarded.executeAsync(order(), "mcp-client", placeOrder()).get(2, TimeUnit.SECONDS));
        assertEquals(2, executions.get());
        assertTrue(store.findRecent(10).isEmpty());
    }

    @Test
    void testCheckedFailureIsWrapped() {
        GuardedActionExecutor guarded = executor(Duration.ofMinutes(5), true);

        ActionExecutionException e = assertThrows(ActionExecutionException.class,
            () -> guarded.execute(order(), "mcp-client", (action, token) -> {
                throw new java.io.IOException("broker down");
            }));
        assertInstanceOf(java.io.IOException.class, e.getCause());
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
