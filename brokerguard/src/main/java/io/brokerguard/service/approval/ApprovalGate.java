package io.brokerguard.service.approval;

import io.brokerguard.domain.approval.ActionDescriptor;
import io.brokerguard.domain.approval.ApprovalDecision;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.domain.approval.ApprovalStatus;
import io.brokerguard.infrastructure.metrics.GuardMetrics;
import io.brokerguard.repository.ApprovalStore;
import io.brokerguard.security.SecureAuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.*;

/**
 * Blocks mutating actions until a configured approver decides, or the request expires.
 *
 * The requester side ({@link #requestApproval}, {@link #awaitDecision}) and the transport side
 * ({@link #recordDecision}) meet only in the store: every terminal transition is a conditional
 * PENDING -> X update, so exactly one of decision, timeout and cancellation wins.
 *
 * Waits are futures completed by a local decision, by a timer at expires_at, or by a coarse store poll
 * that picks up decisions recorded on other replicas.
 */
public class ApprovalGate {
    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    public static final String SYSTEM_TIMEOUT = "system:timeout";
    public static final String SYSTEM_CANCELLED = "system:cancelled";

    private final ApprovalStore store;
    private final DecisionTransport transport;
    private final ApprovalPolicy policy;
    private final Clock clock;
    private final GuardMetrics metrics;
    private final SecureAuditLogger audit;

    private final ExecutorService notifyExecutor;
    private final ScheduledExecutorService timers;
    private final Map<String, Waiter> waiters = new ConcurrentHashMap<>();

    public ApprovalGate(ApprovalStore store, DecisionTransport transport, ApprovalPolicy policy, Clock clock,
                        GuardMetrics metrics, SecureAuditLogger audit) {
        this.store = store;
        this.transport = transport;
        this.policy = policy;
        this.clock = clock;
        this.metrics = metrics;
        this.audit = audit;
        this.notifyExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ApprovalNotify");
            t.setDaemon(true);
            return t;
        });
        this.timers = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "ApprovalTimer");
            t.setDaemon(true);
            return t;
        });

        if (policy.bypass()) {
            log.warn("[APPROVAL] ⚠️ ⚠️ ⚠️  APPROVAL BYPASS ENABLED: mutating actions run WITHOUT human approval");
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Requester side
    // ═══════════════════════════════════════════════════════════════

    /**
     * Gate an action with the default timeout, blocking until it is decided.
     *
     * @return APPROVED, DENIED or EXPIRED
     * @throws ApprovalCancelledException the calling thread was interrupted while waiting
     */
    public ApprovalStatus gate(ActionDescriptor action, String requestedBy) {
        if (policy.bypass()) {
            return bypass(action);
        }

        ApprovalRequest request = requestApproval(action, requestedBy, policy.defaultTimeout());
        CompletableFuture<ApprovalStatus> decision = awaitDecision(request.id());
        try {
            return decision.get();
        } catch (InterruptedException e) {
            decision.cancel(true);
            Thread.currentThread().interrupt();
            throw new ApprovalCancelledException(request.id(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new ApprovalGateException(request.id(), "Approval wait failed", e.getCause());
        }
    }

    /**
     * Gate an action with the default timeout. With bypass on, completes APPROVED immediately and
     * nothing is persisted. Cancelling the returned future cancels the approval request.
     */
    public CompletableFuture<ApprovalStatus> gateAsync(ActionDescriptor action, String requestedBy) {
        if (policy.bypass()) {
            return CompletableFuture.completedFuture(bypass(action));
        }
        ApprovalRequest request = requestApproval(action, requestedBy, policy.defaultTimeout());
        return awaitDecision(request.id());
    }

    /**
     * Persist a new PENDING request and hand it to the decision transport in the background.
     */
    public ApprovalRequest requestApproval(ActionDescriptor action, String requestedBy, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        Instant now = clock.instant();
        ApprovalRequest request = ApprovalRequest.pending(
            UUID.randomUUID().toString(), action, requestedBy, now, now.plus(timeout));

        store.insert(request);
        metrics.recordApprovalRequested();
        audit.logApprovalRequested(request.id(), action.toolName(), action.parameters(),
            requestedBy, request.expiresAt());

        notifyExecutor.execute(() -> deliver(request));

        return request;
    }

    /**
     * Wait for the request to reach a terminal status.
     *
     * The returned future completes with APPROVED, DENIED or EXPIRED, or fails with
     * {@link ApprovalCancelledException} if the request was cancelled. Cancelling the returned future
     * moves a still-PENDING request to CANCELLED.
     *
     * @throws ApprovalNotFoundException unknown id
     */
    public CompletableFuture<ApprovalStatus> awaitDecision(String id) {
        ApprovalRequest request = store.findById(id).orElseThrow(() -> new ApprovalNotFoundException(id));
        if (request.status().isTerminal()) {
            return completedWith(id, request.status());
        }

        Waiter waiter = waiters.computeIfAbsent(id, key -> startWaiter(request));
        metrics.setPendingWaiters(waiters.size());

        // A decision may have landed between the first read and registration.
        store.findById(id)
            .filter(r -> r.status().isTerminal())
            .ifPresent(r -> resolveLocal(id, r.status()));

        CompletableFuture<ApprovalStatus> callerView = waiter.result.copy();
        callerView.whenComplete((status, error) -> {
            if (error instanceof CancellationException) {
                cancel(id);
            }
        });
        return callerView;
    }

    /**
     * Move a PENDING request to CANCELLED. Returns false if it had already reached another status.
     */
    public boolean cancel(String id) {
        boolean won = store.compareAndSwapStatus(id, ApprovalStatus.PENDING, ApprovalStatus.CANCELLED,
            SYSTEM_CANCELLED, clock.instant());
        if (won) {
            metrics.recordApprovalOutcome(ApprovalStatus.CANCELLED);
            audit.logApprovalCancelled(id);
            notifyResolved(id);
        }
        store.findById(id).ifPresent(r -> resolveLocal(id, r.status()));
        return won;
    }

    // ═══════════════════════════════════════════════════════════════
    // Transport side
    // ═══════════════════════════════════════════════════════════════

    /**
     * Record a human decision. Only a configured approver may decide and only while the request is PENDING.
     *
     * @return the request in its new terminal status
     * @throws UnauthorizedApproverException decider is not a configured approver (state unchanged)
     * @throws ApprovalNotFoundException unknown id
     * @throws AlreadyDecidedException the request already reached a terminal status, or expired just now
     */
    public ApprovalRequest recordDecision(String id, ApprovalDecision decision, String decidedBy) {
        if (!policy.isApprover(decidedBy)) {
            metrics.recordRejectedDecision("UNAUTHORIZED");
            audit.logUnauthorizedDecision(id, decidedBy);
            throw new UnauthorizedApproverException(id, decidedBy);
        }

        ApprovalRequest request = store.findById(id).orElseThrow(() -> {
            metrics.recordRejectedDecision("NOT_FOUND");
            return new ApprovalNotFoundException(id);
        });

        Instant now = clock.instant();
        if (request.status() == ApprovalStatus.PENDING && request.isPastDeadline(now)) {
            expire(id);
            throw alreadyDecided(id);
        }
        if (request.status().isTerminal()) {
            metrics.recordRejectedDecision("ALREADY_DECIDED");
            throw new AlreadyDecidedException(id, request.status());
        }

        ApprovalStatus target = decision.resultingStatus();
        if (!store.compareAndSwapStatus(id, ApprovalStatus.PENDING, target, decidedBy, now)) {
            throw alreadyDecided(id);
        }

        ApprovalRequest decided = request.withTerminalStatus(target, decidedBy, now);
        metrics.recordApprovalOutcome(target);
        audit.logDecisionRecorded(id, target.name(), decidedBy);
        resolveLocal(id, target);
        notifyResolved(id);
        return decided;
    }

    // ═══════════════════════════════════════════════════════════════
    // Expiry
    // ═══════════════════════════════════════════════════════════════

    /**
     * Move a PENDING request to EXPIRED if its deadline has passed.
     *
     * @return true if this call performed the transition
     */
    public boolean expire(String id) {
        Optional<ApprovalRequest> current = store.findById(id);
        if (current.isEmpty() || current.get().status().isTerminal()) {
            current.ifPresent(r -> resolveLocal(id, r.status()));
            return false;
        }

        Instant now = clock.instant();
        if (!current.get().isPastDeadline(now)) {
            return false;
        }

        boolean won = store.compareAndSwapStatus(id, ApprovalStatus.PENDING, ApprovalStatus.EXPIRED, SYSTEM_TIMEOUT, now);
        if (won) {
            metrics.recordApprovalOutcome(ApprovalStatus.EXPIRED);
            audit.logApprovalExpired(id, SYSTEM_TIMEOUT);
            notifyResolved(id);
        }
        store.findById(id).ifPresent(r -> resolveLocal(id, r.status()));
        return won;
    }

    public Optional<ApprovalRequest> findRequest(String id) {
        return store.findById(id);
    }

    public int pendingWaiterCount() {
        return waiters.size();
    }

    public ApprovalPolicy getPolicy() {
        return policy;
    }

    /**
     * Stop timers. Requests still awaited by this replica are cancelled; their callers never execute.
     */
    public void shutdown() {
        for (String id : waiters.keySet()) {
            try {
                cancel(id);
            } catch (RuntimeException e) {
                log.warn("[APPROVAL] Could not cancel request {} on shutdown: {}", id, e.getMessage());
            }
        }
        timers.shutdownNow();
        notifyExecutor.shutdown();
        try {
            if (!notifyExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                notifyExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            notifyExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[APPROVAL] Gate stopped");
    }

    // ═══════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════

    private Waiter startWaiter(ApprovalRequest request) {
        Waiter waiter = new Waiter();
        waiter.timeout = scheduleTimeout(request.id(), request.expiresAt());
        long pollMillis = policy.pollInterval().toMillis();
        waiter.poll = timers.scheduleWithFixedDelay(() -> pollStore(request.id()),
            pollMillis, pollMillis, TimeUnit.MILLISECONDS);
        log.debug("[APPROVAL] Waiting on request {} until {}", request.id(), request.expiresAt());
        return waiter;
    }

    private ScheduledFuture<?> scheduleTimeout(String id, Instant expiresAt) {
        long delayMillis = Math.max(0, Duration.between(clock.instant(), expiresAt).toMillis());
        return timers.schedule(() -> onTimeout(id, expiresAt), delayMillis, TimeUnit.MILLISECONDS);
    }

    private void onTimeout(String id, Instant expiresAt) {
        try {
            if (clock.instant().isBefore(expiresAt)) {
                Waiter waiter = waiters.get(id);
                if (waiter != null) {
                    waiter.timeout = scheduleTimeout(id, expiresAt);
                }
                return;
            }
            expire(id);
        } catch (RuntimeException e) {
            log.error("[APPROVAL] Timeout handling failed for request {}: {}", id, e.getMessage(), e);
        }
    }

    private void pollStore(String id) {
        try {
            Optional<ApprovalRequest> current = store.findById(id);
            if (current.isEmpty()) {
                return;
            }
            ApprovalRequest request = current.get();
            if (request.status().isTerminal()) {
                resolveLocal(id, request.status());
            } else if (request.isPastDeadline(clock.instant())) {
                expire(id);
            }
        } catch (RuntimeException e) {
            log.warn("[APPROVAL] Poll of request {} failed: {}", id, e.getMessage());
        }
    }

    private void deliver(ApprovalRequest request) {
        String ref;
        try {
            ref = transport.notify(request);
            log.info("[APPROVAL] Request {} delivered via {}", request.id(), transport.name());
        } catch (RuntimeException e) {
            metrics.recordNotifyFailure();
            log.error("[APPROVAL] Failed to deliver request {} via {} (still resolvable by timeout or manual decision): {}",
                request.id(), transport.name(), e.getMessage());
            return;
        }
        if (ref == null) {
            return;
        }
        try {
            store.attachTransportRef(request.id(), ref);
            // Resolved while the transport was posting: the winner saw no reference, so publish it here.
            store.findById(request.id())
                .filter(r -> r.status().isTerminal())
                .ifPresent(this::safeOnResolved);
        } catch (RuntimeException e) {
            log.warn("[APPROVAL] Could not store transport reference for {}: {}", request.id(), e.getMessage());
        }
    }

    private ApprovalStatus bypass(ActionDescriptor action) {
        metrics.recordBypass();
        audit.logBypass(action.toolName(), action.parameters());
        return ApprovalStatus.APPROVED;
    }

    private void resolveLocal(String id, ApprovalStatus status) {
        if (!status.isTerminal()) {
            return;
        }
        Waiter waiter = waiters.remove(id);
        if (waiter == null) {
            return;
        }
        waiter.cancelTimers();
        metrics.setPendingWaiters(waiters.size());

        if (status == ApprovalStatus.CANCELLED) {
            waiter.result.completeExceptionally(new ApprovalCancelledException(id));
        } else {
            waiter.result.complete(status);
        }
        log.debug("[APPROVAL] Request {} resolved locally: {}", id, status);
    }

    private void notifyResolved(String id) {
        notifyExecutor.execute(() -> store.findById(id).ifPresent(this::safeOnResolved));
    }

    private void safeOnResolved(ApprovalRequest request) {
        try {
            transport.onResolved(request);
        } catch (RuntimeException e) {
            log.warn("[APPROVAL] Transport {} failed to publish resolution of {}: {}",
                transport.name(), request.id(), e.getMessage());
        }
    }

    private AlreadyDecidedException alreadyDecided(String id) {
        metrics.recordRejectedDecision("ALREADY_DECIDED");
        ApprovalStatus status = store.findById(id).map(ApprovalRequest::status).orElse(ApprovalStatus.EXPIRED);
        return new AlreadyDecidedException(id, status);
    }

    private static CompletableFuture<ApprovalStatus> completedWith(String id, ApprovalStatus status) {
        if (status == ApprovalStatus.CANCELLED) {
            return CompletableFuture.failedFuture(new ApprovalCancelledException(id));
        }
        return CompletableFuture.completedFuture(status);
    }

    private static final class Waiter {
        final CompletableFuture<ApprovalStatus> result = new CompletableFuture<>();
        volatile ScheduledFuture<?> timeout;
        volatile ScheduledFuture<?> poll;

        void cancelTimers() {
            if (timeout != null) {
                timeout.cancel(false);
            }
            if (poll != null) {
                poll.cancel(false);
            }
        }
    }
}
