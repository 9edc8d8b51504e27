package io.brokerguard.service.execution;

import io.brokerguard.domain.approval.ActionDescriptor;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.domain.approval.ApprovalStatus;
import io.brokerguard.service.approval.ApprovalCancelledException;
import io.brokerguard.service.approval.ApprovalDeniedException;
import io.brokerguard.service.approval.ApprovalExpiredException;
import io.brokerguard.service.approval.ApprovalGate;
import io.brokerguard.service.approval.ApprovalGateException;
import io.brokerguard.service.token.AccessToken;
import io.brokerguard.service.token.TokenLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Calling convention for mutating brokerage actions: gate first, and only on APPROVED fetch a valid
 * token and run the executor. Read-only calls go straight to {@link TokenLifecycleManager}.
 */
public class GuardedActionExecutor {
    private static final Logger log = LoggerFactory.getLogger(GuardedActionExecutor.class);

    private static final String BYPASS_ID = "bypass";

    private final ApprovalGate gate;
    private final TokenLifecycleManager tokens;
    private final Executor executor;

    public GuardedActionExecutor(ApprovalGate gate, TokenLifecycleManager tokens, Executor executor) {
        this.gate = gate;
        this.tokens = tokens;
        this.executor = executor;
    }

    /**
     * Gate the action and run it if approved.
     *
     * @throws ApprovalDeniedException a human denied it
     * @throws ApprovalExpiredException nobody decided in time
     * @throws ApprovalCancelledException the wait was interrupted or cancelled
     * @throws ActionExecutionException the brokerage call failed after approval
     */
    public <T> T execute(ActionDescriptor action, String requestedBy, ActionExecutor<T> actionExecutor) {
        if (gate.getPolicy().bypass()) {
            return runIfApproved(BYPASS_ID, action, gate.gate(action, requestedBy), actionExecutor);
        }

        ApprovalRequest request = gate.requestApproval(action, requestedBy, gate.getPolicy().defaultTimeout());
        CompletableFuture<ApprovalStatus> decision = gate.awaitDecision(request.id());
        ApprovalStatus status;
        try {
            status = decision.get();
        } catch (InterruptedException e) {
            decision.cancel(true);
            Thread.currentThread().interrupt();
            throw new ApprovalCancelledException(request.id(), e);
        } catch (ExecutionException e) {
            throw asRuntime(request.id(), e.getCause());
        }
        return runIfApproved(request.id(), action, status, actionExecutor);
    }

    /**
     * Async variant. Cancelling the returned future before a decision cancels the approval request, and the
     * action is then never executed.
     */
    public <T> CompletableFuture<T> executeAsync(ActionDescriptor action, String requestedBy,
                                                 ActionExecutor<T> actionExecutor) {
        if (gate.getPolicy().bypass()) {
            gate.gate(action, requestedBy);
            return CompletableFuture.supplyAsync(
                () -> runIfApproved(BYPASS_ID, action, ApprovalStatus.APPROVED, actionExecutor), executor);
        }

        ApprovalRequest request = gate.requestApproval(action, requestedBy, gate.getPolicy().defaultTimeout());
        CompletableFuture<ApprovalStatus> decision = gate.awaitDecision(request.id());
        CompletableFuture<T> result = new CompletableFuture<>();

        result.whenComplete((value, error) -> {
            if (error instanceof CancellationException) {
                decision.cancel(true);
            }
        });

        decision.whenCompleteAsync((status, error) -> {
            if (result.isDone()) {
                log.info("[EXECUTE] Caller for {} gone before decision on {}; not executing",
                    action.toolName(), request.id());
                return;
            }
            if (error != null) {
                result.completeExceptionally(asRuntime(request.id(), error));
                return;
            }
            try {
                result.complete(runIfApproved(request.id(), action, status, actionExecutor));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, executor);

        return result;
    }

    private <T> T runIfApproved(String approvalId, ActionDescriptor action, ApprovalStatus status,
                                ActionExecutor<T> actionExecutor) {
        String toolName = action.toolName();
        switch (status) {
            case APPROVED -> {
                AccessToken token = tokens.getValidToken();
                log.info("[EXECUTE] Running approved action {} (approval {}, credential version {})",
                    toolName, approvalId, token.credentialVersion());
                try {
                    return actionExecutor.execute(action, token);
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new ActionExecutionException(toolName, e);
                }
            }
            case DENIED -> throw new ApprovalDeniedException(approvalId, toolName);
            case EXPIRED -> throw new ApprovalExpiredException(approvalId, toolName);
            case CANCELLED -> throw new ApprovalCancelledException(approvalId);
            default -> throw new IllegalStateException("Gate returned non-terminal status " + status + " for " + toolName);
        }
    }

    private static RuntimeException asRuntime(String approvalId, Throwable error) {
        Throwable cause = (error instanceof CompletionException && error.getCause() != null) ? error.getCause() : error;
        if (cause instanceof CancellationException) {
            return new ApprovalCancelledException(approvalId, cause);
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new ApprovalGateException(approvalId, "Approval wait failed", cause);
    }
}
