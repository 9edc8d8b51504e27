package io.brokerguard.bootstrap;

import io.brokerguard.config.BrokerGuardConfig.RunMode;
import io.brokerguard.service.approval.ApprovalGate;
import io.brokerguard.service.execution.GuardedActionExecutor;
import io.brokerguard.service.token.TokenLifecycleManager;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A running BrokerGuard instance, as returned by {@link App#start}.
 *
 * Usage from an embedding tool server:
 * <pre>
 * BrokerGuard guard = App.start(BrokerGuardConfig.fromEnv());
 * OrderResult result = guard.actions().execute(action, "mcp", (descriptor, token) -> broker.placeOrder(descriptor, token));
 * AccessToken readToken = guard.tokens().getValidToken();
 * guard.stop();
 * </pre>
 */
public final class BrokerGuard {

    private final RunMode runMode;
    private final int port;
    private final TokenLifecycleManager tokens;
    private final ApprovalGate gate;
    private final GuardedActionExecutor actions;
    private final Runnable shutdown;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    BrokerGuard(RunMode runMode, int port, TokenLifecycleManager tokens, ApprovalGate gate,
                GuardedActionExecutor actions, Runnable shutdown) {
        this.runMode = runMode;
        this.port = port;
        this.tokens = tokens;
        this.gate = gate;
        this.actions = actions;
        this.shutdown = shutdown;
    }

    /**
     * Entry point for mutating brokerage actions: approval first, then a valid token, then the call.
     *
     * @throws IllegalStateException not running in TRADING mode
     */
    public GuardedActionExecutor actions() {
        if (actions == null) {
            throw new IllegalStateException("Guarded actions are only available in TRADING mode (running " + runMode + ")");
        }
        return actions;
    }

    /**
     * Tokens for read-only brokerage calls, which skip the approval gate.
     */
    public TokenLifecycleManager tokens() {
        return tokens;
    }

    public ApprovalGate gate() {
        return gate;
    }

    public RunMode runMode() {
        return runMode;
    }

    /**
     * Port the HTTP API listens on (the bound one when configured as 0).
     */
    public int port() {
        return port;
    }

    /**
     * Stop the HTTP server, background tasks and connection pool. Later calls do nothing.
     */
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            shutdown.run();
        }
    }
}
