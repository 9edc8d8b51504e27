package io.brokerguard.service.approval;

import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.repository.ApprovalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically expires PENDING requests whose deadline passed while no replica was waiting on them
 * (the requesting replica crashed or was replaced). Uses the gate's conditional transition, so it
 * never overrides a decision.
 */
public class ApprovalExpirySweeper {
    private static final Logger log = LoggerFactory.getLogger(ApprovalExpirySweeper.class);

    private static final int BATCH_SIZE = 100;

    private final ApprovalStore store;
    private final ApprovalGate gate;
    private final Clock clock;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public ApprovalExpirySweeper(ApprovalStore store, ApprovalGate gate, Clock clock, Duration interval) {
        this.store = store;
        this.gate = gate;
        this.clock = clock;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ApprovalExpirySweeper");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[APPROVAL] Expiry sweeper already running");
            return;
        }
        running = true;
        scheduler.scheduleWithFixedDelay(this::runSweep, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[APPROVAL] Expiry sweeper started (every {}s)", interval.getSeconds());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdownNow();
        log.info("[APPROVAL] Expiry sweeper stopped");
    }

    /**
     * Expire every overdue PENDING request.
     *
     * @return number of requests this sweep moved to EXPIRED
     */
    public int sweep() {
        List<ApprovalRequest> overdue = store.findPendingExpiredBefore(clock.instant(), BATCH_SIZE);
        int expired = 0;
        for (ApprovalRequest request : overdue) {
            if (gate.expire(request.id())) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("[APPROVAL] Sweeper expired {} overdue request(s)", expired);
        }
        return expired;
    }

    private void runSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("[APPROVAL] Expiry sweep failed: {}", e.getMessage(), e);
        }
    }
}
