package io.brokerguard.service.token;

import io.brokerguard.domain.credential.Credential;
import io.brokerguard.domain.credential.CredentialFreshness;
import io.brokerguard.domain.credential.OAuthTokens;
import io.brokerguard.infrastructure.metrics.GuardMetrics;
import io.brokerguard.infrastructure.oauth.OAuthEndpoint;
import io.brokerguard.infrastructure.oauth.OAuthExchangeException;
import io.brokerguard.repository.CredentialStore;
import io.brokerguard.security.SecureAuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serves valid access tokens for one brokerage account shared by every replica.
 *
 * Refresh discipline (check-then-refresh):
 * - A replica that finds the token due claims the store's refresh lease; only the holder calls the OAuth endpoint.
 * - After acquiring the lease the holder re-reads. If the version already moved it adopts the stored credential.
 * - The new credential is written with a version-checked compare-and-swap. A lost swap adopts the winner.
 * - Replicas that do not hold the lease poll the store until the version advances, then adopt.
 * - Within this replica concurrent callers share one in-flight refresh; cancelling a caller's future never
 *   cancels the refresh itself.
 * - A fresh credential is served from a local copy for {@link TokenPolicy#credentialCacheTtl()}. The copy is
 *   replaced by every refresh, adoption and seed of this replica and is never used once inside the safety margin.
 *
 * Usage:
 * <pre>
 * TokenLifecycleManager tokens = new TokenLifecycleManager(store, schwab, policy, Clock.systemUTC(),
 *     metrics, audit, "trading-1");
 * tokens.start();
 * AccessToken token = tokens.getValidToken();
 * tokens.shutdown();
 * </pre>
 */
public class TokenLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(TokenLifecycleManager.class);

    private final CredentialStore store;
    private final OAuthEndpoint oauth;
    private final TokenPolicy policy;
    private final Clock clock;
    private final GuardMetrics metrics;
    private final SecureAuditLogger audit;
    private final String replicaId;
    private final String accountKey;

    private final ExecutorService refreshExecutor;
    private final ScheduledExecutorService scheduler;
    private final AtomicReference<CompletableFuture<Credential>> inFlight = new AtomicReference<>();
    private volatile ScheduledFuture<?> proactiveTask;
    private volatile boolean running = false;
    private volatile CachedCredential cached;

    private record CachedCredential(Credential credential, Instant loadedAt) {
    }

    public TokenLifecycleManager(CredentialStore store, OAuthEndpoint oauth, TokenPolicy policy, Clock clock,
                                 GuardMetrics metrics, SecureAuditLogger audit, String replicaId) {
        this.store = store;
        this.oauth = oauth;
        this.policy = policy;
        this.clock = clock;
        this.metrics = metrics;
        this.audit = audit;
        this.replicaId = replicaId;
        this.accountKey = store.accountKey();
        this.refreshExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "TokenRefresh-" + accountKey);
            t.setDaemon(true);
            return t;
        });
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "TokenWatch-" + accountKey);
            t.setDaemon(true);
            return t;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Token access
    // ═══════════════════════════════════════════════════════════════

    /**
     * Return an access token with more than the safety margin of life left, refreshing first if needed.
     *
     * @throws CredentialUnavailableException no credential seeded yet
     * @throws RefreshTokenExpiredException refresh token past its expiry
     * @throws RefreshRejectedException OAuth endpoint rejected the refresh token
     * @throws RefreshTransientException transient OAuth failures exhausted the retry budget
     */
    public AccessToken getValidToken() {
        Instant now = clock.instant();
        Credential current = currentCredential(now);
        ensureRefreshable(current, now);

        if (!current.needsRefresh(now, policy.safetyMargin())) {
            return AccessToken.from(current);
        }

        log.info("[TOKEN] Access token for account={} due (expires {}, margin {}s), refreshing",
            accountKey, current.accessExpiresAt(), policy.safetyMargin().getSeconds());
        return toValidToken(await(refreshFrom(current.version())));
    }

    /**
     * Non-blocking variant of {@link #getValidToken()}. The store read and any refresh run on the manager's pool.
     */
    public CompletableFuture<AccessToken> getValidTokenAsync() {
        return CompletableFuture
            .supplyAsync(() -> {
                Instant now = clock.instant();
                Credential current = currentCredential(now);
                ensureRefreshable(current, now);
                return current;
            }, refreshExecutor)
            .thenCompose(current -> current.needsRefresh(clock.instant(), policy.safetyMargin())
                ? refreshFrom(current.version()).thenApply(this::toValidToken)
                : CompletableFuture.completedFuture(AccessToken.from(current)));
    }

    /**
     * Exchange the current refresh token now, unless another writer already replaced the credential this
     * call observed, in which case the stored credential is returned without an exchange.
     */
    public Credential refresh() {
        return await(refreshAsync());
    }

    public CompletableFuture<Credential> refreshAsync() {
        Credential current = loadOrThrow();
        ensureRefreshable(current, clock.instant());
        return refreshFrom(current.version());
    }

    /**
     * Install the first credential after an interactive OAuth completion.
     *
     * @throws AlreadySeededException a credential with a live refresh token exists and {@code force} is false
     */
    public Credential seed(OAuthTokens tokens, boolean force, String writtenBy) {
        Credential template = Credential.seeded(accountKey, tokens, clock.instant(),
            policy.refreshTokenLifetime(), 0, writtenBy);
        return seed(template, force);
    }

    /**
     * Install {@code credential} as the current credential. Its version is reassigned to follow the stored one.
     */
    public Credential seed(Credential credential, boolean force) {
        if (!accountKey.equals(credential.accountKey())) {
            throw new IllegalArgumentException("Credential for " + credential.accountKey()
                + " cannot seed account " + accountKey);
        }

        for (int attempt = 1; attempt <= 3; attempt++) {
            Optional<Credential> existing = store.load();
            Instant now = clock.instant();

            if (existing.isPresent() && !force && !existing.get().isRefreshExpired(now)) {
                throw new AlreadySeededException(accountKey, existing.get().version());
            }

            long expectedVersion = existing.map(Credential::version).orElse(0L);
            Credential next = new Credential(
                accountKey,
                credential.accessToken(),
                credential.refreshToken(),
                credential.issuedAt(),
                credential.accessExpiresAt(),
                credential.refreshExpiresAt(),
                expectedVersion + 1,
                credential.writtenBy()
            );

            if (store.compareAndSwap(expectedVersion, next)) {
                remember(next);
                audit.logCredentialSeeded(accountKey, next.version(), next.writtenBy(), force);
                log.info("[TOKEN] ✓ Seeded credential version {} for account={}", next.version(), accountKey);
                return next;
            }
            log.info("[TOKEN] Seed of account={} raced another writer (expected version {}), re-reading",
                accountKey, expectedVersion);
        }
        throw new TokenLifecycleException(accountKey, "Seed kept losing to concurrent writers");
    }

    /**
     * Most recent stored versions, newest first. Includes token values; callers that expose it must strip them.
     */
    public List<Credential> history(int limit) {
        return store.history(limit);
    }

    public CredentialFreshness freshness() {
        return CredentialFreshness.of(accountKey, store.load(), clock.instant());
    }

    public String getAccountKey() {
        return accountKey;
    }

    // ═══════════════════════════════════════════════════════════════
    // Proactive refresh
    // ═══════════════════════════════════════════════════════════════

    /**
     * Start the background freshness check.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[TOKEN] Lifecycle manager for account={} already running", accountKey);
            return;
        }
        running = true;
        long periodMillis = policy.proactiveInterval().toMillis();
        proactiveTask = scheduler.scheduleWithFixedDelay(this::proactiveCheck, 0, periodMillis, TimeUnit.MILLISECONDS);
        log.info("[TOKEN] Proactive refresh for account={} every {}s (margin {}s)",
            accountKey, policy.proactiveInterval().getSeconds(), policy.safetyMargin().getSeconds());
    }

    public synchronized void shutdown() {
        if (proactiveTask != null) {
            proactiveTask.cancel(false);
            proactiveTask = null;
        }
        running = false;

        scheduler.shutdown();
        refreshExecutor.shutdown();
        try {
            if (!refreshExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                refreshExecutor.shutdownNow();
            }
            if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            refreshExecutor.shutdownNow();
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[TOKEN] Lifecycle manager for account={} stopped", accountKey);
    }

    void proactiveCheck() {
        try {
            Optional<Credential> loaded = store.load();
            if (loaded.isEmpty()) {
                log.debug("[TOKEN] No credential for account={} yet", accountKey);
                return;
            }

            Credential current = loaded.get();
            Instant now = clock.instant();
            if (current.isRefreshExpired(now)) {
                log.warn("[TOKEN] Refresh token for account={} expired at {}; re-authenticate via the admin service",
                    accountKey, current.refreshExpiresAt());
                return;
            }

            Duration refreshLeft = current.refreshRemaining(now);
            if (refreshLeft.compareTo(Duration.ofDays(1)) < 0) {
                log.warn("[TOKEN] Refresh token for account={} expires in {}h; re-authenticate soon",
                    accountKey, refreshLeft.toHours());
            }

            if (current.needsRefresh(now, policy.safetyMargin())) {
                Credential refreshed = refreshFrom(current.version()).join();
                log.debug("[TOKEN] Proactive refresh for account={} now at version {}", accountKey, refreshed.version());
            }
        } catch (CompletionException e) {
            log.error("[TOKEN] Proactive refresh for account={} failed: {}", accountKey, unwrap(e).getMessage());
        } catch (RuntimeException e) {
            log.error("[TOKEN] Proactive check for account={} failed: {}", accountKey, e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Refresh critical section
    // ═══════════════════════════════════════════════════════════════

    /**
     * Join the in-flight refresh of this replica, or start one from {@code observedVersion}.
     * Callers get a copy so their cancellation never reaches the shared refresh.
     */
    private CompletableFuture<Credential> refreshFrom(long observedVersion) {
        while (true) {
            CompletableFuture<Credential> existing = inFlight.get();
            if (existing != null) {
                // A refresh started from an older version may only catch up to ours; go again if so.
                return existing.copy().thenCompose(c -> c.version() > observedVersion
                    ? CompletableFuture.completedFuture(c)
                    : refreshFrom(observedVersion));
            }

            CompletableFuture<Credential> mine = new CompletableFuture<>();
            if (inFlight.compareAndSet(null, mine)) {
                refreshExecutor.execute(() -> {
                    try {
                        Credential result = refreshAcrossReplicas(observedVersion);
                        inFlight.compareAndSet(mine, null);
                        mine.complete(result);
                    } catch (Throwable t) {
                        inFlight.compareAndSet(mine, null);
                        mine.completeExceptionally(t);
                    }
                });
                return mine.copy();
            }
        }
    }

    private Credential refreshAcrossReplicas(long observedVersion) {
        String owner = replicaId + "/" + UUID.randomUUID();
        long waitDeadline = System.nanoTime() + policy.leaseTtl().multipliedBy(2).toNanos();

        while (true) {
            Credential current = loadOrThrow();
            if (current.version() != observedVersion) {
                return adopt(observedVersion, current);
            }
            Instant now = clock.instant();
            ensureRefreshable(current, now);

            if (store.tryAcquireRefreshLease(owner, current.version(), now, now.plus(policy.leaseTtl()))) {
                try {
                    Optional<Credential> result = refreshAsLeaseHolder(observedVersion, owner);
                    if (result.isPresent()) {
                        return result.get();
                    }
                    // Lease lost mid-exchange; fall through and reconcile with whoever took over.
                } finally {
                    store.releaseRefreshLease(owner);
                }
            } else {
                log.debug("[TOKEN] Refresh lease for account={} held elsewhere, waiting for version > {}",
                    accountKey, observedVersion);
            }

            if (System.nanoTime() > waitDeadline) {
                metrics.recordRefresh("TRANSIENT_FAILURE");
                throw new RefreshTransientException(accountKey,
                    "Timed out waiting for another replica to finish refreshing version " + observedVersion);
            }
            sleep(policy.leasePollInterval());
        }
    }

    /**
     * @return the resulting credential, or empty if the lease was lost before an exchange succeeded
     */
    private Optional<Credential> refreshAsLeaseHolder(long observedVersion, String owner) {
        // Re-read under the lease: another replica may have finished between our read and our claim.
        Credential current = loadOrThrow();
        if (current.version() != observedVersion) {
            return Optional.of(adopt(observedVersion, current));
        }
        ensureRefreshable(current, clock.instant());

        Optional<OAuthTokens> tokens = exchangeWithRetry(current, owner);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }

        Credential next = current.refreshedWith(tokens.get(), clock.instant(), replicaId);
        if (store.compareAndSwap(current.version(), next)) {
            remember(next);
            metrics.recordRefresh("EXCHANGED");
            audit.logCredentialRefreshed(accountKey, current.version(), next.version(), "EXCHANGED", replicaId);
            log.info("[TOKEN] ✓ Refreshed account={} to version {} (access expires {})",
                accountKey, next.version(), next.accessExpiresAt());
            return Optional.of(next);
        }

        // Someone else wrote while our lease had lapsed; their credential wins.
        invalidateCache();
        log.warn("[TOKEN] Lost compare-and-swap for account={} at version {}; adopting stored credential",
            accountKey, current.version());
        return Optional.of(adopt(observedVersion, loadOrThrow()));
    }

    private Optional<OAuthTokens> exchangeWithRetry(Credential current, String owner) {
        for (int attempt = 1; ; attempt++) {
            if (attempt > 1) {
                Instant now = clock.instant();
                if (!store.tryAcquireRefreshLease(owner, current.version(), now, now.plus(policy.leaseTtl()))) {
                    log.warn("[TOKEN] Refresh lease for account={} taken over before attempt {}", accountKey, attempt);
                    return Optional.empty();
                }
            }

            try {
                return Optional.of(oauth.exchangeRefreshToken(current.refreshToken()));
            } catch (OAuthExchangeException e) {
                if (!e.isTransient()) {
                    metrics.recordRefresh("REJECTED");
                    audit.logRefreshFailed(accountKey, "REJECTED", e);
                    throw new RefreshRejectedException(accountKey,
                        "OAuth endpoint rejected refresh token (HTTP " + e.getHttpStatus() + "); re-authentication required", e);
                }
                if (!policy.retryPolicy().shouldRetry(attempt)) {
                    metrics.recordRefresh("TRANSIENT_FAILURE");
                    audit.logRefreshFailed(accountKey, "RETRIES_EXHAUSTED", e);
                    throw new RefreshTransientException(accountKey,
                        "Refresh failed after " + attempt + " attempts", e);
                }
                Duration delay = policy.retryPolicy().delayAfter(attempt);
                log.warn("[TOKEN] Refresh attempt {} for account={} failed ({}), retrying in {}ms",
                    attempt, accountKey, e.getMessage(), delay.toMillis());
                sleep(delay);
            }
        }
    }

    private Credential adopt(long observedVersion, Credential current) {
        remember(current);
        metrics.recordRefresh("ADOPTED");
        audit.logCredentialRefreshed(accountKey, observedVersion, current.version(), "ADOPTED", replicaId);
        log.info("[TOKEN] Adopted credential version {} for account={} (observed {})",
            current.version(), accountKey, observedVersion);
        return current;
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    private Credential loadOrThrow() {
        return store.load().orElseThrow(() -> new CredentialUnavailableException(accountKey));
    }

    /**
     * The local copy while it is younger than the cache TTL and outside the safety margin, else a store read.
     */
    private Credential currentCredential(Instant now) {
        CachedCredential entry = cached;
        if (entry != null
            && now.isBefore(entry.loadedAt().plus(policy.credentialCacheTtl()))
            && !entry.credential().needsRefresh(now, policy.safetyMargin())) {
            return entry.credential();
        }
        Credential loaded = loadOrThrow();
        remember(loaded);
        return loaded;
    }

    private void remember(Credential credential) {
        CachedCredential entry = cached;
        // never step back to an older version than one already cached
        if (entry == null || credential.version() >= entry.credential().version()) {
            cached = new CachedCredential(credential, clock.instant());
        }
    }

    private void invalidateCache() {
        cached = null;
    }

    private void ensureRefreshable(Credential credential, Instant now) {
        if (credential.isRefreshExpired(now)) {
            metrics.recordRefresh("REFRESH_EXPIRED");
            throw new RefreshTokenExpiredException(accountKey, credential.refreshExpiresAt());
        }
    }

    private AccessToken toValidToken(Credential credential) {
        if (credential.needsRefresh(clock.instant(), policy.safetyMargin())) {
            throw new RefreshTransientException(accountKey, "Refreshed access token (version "
                + credential.version() + ") already within the safety margin");
        }
        return AccessToken.from(credential);
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TokenLifecycleException(accountKey, "Refresh failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenLifecycleException(accountKey, "Interrupted while waiting for refresh", e);
        }
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RefreshTransientException(accountKey, "Interrupted during refresh backoff", e);
        }
    }

    private static Throwable unwrap(Throwable t) {
        return (t instanceof CompletionException && t.getCause() != null) ? t.getCause() : t;
    }
}
