package io.brokerguard.repository;

import io.brokerguard.domain.credential.Credential;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Versioned persistence for the credential of one brokerage account.
 * Shared by every replica; all writes are version-checked.
 */
public interface CredentialStore {

    /**
     * The account this store is bound to.
     */
    String accountKey();

    /**
     * Read the current credential (superseded_at IS NULL), if any.
     */
    Optional<Credential> load();

    /**
     * Install {@code next} only if the current version equals {@code expectedVersion}.
     * An expected version of 0 means "no current credential".
     *
     * @return true if this writer won; false if the row has moved on
     */
    boolean compareAndSwap(long expectedVersion, Credential next);

    /**
     * Claim the refresh lease for this account if it is free or its previous holder's lease has run out.
     *
     * @return true if {@code owner} now holds the lease until {@code until}
     */
    boolean tryAcquireRefreshLease(String owner, long observedVersion, Instant now, Instant until);

    /**
     * Release the lease if {@code owner} still holds it. No-op otherwise.
     */
    void releaseRefreshLease(String owner);

    /**
     * Most recent credential versions, newest first (audit).
     */
    List<Credential> history(int limit);
}
