package io.brokerguard.repository;

import io.brokerguard.domain.credential.Credential;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CredentialStore for tests: same conditional-write contract as the PostgreSQL store, one lock for all writes.
 * Several TokenLifecycleManagers sharing one instance behave like replicas sharing the database.
 */
public class InMemoryCredentialStore implements CredentialStore {
    private final String accountKey;
    private final List<Credential> versions = new ArrayList<>();
    private String leaseOwner;
    private Instant leasedUntil;
    private int casFailures;
    private int loads;

    public InMemoryCredentialStore(String accountKey) {
        this.accountKey = accountKey;
    }

    @Override
    public String accountKey() {
        return accountKey;
    }

    @Override
    public synchronized Optional<Credential> load() {
        loads++;
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    @Override
    public synchronized boolean compareAndSwap(long expectedVersion, Credential next) {
        long current = versions.isEmpty() ? 0 : versions.get(versions.size() - 1).version();
        if (current != expectedVersion || next.version() <= current) {
            casFailures++;
            return false;
        }
        versions.add(next);
        return true;
    }

    @Override
    public synchronized boolean tryAcquireRefreshLease(String owner, long observedVersion, Instant now, Instant until) {
        if (leaseOwner == null || owner.equals(leaseOwner) || !leasedUntil.isAfter(now)) {
            leaseOwner = owner;
            leasedUntil = until;
            return true;
        }
        return false;
    }

    @Override
    public synchronized void releaseRefreshLease(String owner) {
        if (owner.equals(leaseOwner)) {
            leaseOwner = null;
            leasedUntil = null;
        }
    }

    @Override
    public synchronized List<Credential> history(int limit) {
        List<Credential> newestFirst = new ArrayList<>();
        for (int i = versions.size() - 1; i >= 0 && newestFirst.size() < limit; i--) {
            newestFirst.add(versions.get(i));
        }
        return newestFirst;
    }

    /**
     * Put a credential in place directly, bypassing the version check.
     */
    public synchronized void put(Credential credential) {
        versions.add(credential);
    }

    public synchronized int loads() {
        return loads;
    }

    public synchronized int casFailures() {
        return casFailures;
    }

    public synchronized String leaseOwner() {
        return leaseOwner;
    }
}
