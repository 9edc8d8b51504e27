package io.brokerguard.repository;

import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.domain.approval.ApprovalStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for approval_requests table.
 * Requests are inserted PENDING and move to a terminal status through a single conditional transition.
 */
public interface ApprovalStore {

    /**
     * Insert a new request (status PENDING).
     */
    void insert(ApprovalRequest request);

    Optional<ApprovalRequest> findById(String id);

    /**
     * Move the request from {@code expectedStatus} to {@code newStatus}.
     *
     * @return true if this transition won; false if the request is missing or no longer in the expected status
     */
    boolean compareAndSwapStatus(String id, ApprovalStatus expectedStatus, ApprovalStatus newStatus,
                                 String decidedBy, Instant decidedAt);

    /**
     * Record where the decision transport posted the request.
     */
    void attachTransportRef(String id, String transportRef);

    /**
     * Most recent requests, newest first.
     */
    List<ApprovalRequest> findRecent(int limit);

    /**
     * PENDING requests whose expiry is at or before {@code now}. Used by the expiry sweeper.
     */
    List<ApprovalRequest> findPendingExpiredBefore(Instant now, int limit);

    /**
     * Number of requests per status (every status present, zero if none).
     */
    Map<ApprovalStatus, Long> countByStatus();
}
