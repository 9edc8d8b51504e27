package io.brokerguard.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.brokerguard.domain.approval.ActionDescriptor;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.domain.approval.ApprovalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of ApprovalStore.
 * The action descriptor is stored as JSONB.
 */
public class PostgresApprovalStore implements ApprovalStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresApprovalStore.class);

    private static final String COLUMNS = """
        id, action_descriptor::text AS action_descriptor, requested_by, created_at, expires_at,
        status, decided_by, decided_at, transport_ref
        """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public PostgresApprovalStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    @Override
    public void insert(ApprovalRequest request) {
        String sql = """
            INSERT INTO approval_requests (
                id, action_descriptor, requested_by, created_at, expires_at, status, decided_by, decided_at
            ) VALUES (?, ?::jsonb, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, request.id());
            stmt.setString(2, toJson(request.actionDescriptor()));
            stmt.setString(3, request.requestedBy());
            stmt.setTimestamp(4, Timestamp.from(request.createdAt()));
            stmt.setTimestamp(5, Timestamp.from(request.expiresAt()));
            stmt.setString(6, request.status().name());
            stmt.setString(7, request.decidedBy());
            stmt.setTimestamp(8, request.decidedAt() != null ? Timestamp.from(request.decidedAt()) : null);

            stmt.executeUpdate();

            log.info("[APPROVAL] Inserted request {} for tool={} (expires: {})",
                     request.id(), request.actionDescriptor().toolName(), request.expiresAt());

        } catch (SQLException e) {
            log.error("[APPROVAL] Error inserting request {}: {}", request.id(), e.getMessage());
            throw new RuntimeException("Failed to insert approval request " + request.id(), e);
        }
    }

    @Override
    public Optional<ApprovalRequest> findById(String id) {
        String sql = "SELECT " + COLUMNS + """
            FROM approval_requests
            WHERE id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSet(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            log.error("[APPROVAL] Error finding request {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to read approval request " + id, e);
        }
    }

    @Override
    public boolean compareAndSwapStatus(String id, ApprovalStatus expectedStatus, ApprovalStatus newStatus,
                                        String decidedBy, Instant decidedAt) {
        String sql = """
            UPDATE approval_requests
            SET status = ?,
                decided_by = ?,
                decided_at = ?
            WHERE id = ?
              AND status = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, newStatus.name());
            stmt.setString(2, decidedBy);
            stmt.setTimestamp(3, decidedAt != null ? Timestamp.from(decidedAt) : null);
            stmt.setString(4, id);
            stmt.setString(5, expectedStatus.name());

            int updated = stmt.executeUpdate();
            if (updated > 0) {
                log.info("[APPROVAL] Request {} {} -> {} (by {})", id, expectedStatus, newStatus, decidedBy);
                return true;
            }
            log.debug("[APPROVAL] Request {} no longer {} (wanted {})", id, expectedStatus, newStatus);
            return false;

        } catch (SQLException e) {
            log.error("[APPROVAL] Error transitioning request {} to {}: {}", id, newStatus, e.getMessage());
            throw new RuntimeException("Failed to transition approval request " + id, e);
        }
    }

    @Override
    public void attachTransportRef(String id, String transportRef) {
        String sql = """
            UPDATE approval_requests
            SET transport_ref = ?
            WHERE id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, transportRef);
            stmt.setString(2, id);
            stmt.executeUpdate();

        } catch (SQLException e) {
            log.error("[APPROVAL] Error storing transport reference for {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to store transport reference for approval request " + id, e);
        }
    }

    @Override
    public List<ApprovalRequest> findRecent(int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM approval_requests
            ORDER BY created_at DESC
            LIMIT ?
            """;

        List<ApprovalRequest> requests = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setInt(1, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    requests.add(mapResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[APPROVAL] Error finding recent requests: {}", e.getMessage());
        }

        return requests;
    }

    @Override
    public List<ApprovalRequest> findPendingExpiredBefore(Instant now, int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM approval_requests
            WHERE status = 'PENDING'
              AND expires_at <= ?
            ORDER BY expires_at ASC
            LIMIT ?
            """;

        List<ApprovalRequest> requests = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setTimestamp(1, Timestamp.from(now));
            stmt.setInt(2, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    requests.add(mapResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[APPROVAL] Error finding overdue pending requests: {}", e.getMessage());
            throw new RuntimeException("Failed to read overdue approval requests", e);
        }

        return requests;
    }

    @Override
    public Map<ApprovalStatus, Long> countByStatus() {
        String sql = """
            SELECT status, COUNT(*) AS count
            FROM approval_requests
            GROUP BY status
            """;

        Map<ApprovalStatus, Long> counts = new EnumMap<>(ApprovalStatus.class);
        for (ApprovalStatus status : ApprovalStatus.values()) {
            counts.put(status, 0L);
        }

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                counts.put(ApprovalStatus.valueOf(rs.getString("status")), rs.getLong("count"));
            }
        } catch (SQLException e) {
            log.error("[APPROVAL] Error counting requests by status: {}", e.getMessage());
        }

        return counts;
    }

    private String toJson(ActionDescriptor descriptor) {
        try {
            return objectMapper.writeValueAsString(descriptor);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Action descriptor is not JSON-serializable: " + descriptor.toolName(), e);
        }
    }

    /**
     * Map ResultSet to ApprovalRequest domain model.
     */
    private ApprovalRequest mapResultSet(ResultSet rs) throws SQLException {
        Timestamp decidedAtTs = rs.getTimestamp("decided_at");
        ActionDescriptor descriptor;
        try {
            descriptor = objectMapper.readValue(rs.getString("action_descriptor"), ActionDescriptor.class);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt action_descriptor for approval request " + rs.getString("id"), e);
        }

        return new ApprovalRequest(
            rs.getString("id"),
            descriptor,
            rs.getString("requested_by"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("expires_at").toInstant(),
            ApprovalStatus.valueOf(rs.getString("status")),
            rs.getString("decided_by"),
            decidedAtTs != null ? decidedAtTs.toInstant() : null,
            rs.getString("transport_ref")
        );
    }
}
