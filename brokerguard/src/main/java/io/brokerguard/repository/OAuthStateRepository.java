package io.brokerguard.repository;

import io.brokerguard.domain.model.OAuthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for OAuth state of the admin re-authentication flow.
 */
public class OAuthStateRepository {
    private static final Logger log = LoggerFactory.getLogger(OAuthStateRepository.class);

    private final DataSource dataSource;

    public OAuthStateRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Generate and store a new OAuth state.
     *
     * @param accountKey brokerage account being re-authenticated
     * @param ttl how long until the state expires
     * @return Generated state string
     */
    public String generateState(String accountKey, Duration ttl) {
        String state = UUID.randomUUID().toString();
        Instant now = Instant.now();
        Instant expiresAt = now.plus(ttl);

        String sql = """
            INSERT INTO oauth_states (state, account_key, created_at, expires_at)
            VALUES (?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, state);
            stmt.setString(2, accountKey);
            stmt.setTimestamp(3, Timestamp.from(now));
            stmt.setTimestamp(4, Timestamp.from(expiresAt));

            stmt.executeUpdate();
            log.info("[OAUTH] Generated state for account={}, expires in {}min", accountKey, ttl.toMinutes());
            return state;

        } catch (SQLException e) {
            log.error("[OAUTH] Failed to generate state for account={}", accountKey, e);
            throw new RuntimeException("Failed to generate OAuth state", e);
        }
    }

    /**
     * Find OAuth state by state parameter.
     */
    public Optional<OAuthState> findByState(String state) {
        String sql = """
            SELECT state, account_key, created_at, expires_at, used_at, deleted_at
            FROM oauth_states
            WHERE state = ?
              AND deleted_at IS NULL
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, state);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }

        } catch (SQLException e) {
            log.error("[OAUTH] Failed to find state: {}", state, e);
            return Optional.empty();
        }
    }

    /**
     * Mark state as used (single use).
     *
     * @return true if marked, false if already used or unknown
     */
    public boolean markUsed(String state) {
        String sql = """
            UPDATE oauth_states
            SET used_at = ?
            WHERE state = ?
              AND deleted_at IS NULL
              AND used_at IS NULL
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setTimestamp(1, Timestamp.from(Instant.now()));
            stmt.setString(2, state);

            if (stmt.executeUpdate() > 0) {
                log.info("[OAUTH] Marked state as used: {}", state);
                return true;
            }
            log.warn("[OAUTH] State already used or not found: {}", state);
            return false;

        } catch (SQLException e) {
            log.error("[OAUTH] Failed to mark state as used: {}", state, e);
            return false;
        }
    }

    /**
     * Clean up expired states (run periodically).
     *
     * @return Number of states deleted
     */
    public int cleanupExpired() {
        String sql = """
            UPDATE oauth_states
            SET deleted_at = ?
            WHERE deleted_at IS NULL
              AND expires_at < ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            stmt.setTimestamp(1, Timestamp.from(now));
            stmt.setTimestamp(2, Timestamp.from(now));

            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                log.info("[OAUTH] Cleaned up {} expired states", deleted);
            }
            return deleted;

        } catch (SQLException e) {
            log.error("[OAUTH] Failed to cleanup expired states", e);
            return 0;
        }
    }

    private OAuthState mapRow(ResultSet rs) throws SQLException {
        Timestamp usedAt = rs.getTimestamp("used_at");
        Timestamp deletedAt = rs.getTimestamp("deleted_at");
        return new OAuthState(
            rs.getString("state"),
            rs.getString("account_key"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("expires_at").toInstant(),
            usedAt != null ? usedAt.toInstant() : null,
            deletedAt != null ? deletedAt.toInstant() : null
        );
    }
}
