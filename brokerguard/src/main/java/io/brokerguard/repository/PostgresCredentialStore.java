package io.brokerguard.repository;

import io.brokerguard.domain.credential.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of CredentialStore.
 * Implements immutable audit trail pattern: a write supersedes the current version and inserts the next one.
 */
public class PostgresCredentialStore implements CredentialStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresCredentialStore.class);

    private static final String COLUMNS = """
        account_key, version, access_token, refresh_token, issued_at,
        access_expires_at, refresh_expires_at, written_by
        """;

    private final DataSource dataSource;
    private final String accountKey;

    public PostgresCredentialStore(DataSource dataSource, String accountKey) {
        this.dataSource = dataSource;
        this.accountKey = accountKey;
    }

    @Override
    public String accountKey() {
        return accountKey;
    }

    @Override
    public Optional<Credential> load() {
        String sql = "SELECT " + COLUMNS + """
            FROM broker_credentials
            WHERE account_key = ?
              AND superseded_at IS NULL
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, accountKey);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSet(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            log.error("[TOKEN] Error loading credential for account={}: {}", accountKey, e.getMessage());
            throw new RuntimeException("Failed to load credential for " + accountKey, e);
        }
    }

    @Override
    public boolean compareAndSwap(long expectedVersion, Credential next) {
        if (!accountKey.equals(next.accountKey())) {
            throw new IllegalArgumentException("Credential for " + next.accountKey() + " written to store for " + accountKey);
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);

            try {
                if (expectedVersion > 0) {
                    // Step 1: Supersede the expected current version
                    String supersedeSql = """
                        UPDATE broker_credentials
                        SET superseded_at = NOW()
                        WHERE account_key = ?
                          AND version = ?
                          AND superseded_at IS NULL
                        """;

                    try (PreparedStatement stmt = conn.prepareStatement(supersedeSql)) {
                        stmt.setString(1, accountKey);
                        stmt.setLong(2, expectedVersion);
                        if (stmt.executeUpdate() != 1) {
                            conn.rollback();
                            log.info("[TOKEN] CAS lost for account={} (expected version {})", accountKey, expectedVersion);
                            return false;
                        }
                    }
                }

                // Step 2: Insert new version. With expectedVersion 0 the partial unique index on
                // current rows rejects the insert if some other writer seeded first.
                String insertSql = """
                    INSERT INTO broker_credentials (
                        account_key, version, access_token, refresh_token, issued_at,
                        access_expires_at, refresh_expires_at, written_by
                    ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    ON CONFLICT DO NOTHING
                    """;

                try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
                    stmt.setString(1, next.accountKey());
                    stmt.setLong(2, next.version());
                    stmt.setString(3, next.accessToken());
                    stmt.setString(4, next.refreshToken());
                    stmt.setTimestamp(5, Timestamp.from(next.issuedAt()));
                    stmt.setTimestamp(6, Timestamp.from(next.accessExpiresAt()));
                    stmt.setTimestamp(7, Timestamp.from(next.refreshExpiresAt()));
                    stmt.setString(8, next.writtenBy());

                    if (stmt.executeUpdate() != 1) {
                        conn.rollback();
                        log.info("[TOKEN] CAS lost for account={} (insert of version {} conflicted)",
                                 accountKey, next.version());
                        return false;
                    }
                }

                conn.commit();

                log.info("[TOKEN] Stored credential version {} for account={} (writer={})",
                         next.version(), accountKey, next.writtenBy());
                return true;

            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

        } catch (SQLException e) {
            log.error("[TOKEN] Error writing credential version {} for account={}: {}",
                      next.version(), accountKey, e.getMessage());
            throw new RuntimeException("Failed to write credential for " + accountKey, e);
        }
    }

    @Override
    public boolean tryAcquireRefreshLease(String owner, long observedVersion, Instant now, Instant until) {
        String sql = """
            INSERT INTO credential_refresh_leases (account_key, owner, observed_version, acquired_at, leased_until)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (account_key) DO UPDATE
            SET owner = EXCLUDED.owner,
                observed_version = EXCLUDED.observed_version,
                acquired_at = EXCLUDED.acquired_at,
                leased_until = EXCLUDED.leased_until
            WHERE credential_refresh_leases.leased_until <= ?
               OR credential_refresh_leases.owner = EXCLUDED.owner
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, accountKey);
            stmt.setString(2, owner);
            stmt.setLong(3, observedVersion);
            stmt.setTimestamp(4, Timestamp.from(now));
            stmt.setTimestamp(5, Timestamp.from(until));
            stmt.setTimestamp(6, Timestamp.from(now));

            boolean acquired = stmt.executeUpdate() == 1;
            log.debug("[TOKEN] Refresh lease for account={} owner={}: {}", accountKey, owner, acquired ? "acquired" : "busy");
            return acquired;

        } catch (SQLException e) {
            log.error("[TOKEN] Error acquiring refresh lease for account={}: {}", accountKey, e.getMessage());
            throw new RuntimeException("Failed to acquire refresh lease for " + accountKey, e);
        }
    }

    @Override
    public void releaseRefreshLease(String owner) {
        String sql = """
            DELETE FROM credential_refresh_leases
            WHERE account_key = ?
              AND owner = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, accountKey);
            stmt.setString(2, owner);
            stmt.executeUpdate();

        } catch (SQLException e) {
            // The lease runs out on its own; a failed release only delays the next refresh.
            log.warn("[TOKEN] Error releasing refresh lease for account={} owner={}: {}", accountKey, owner, e.getMessage());
        }
    }

    @Override
    public List<Credential> history(int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM broker_credentials
            WHERE account_key = ?
            ORDER BY version DESC
            LIMIT ?
            """;

        List<Credential> versions = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, accountKey);
            stmt.setInt(2, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    versions.add(mapResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[TOKEN] Error reading credential history for account={}: {}", accountKey, e.getMessage());
            throw new RuntimeException("Failed to read credential history for " + accountKey, e);
        }

        return versions;
    }

    /**
     * Map ResultSet to Credential domain model.
     */
    private Credential mapResultSet(ResultSet rs) throws SQLException {
        return new Credential(
            rs.getString("account_key"),
            rs.getString("access_token"),
            rs.getString("refresh_token"),
            rs.getTimestamp("issued_at").toInstant(),
            rs.getTimestamp("access_expires_at").toInstant(),
            rs.getTimestamp("refresh_expires_at").toInstant(),
            rs.getLong("version"),
            rs.getString("written_by")
        );
    }
}
