package io.brokerguard.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.brokerguard.domain.approval.ApprovalStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Behaviour of the PostgreSQL stores when the database is unreachable.
 *
 * Tests:
 * - Reads that drive the sweeper or the audit endpoint fail loudly
 * - Status page reads degrade to empty results
 */
@ExtendWith(MockitoExtension.class)
class PostgresStoreErrorHandlingTest {

    @Mock
    private DataSource dataSource;

    @BeforeEach
    void setUp() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));
    }

    @Test
    void testOverdueLookupThrows() {
        PostgresApprovalStore store = new PostgresApprovalStore(dataSource, new ObjectMapper());

        RuntimeException e = assertThrows(RuntimeException.class,
            () -> store.findPendingExpiredBefore(Instant.parse("2026-03-02T15:30:00Z"), 50));
        assertInstanceOf(SQLException.class, e.getCause());
    }

    @Test
    void testCredentialHistoryThrows() {
        PostgresCredentialStore store = new PostgresCredentialStore(dataSource, "acct-1");

        RuntimeException e = assertThrows(RuntimeException.class, () -> store.history(10));
        assertTrue(e.getMessage().contains("acct-1"));
    }

    @Test
    void testStatusPageReadsDegrade() {
        PostgresApprovalStore store = new PostgresApprovalStore(dataSource, new ObjectMapper());

        assertTrue(store.findRecent(20).isEmpty());
        assertEquals(0L, store.countByStatus().get(ApprovalStatus.PENDING));
    }
}
