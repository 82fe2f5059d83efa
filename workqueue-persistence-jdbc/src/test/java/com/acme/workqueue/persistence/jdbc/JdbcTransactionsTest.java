package com.acme.workqueue.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.sql.Connection;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JdbcTransactionsTest {

    @Test
    @DisplayName("commits a local transaction and restores auto-commit")
    void testCommitsLocalTransaction() throws SQLException {
        Connection conn = mock(Connection.class);
        when(conn.getAutoCommit()).thenReturn(true);

        String result = JdbcTransactions.inTransaction(conn, c -> "done");

        assertThat(result).isEqualTo("done");
        verify(conn).setAutoCommit(false);
        verify(conn).commit();
        verify(conn).setAutoCommit(true);
        verify(conn, never()).rollback();
    }

    @Test
    @DisplayName("rolls back and rethrows when the work fails")
    void testRollsBackOnFailure() throws SQLException {
        Connection conn = mock(Connection.class);
        when(conn.getAutoCommit()).thenReturn(true);
        SQLException failure = new SQLException("boom", "23505");

        assertThatThrownBy(() -> JdbcTransactions.inTransaction(conn, c -> {
            throw failure;
        })).isSameAs(failure);

        verify(conn).rollback();
        verify(conn, never()).commit();
        verify(conn).setAutoCommit(true);
    }

    @Test
    @DisplayName("keeps the rollback failure as a suppressed exception")
    void testRollbackFailureSuppressed() throws SQLException {
        Connection conn = mock(Connection.class);
        when(conn.getAutoCommit()).thenReturn(true);
        SQLException rollbackFailure = new SQLException("connection gone", "08006");
        doThrow(rollbackFailure).when(conn).rollback();

        assertThatThrownBy(() -> JdbcTransactions.inTransaction(conn, c -> {
            throw new IllegalStateException("work failed");
        }))
                .isInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(rollbackFailure));
    }

    @Test
    @DisplayName("joins an outer transaction without committing it")
    void testJoinsOuterTransaction() throws SQLException {
        Connection conn = mock(Connection.class);
        when(conn.getAutoCommit()).thenReturn(false);

        Integer result = JdbcTransactions.inTransaction(conn, c -> 42);

        assertThat(result).isEqualTo(42);
        verify(conn, never()).commit();
        verify(conn, never()).setAutoCommit(anyBoolean());
    }
}
