package com.acme.workqueue.persistence.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs multi-statement units of work atomically on a single connection.
 *
 * <p>When the connection already belongs to an outer transaction (auto-commit off, e.g. inside a
 * {@code @Transactional} method) the work joins it and the outer transaction decides the outcome.
 * Otherwise a local transaction is opened, committed on success and rolled back on any failure.
 */
public final class JdbcTransactions {

    private JdbcTransactions() {}

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    public static <T> T inTransaction(Connection conn, SqlWork<T> work) throws SQLException {
        if (!conn.getAutoCommit()) {
            return work.run(conn);
        }
        conn.setAutoCommit(false);
        try {
            T result = work.run(conn);
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            try {
                conn.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }
}
