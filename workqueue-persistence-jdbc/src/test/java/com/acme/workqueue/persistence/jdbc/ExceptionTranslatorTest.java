package com.acme.workqueue.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import com.acme.workqueue.core.PermanentStorageException;
import com.acme.workqueue.core.StorageException;
import com.acme.workqueue.core.TransientStorageException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Tests translation of SQLException into transient or permanent StorageException. */
class ExceptionTranslatorTest {

    private static final Logger logger = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

    @Nested
    @DisplayName("Transient Error Detection")
    class TransientErrorTests {

        @Test
        @DisplayName("connection failure SQLState class 08 is transient")
        void testConnectionFailure() {
            SQLException cause = new SQLException("Connection refused to host", "08001");

            StorageException result = ExceptionTranslator.translateException(cause, "claim", logger);

            assertThat(result).isInstanceOf(TransientStorageException.class);
            assertThat(result.isTransient()).isTrue();
            assertThat(result).hasCause(cause);
        }

        @Test
        @DisplayName("PostgreSQL deadlock 40P01 is transient")
        void testDeadlock() {
            SQLException cause = new SQLException("deadlock detected", "40P01");

            assertThat(ExceptionTranslator.translateException(cause, "update", logger))
                    .isInstanceOf(TransientStorageException.class);
        }

        @Test
        @DisplayName("lock not available 55P03 is transient")
        void testLockNotAvailable() {
            assertThat(ExceptionTranslator.isTransient(new SQLException("could not obtain lock", "55P03")))
                    .isTrue();
        }

        @Test
        @DisplayName("H2 lock timeout error code is transient")
        void testH2LockTimeout() {
            SQLException cause = new SQLException("Timeout trying to lock table", "HYT00", 50200);

            assertThat(ExceptionTranslator.isTransient(cause)).isTrue();
        }

        @Test
        @DisplayName("transient detection follows the next-exception chain")
        void testChainedException() {
            SQLException outer = new SQLException("Batch entry failed", "XX000");
            outer.setNextException(new SQLException("terminating connection", "57P01"));

            assertThat(ExceptionTranslator.isTransient(outer)).isTrue();
        }

        @Test
        @DisplayName("unknown failures are reported as transient")
        void testUnknownFailure() {
            SQLException cause = new SQLException("something odd", "XX000");

            StorageException result = ExceptionTranslator.translateException(cause, "stats", logger);

            assertThat(result).isInstanceOf(TransientStorageException.class);
        }
    }

    @Nested
    @DisplayName("Permanent Error Detection")
    class PermanentErrorTests {

        @Test
        @DisplayName("integrity constraint violation is permanent")
        void testConstraintViolation() {
            SQLException cause = new SQLException("check constraint violated", "23514");

            StorageException result = ExceptionTranslator.translateException(cause, "insert", logger);

            assertThat(result).isInstanceOf(PermanentStorageException.class);
            assertThat(result.isTransient()).isFalse();
        }

        @Test
        @DisplayName("missing table is permanent")
        void testMissingTable() {
            SQLException cause = new SQLException("Table \"QUEUE_MESSAGE\" not found", "42S02", 42102);

            assertThat(ExceptionTranslator.translateException(cause, "insert", logger))
                    .isInstanceOf(PermanentStorageException.class);
        }
    }

    @Test
    @DisplayName("message names the failed operation and the driver message")
    void testMessageFormat() {
        SQLException cause = new SQLException("value too long", "22001");

        StorageException result = ExceptionTranslator.translateException(cause, "insert queue message", logger);

        assertThat(result.getMessage()).isEqualTo("Database error during insert queue message: value too long");
    }
}
