package com.acme.workqueue.persistence.jdbc;

import com.acme.workqueue.core.PermanentStorageException;
import com.acme.workqueue.core.StorageException;
import com.acme.workqueue.core.TransientStorageException;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Translates {@link SQLException} into the queue's {@link StorageException} types. The
 * transient/permanent split is informational for callers; the queue itself never retries.
 */
public final class ExceptionTranslator {

    // 08 connection exception, 40 transaction rollback (serialization failure, deadlock),
    // 53 insufficient resources, 55P03 lock not available, 57P01-03 server shutting down
    private static final Set<String> TRANSIENT_STATE_CLASSES = Set.of("08", "40", "53");
    private static final Set<String> TRANSIENT_STATES = Set.of("55P03", "57P01", "57P02", "57P03");

    // 22 data exception, 23 integrity constraint violation, 42 syntax error or access rule
    // violation, 3D invalid catalog, 3F invalid schema
    private static final Set<String> PERMANENT_STATE_CLASSES = Set.of("22", "23", "42", "3D", "3F");

    // H2: 50200 lock timeout, 40001 deadlock, 90067 connection broken, 90131 concurrent update
    private static final Set<Integer> H2_TRANSIENT_CODES = Set.of(50200, 40001, 90067, 90131);

    private static final String[] TRANSIENT_MESSAGE_HINTS = {
        "timeout", "timed out", "connection refused", "connection reset", "deadlock",
        "too many connections", "pool exhausted", "connection is not available"
    };

    private ExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * Logs the failure once and returns the matching storage exception for the caller to throw.
     *
     * @param exception the JDBC failure
     * @param operation short description of what was being done, used in the message
     * @param logger    logger of the repository that failed
     */
    public static StorageException translateException(
            SQLException exception, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, exception);

        String message = String.format("Database error during %s: %s", operation, exception.getMessage());
        if (isTransient(exception)) {
            return new TransientStorageException(message, exception);
        }
        if (isPermanent(exception)) {
            return new PermanentStorageException(message, exception);
        }
        // Unknown failures are reported as transient: the caller decides whether to try again
        return new TransientStorageException(message, exception);
    }

    static boolean isTransient(SQLException exception) {
        for (SQLException e = exception; e != null; e = e.getNextException()) {
            String state = e.getSQLState();
            if (state != null && state.length() >= 2) {
                if (TRANSIENT_STATES.contains(state) || TRANSIENT_STATE_CLASSES.contains(state.substring(0, 2))) {
                    return true;
                }
            }
            if (H2_TRANSIENT_CODES.contains(e.getErrorCode())) {
                return true;
            }
            String text = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
            for (String hint : TRANSIENT_MESSAGE_HINTS) {
                if (text.contains(hint)) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean isPermanent(SQLException exception) {
        for (SQLException e = exception; e != null; e = e.getNextException()) {
            String state = e.getSQLState();
            if (state != null && state.length() >= 2 && PERMANENT_STATE_CLASSES.contains(state.substring(0, 2))) {
                return true;
            }
        }
        return false;
    }
}
