package com.acme.workqueue.persistence.jdbc;

import static com.acme.workqueue.persistence.jdbc.mapper.MessageMapper.toInstant;
import static com.acme.workqueue.persistence.jdbc.mapper.MessageMapper.toTimestamp;

import com.acme.workqueue.domain.DeadLetterRecord;
import com.acme.workqueue.domain.Message;
import com.acme.workqueue.domain.MessageStatus;
import com.acme.workqueue.domain.QueueName;
import com.acme.workqueue.persistence.jdbc.mapper.MessageMapper;
import com.acme.workqueue.repository.ProcessingSummary;
import com.acme.workqueue.repository.QueueRepository;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Abstract JDBC implementation of QueueRepository using Template Method pattern.
 * Subclasses supply the dialect-specific claim and aggregation SQL; the remaining statements are
 * portable and guarded on the expected current state of the row.
 */
public abstract class JdbcQueueRepository implements QueueRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcQueueRepository.class);

    protected final DataSource dataSource;

    protected JdbcQueueRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public long insert(
            QueueName queue,
            String type,
            String body,
            int priority,
            String correlationId,
            Instant scheduledAt,
            int maxRetries,
            Instant createdAt) {
        String sql = getInsertSql();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, queue.value());
            ps.setString(2, type);
            ps.setString(3, body);
            ps.setInt(4, priority);
            ps.setString(5, correlationId);
            ps.setInt(6, maxRetries);
            ps.setTimestamp(7, toTimestamp(createdAt));
            ps.setTimestamp(8, toTimestamp(scheduledAt));

            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    long id = keys.getLong(1);
                    LOG.debug("Inserted message: queue={}, id={}, type={}", queue, id, type);
                    return id;
                }
            }
            throw new SQLException("Insert into queue_message returned no generated key");

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert queue message", LOG);
        }
    }

    @Override
    @Transactional
    public Optional<Message> claimNext(QueueName queue, String typeFilter, String claimantId, Instant now) {
        String sql = getClaimSql();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, claimantId);
            ps.setTimestamp(2, toTimestamp(now));
            ps.setString(3, queue.value());
            ps.setTimestamp(4, toTimestamp(now));
            bindTypeFilter(ps, 5, typeFilter);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    Message claimed = MessageMapper.toDomain(rs);
                    LOG.debug("Claimed message: queue={}, id={}, claimant={}", queue, claimed.getId(), claimantId);
                    return Optional.of(claimed);
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "claim next queue message", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Message> findById(QueueName queue, long id) {
        try (Connection conn = dataSource.getConnection()) {
            return findById(conn, queue, id);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find queue message by id", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Message> findByCorrelationId(QueueName queue, String correlationId) {
        String sql = "SELECT " + MessageMapper.COLUMNS + " FROM queue_message "
                + "WHERE queue_name = ? AND correlation_id = ? ORDER BY created_at, id";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue.value());
            ps.setString(2, correlationId);

            List<Message> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(MessageMapper.toDomain(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find queue messages by correlation id", LOG);
        }
    }

    @Override
    @Transactional
    public boolean markCompleted(QueueName queue, long id, String claimantId, Instant endedAt) {
        String sql = """
                UPDATE queue_message
                SET status = 'COMPLETED', claim_ended_at = ?
                WHERE queue_name = ? AND id = ? AND status = 'PROCESSING' AND claimant_id = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, toTimestamp(endedAt));
            ps.setString(2, queue.value());
            ps.setLong(3, id);
            ps.setString(4, claimantId);

            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark queue message completed", LOG);
        }
    }

    @Override
    @Transactional
    public boolean reschedule(
            QueueName queue,
            long id,
            String claimantId,
            int expectedRetryCount,
            String error,
            Instant nextAttemptAt) {
        String sql = """
                UPDATE queue_message
                SET status = 'PENDING', retry_count = retry_count + 1, claimant_id = NULL,
                    claim_started_at = NULL, last_error = ?, scheduled_at = ?
                WHERE queue_name = ? AND id = ? AND status = 'PROCESSING' AND claimant_id = ?
                  AND retry_count = ? AND retry_count < max_retries
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, error);
            ps.setTimestamp(2, toTimestamp(nextAttemptAt));
            ps.setString(3, queue.value());
            ps.setLong(4, id);
            ps.setString(5, claimantId);
            ps.setInt(6, expectedRetryCount);

            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "reschedule queue message", LOG);
        }
    }

    @Override
    @Transactional
    public boolean moveToDeadLetter(Message snapshot, String reason, String error, Instant deadLetteredAt) {
        String deleteSql = """
                DELETE FROM queue_message
                WHERE queue_name = ? AND id = ? AND status = 'PROCESSING' AND claimant_id = ?
                  AND retry_count = ?
                """;
        DeadLetterRecord record = DeadLetterRecord.of(snapshot, reason, error, deadLetteredAt);

        try (Connection conn = dataSource.getConnection()) {
            return JdbcTransactions.inTransaction(conn, c -> {
                // Deleting first takes the row lock, so a concurrent completion blocks and then misses
                try (PreparedStatement delete = c.prepareStatement(deleteSql)) {
                    delete.setString(1, snapshot.getQueueName());
                    delete.setLong(2, snapshot.getId());
                    delete.setString(3, snapshot.getClaimantId());
                    delete.setInt(4, snapshot.getRetryCount());
                    if (delete.executeUpdate() == 0) {
                        return false;
                    }
                }
                insertDeadLetter(c, record);
                LOG.debug("Moved message to dead-letter store: queue={}, id={}",
                        snapshot.getQueueName(), snapshot.getId());
                return true;
            });
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "move queue message to dead-letter store", LOG);
        }
    }

    @Override
    @Transactional
    public int releaseStuckClaims(Instant claimedBefore, String reason, Instant now) {
        String sql = """
                UPDATE queue_message
                SET status = 'PENDING', claimant_id = NULL, claim_started_at = NULL,
                    last_error = ?, scheduled_at = ?
                WHERE status = 'PROCESSING' AND claim_started_at < ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, reason);
            ps.setTimestamp(2, toTimestamp(now));
            ps.setTimestamp(3, toTimestamp(claimedBefore));

            return ps.executeUpdate();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "release stuck queue claims", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Map<MessageStatus, Long> countByStatus(QueueName queue) {
        String sql = "SELECT status, COUNT(*) AS message_count FROM queue_message WHERE queue_name = ? GROUP BY status";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue.value());

            Map<MessageStatus, Long> counts = new EnumMap<>(MessageStatus.class);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(MessageStatus.valueOf(rs.getString("status")), rs.getLong("message_count"));
                }
            }
            return counts;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count queue messages by status", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Instant> findOldestPendingCreatedAt(QueueName queue) {
        String sql = "SELECT MIN(created_at) AS oldest FROM queue_message WHERE queue_name = ? AND status = 'PENDING'";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue.value());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(toInstant(rs.getTimestamp("oldest")));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find oldest pending queue message", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public ProcessingSummary summarizeCompleted(QueueName queue, Instant since) {
        String sql = getSummarizeCompletedSql();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue.value());
            ps.setTimestamp(2, toTimestamp(since));

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long count = rs.getLong("completed_count");
                    if (count == 0) {
                        return ProcessingSummary.empty();
                    }
                    return new ProcessingSummary(
                            count,
                            getNullableDouble(rs, "avg_ms"),
                            getNullableDouble(rs, "p50_ms"),
                            getNullableDouble(rs, "p95_ms"));
                }
            }
            return ProcessingSummary.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "summarize completed queue messages", LOG);
        }
    }

    // Template methods for database-specific SQL

    /** INSERT with parameters (queue, type, body, priority, correlation, max_retries, created_at, scheduled_at) */
    protected abstract String getInsertSql();

    /**
     * Single-statement claim returning the claimed row, parameters (claimant, started_at, queue, now,
     * type filter, type filter).
     */
    protected abstract String getClaimSql();

    /**
     * Aggregate over completed rows with parameters (queue, since) returning completed_count, avg_ms,
     * p50_ms and p95_ms.
     */
    protected abstract String getSummarizeCompletedSql();

    // Helpers shared with dialect subclasses

    protected Optional<Message> findById(Connection conn, QueueName queue, long id) throws SQLException {
        String sql = "SELECT " + MessageMapper.COLUMNS + " FROM queue_message WHERE queue_name = ? AND id = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, queue.value());
            ps.setLong(2, id);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(MessageMapper.toDomain(rs));
                }
            }
        }
        return Optional.empty();
    }

    protected static void bindTypeFilter(PreparedStatement ps, int index, String typeFilter) throws SQLException {
        if (typeFilter == null) {
            ps.setNull(index, Types.VARCHAR);
            ps.setNull(index + 1, Types.VARCHAR);
        } else {
            ps.setString(index, typeFilter);
            ps.setString(index + 1, typeFilter);
        }
    }

    private static void insertDeadLetter(Connection conn, DeadLetterRecord record) throws SQLException {
        String sql = """
                INSERT INTO queue_dead_letter
                (queue_name, original_message_id, message_type, body, priority, correlation_id, retry_count,
                 max_retries, last_error, claimant_id, original_created_at, reason, dead_lettered_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.getQueueName());
            ps.setLong(2, record.getOriginalMessageId());
            ps.setString(3, record.getType());
            ps.setString(4, record.getBody());
            ps.setInt(5, record.getPriority());
            ps.setString(6, record.getCorrelationId());
            ps.setInt(7, record.getRetryCount());
            ps.setInt(8, record.getMaxRetries());
            ps.setString(9, record.getLastError());
            ps.setString(10, record.getClaimantId());
            ps.setTimestamp(11, toTimestamp(record.getOriginalCreatedAt()));
            ps.setString(12, record.getReason());
            ps.setTimestamp(13, toTimestamp(record.getDeadLetteredAt()));
            ps.executeUpdate();
        }
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
