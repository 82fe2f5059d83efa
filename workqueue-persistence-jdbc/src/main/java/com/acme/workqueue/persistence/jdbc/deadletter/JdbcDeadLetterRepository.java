package com.acme.workqueue.persistence.jdbc.deadletter;

import static com.acme.workqueue.persistence.jdbc.mapper.MessageMapper.toTimestamp;

import com.acme.workqueue.domain.DeadLetterRecord;
import com.acme.workqueue.domain.QueueName;
import com.acme.workqueue.persistence.jdbc.ExceptionTranslator;
import com.acme.workqueue.persistence.jdbc.JdbcTransactions;
import com.acme.workqueue.persistence.jdbc.mapper.DeadLetterMapper;
import com.acme.workqueue.repository.DeadLetterRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * JDBC implementation of DeadLetterRepository. The statements are portable across H2 and
 * PostgreSQL, so a single implementation serves both dialects.
 */
@Singleton
public class JdbcDeadLetterRepository implements DeadLetterRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDeadLetterRepository.class);

    private final DataSource dataSource;

    public JdbcDeadLetterRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DeadLetterRecord> findByQueue(QueueName queue, int limit) {
        String sql = "SELECT " + DeadLetterMapper.COLUMNS + " FROM queue_dead_letter "
                + "WHERE queue_name = ? ORDER BY dead_lettered_at DESC, id DESC LIMIT ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue.value());
            ps.setInt(2, limit);

            List<DeadLetterRecord> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(DeadLetterMapper.toDomain(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "list dead-letter records", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DeadLetterRecord> findById(QueueName queue, long id) {
        try (Connection conn = dataSource.getConnection()) {
            return findById(conn, queue, id);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find dead-letter record", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long count(QueueName queue) {
        String sql = "SELECT COUNT(*) FROM queue_dead_letter WHERE queue_name = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queue.value());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count dead-letter records", LOG);
        }
    }

    @Override
    @Transactional
    public OptionalLong requeue(QueueName queue, long deadLetterId, Instant now) {
        try (Connection conn = dataSource.getConnection()) {
            return JdbcTransactions.inTransaction(conn, c -> {
                Optional<DeadLetterRecord> found = findById(c, queue, deadLetterId);
                if (found.isEmpty()) {
                    return OptionalLong.empty();
                }
                // A concurrent requeue of the same record deletes nothing here and backs out
                if (!delete(c, queue, deadLetterId)) {
                    return OptionalLong.empty();
                }
                DeadLetterRecord record = found.get();
                long messageId = insertPending(c, record, now);
                LOG.debug("Requeued dead-letter record: queue={}, deadLetterId={}, newMessageId={}",
                        queue, deadLetterId, messageId);
                return OptionalLong.of(messageId);
            });
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "requeue dead-letter record", LOG);
        }
    }

    private Optional<DeadLetterRecord> findById(Connection conn, QueueName queue, long id) throws SQLException {
        String sql = "SELECT " + DeadLetterMapper.COLUMNS + " FROM queue_dead_letter WHERE queue_name = ? AND id = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, queue.value());
            ps.setLong(2, id);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(DeadLetterMapper.toDomain(rs));
                }
            }
        }
        return Optional.empty();
    }

    private static boolean delete(Connection conn, QueueName queue, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM queue_dead_letter WHERE queue_name = ? AND id = ?")) {
            ps.setString(1, queue.value());
            ps.setLong(2, id);
            return ps.executeUpdate() == 1;
        }
    }

    private static long insertPending(Connection conn, DeadLetterRecord record, Instant now) throws SQLException {
        String sql = """
                INSERT INTO queue_message
                (queue_name, message_type, body, priority, correlation_id, status, retry_count, max_retries,
                 created_at, scheduled_at)
                VALUES (?, ?, ?, ?, ?, 'PENDING', 0, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, record.getQueueName());
            ps.setString(2, record.getType());
            ps.setString(3, record.getBody());
            ps.setInt(4, record.getPriority());
            ps.setString(5, record.getCorrelationId());
            ps.setInt(6, record.getMaxRetries());
            ps.setTimestamp(7, toTimestamp(now));
            ps.setTimestamp(8, toTimestamp(now));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    return keys.getLong(1);
                }
            }
        }
        throw new SQLException("Insert into queue_message returned no generated key");
    }
}
