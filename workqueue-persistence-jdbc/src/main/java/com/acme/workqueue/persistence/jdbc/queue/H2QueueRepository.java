package com.acme.workqueue.persistence.jdbc.queue;

import static com.acme.workqueue.persistence.jdbc.mapper.MessageMapper.toTimestamp;

import com.acme.workqueue.domain.Message;
import com.acme.workqueue.domain.QueueName;
import com.acme.workqueue.persistence.jdbc.ExceptionTranslator;
import com.acme.workqueue.persistence.jdbc.JdbcQueueRepository;
import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * H2-specific implementation of QueueRepository. H2 has neither SKIP LOCKED nor UPDATE ...
 * RETURNING, so a claim reads a short list of candidates in claim order and takes the first one
 * whose conditional update still finds it PENDING. A lost race just moves on to the next candidate.
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2QueueRepository extends JdbcQueueRepository {

    private static final Logger LOG = LoggerFactory.getLogger(H2QueueRepository.class);

    static final int CLAIM_CANDIDATES = 16;

    // org.h2.api.ErrorCode.CONCURRENT_UPDATE_1
    private static final int H2_CONCURRENT_UPDATE = 90131;

    public H2QueueRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO queue_message
                (queue_name, message_type, body, priority, correlation_id, status, retry_count, max_retries,
                  created_at, scheduled_at)
                VALUES (?, ?, ?, ?, ?, 'PENDING', 0, ?, ?, ?)
                """;
    }

    /** Conditional update of one candidate, parameters (claimant, started_at, id, now). */
    @Override
    protected String getClaimSql() {
        return """
                UPDATE queue_message
                SET status = 'PROCESSING', claimant_id = ?, claim_started_at = ?
                WHERE id = ? AND status = 'PENDING' AND scheduled_at <= ?
                """;
    }

    @Override
    @Transactional
    public Optional<Message> claimNext(
            QueueName queue, String typeFilter, String claimantId, Instant now) {
        try (Connection conn = dataSource.getConnection()) {
            while (true) {
                List<Long> candidates = selectCandidates(conn, queue, typeFilter, now);
                if (candidates.isEmpty()) {
                    return Optional.empty();
                }
                for (long id : candidates) {
                    if (tryClaim(conn, id, claimantId, now)) {
                        LOG.debug("Claimed message: queue={}, id={}, claimant={}", queue, id, claimantId);
                        return findById(conn, queue, id);
                    }
                }
                // every candidate went to a concurrent claimer; look again
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "claim next queue message", LOG);
        }
    }

    @Override
    protected String getSummarizeCompletedSql() {
        return """
                SELECT COUNT(*) AS completed_count,
                              AVG(CAST(DATEDIFF('MILLISECOND', claim_started_at, claim_ended_at) AS DOUBLE PRECISION)) AS avg_ms,
                              PERCENTILE_CONT(0.5) WITHIN GROUP
                                  (ORDER BY DATEDIFF('MILLISECOND', claim_started_at, claim_ended_at)) AS p50_ms,
                              PERCENTILE_CONT(0.95) WITHIN GROUP
                                  (ORDER BY DATEDIFF('MILLISECOND', claim_started_at, claim_ended_at)) AS p95_ms
                FROM queue_message
                WHERE queue_name = ? AND status = 'COMPLETED' AND claim_ended_at >= ?
                    AND claim_started_at IS NOT NULL
                """;
    }

    private List<Long> selectCandidates(
            Connection conn, QueueName queue, String typeFilter, Instant now) throws SQLException {
        String sql =
                """
                        SELECT id
                        FROM queue_message
                        WHERE queue_name = ? AND status = 'PENDING' AND scheduled_at <= ?
                            AND (CAST(? AS VARCHAR(100)) IS NULL OR message_type = ?)
                        ORDER BY priority DESC, created_at ASC, id ASC
                        LIMIT ?
                        """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, queue.value());
            ps.setTimestamp(2, toTimestamp(now));
            bindTypeFilter(ps, 3, typeFilter);
            ps.setInt(5, CLAIM_CANDIDATES);

            List<Long> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong("id"));
                }
            }
            return ids;
        }
    }

    private boolean tryClaim(Connection conn, long id, String claimantId, Instant now)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getClaimSql())) {
            ps.setString(1, claimantId);
            ps.setTimestamp(2, toTimestamp(now));
            ps.setLong(3, id);
            ps.setTimestamp(4, toTimestamp(now));
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            if (e.getErrorCode() == H2_CONCURRENT_UPDATE) {
                LOG.debug("Lost claim race: id={}, claimant={}", id, claimantId);
                return false;
            }
            throw e;
        }
    }
}
