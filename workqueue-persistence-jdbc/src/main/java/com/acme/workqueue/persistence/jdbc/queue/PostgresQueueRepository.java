package com.acme.workqueue.persistence.jdbc.queue;

import com.acme.workqueue.persistence.jdbc.JdbcQueueRepository;
import com.acme.workqueue.persistence.jdbc.mapper.MessageMapper;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of QueueRepository. Claims with a single UPDATE whose
 * candidate row is picked by {@code FOR UPDATE SKIP LOCKED}, so concurrent claimers never wait on
 * each other's rows and never receive the same one.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresQueueRepository extends JdbcQueueRepository {

    public PostgresQueueRepository(DataSource dataSource) {
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

    @Override
    protected String getClaimSql() {
        return """
                UPDATE queue_message
                SET status = 'PROCESSING', claimant_id = ?, claim_started_at = ?
                WHERE id = (
                    SELECT id
                    FROM queue_message
                    WHERE queue_name = ? AND status = 'PENDING' AND scheduled_at <= ?
                        AND (CAST(? AS VARCHAR) IS NULL OR message_type = ?)
                    ORDER BY priority DESC, created_at ASC, id ASC
                    LIMIT 1
                    FOR UPDATE SKIP LOCKED
                )
                RETURNING %s
                """
                .formatted(MessageMapper.COLUMNS);
    }

    @Override
    protected String getSummarizeCompletedSql() {
        return """
                SELECT COUNT(*) AS completed_count,
                              AVG(EXTRACT(EPOCH FROM (claim_ended_at - claim_started_at)) * 1000) AS avg_ms,
                              PERCENTILE_CONT(0.5) WITHIN GROUP
                                  (ORDER BY EXTRACT(EPOCH FROM (claim_ended_at - claim_started_at)) * 1000) AS p50_ms,
                              PERCENTILE_CONT(0.95) WITHIN GROUP
                                  (ORDER BY EXTRACT(EPOCH FROM (claim_ended_at - claim_started_at)) * 1000) AS p95_ms
                FROM queue_message
                WHERE queue_name = ? AND status = 'COMPLETED' AND claim_ended_at >= ?
                    AND claim_started_at IS NOT NULL
                """;
    }
}
