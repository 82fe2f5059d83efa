package com.acme.workqueue.persistence.jdbc.mapper;

import com.acme.workqueue.domain.Message;
import com.acme.workqueue.domain.MessageStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Maps rows of {@code queue_message} to {@link Message}. Expects the column set of
 * {@link #COLUMNS}.
 */
public final class MessageMapper {

    public static final String COLUMNS =
            "id, queue_name, message_type, body, priority, status, correlation_id, retry_count, max_retries, "
                    + "created_at, scheduled_at, claim_started_at, claim_ended_at, claimant_id, last_error";

    private MessageMapper() {}

    public static Message toDomain(ResultSet rs) throws SQLException {
        return Message.builder()
                .id(rs.getLong("id"))
                .queueName(rs.getString("queue_name"))
                .type(rs.getString("message_type"))
                .body(rs.getString("body"))
                .priority(rs.getInt("priority"))
                .status(MessageStatus.valueOf(rs.getString("status")))
                .correlationId(rs.getString("correlation_id"))
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .scheduledAt(toInstant(rs.getTimestamp("scheduled_at")))
                .claimStartedAt(toInstant(rs.getTimestamp("claim_started_at")))
                .claimEndedAt(toInstant(rs.getTimestamp("claim_ended_at")))
                .claimantId(rs.getString("claimant_id"))
                .lastError(rs.getString("last_error"))
                .build();
    }

    public static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    public static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
