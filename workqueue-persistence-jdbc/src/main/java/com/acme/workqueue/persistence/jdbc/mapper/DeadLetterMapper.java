package com.acme.workqueue.persistence.jdbc.mapper;

import static com.acme.workqueue.persistence.jdbc.mapper.MessageMapper.toInstant;

import com.acme.workqueue.domain.DeadLetterRecord;
import java.sql.ResultSet;
import java.sql.SQLException;

/** Maps rows of {@code queue_dead_letter} to {@link DeadLetterRecord}. */
public final class DeadLetterMapper {

    public static final String COLUMNS =
            "id, queue_name, original_message_id, message_type, body, priority, correlation_id, retry_count, "
                    + "max_retries, last_error, claimant_id, original_created_at, reason, dead_lettered_at";

    private DeadLetterMapper() {}

    public static DeadLetterRecord toDomain(ResultSet rs) throws SQLException {
        return DeadLetterRecord.builder()
                .id(rs.getLong("id"))
                .queueName(rs.getString("queue_name"))
                .originalMessageId(rs.getLong("original_message_id"))
                .type(rs.getString("message_type"))
                .body(rs.getString("body"))
                .priority(rs.getInt("priority"))
                .correlationId(rs.getString("correlation_id"))
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .lastError(rs.getString("last_error"))
                .claimantId(rs.getString("claimant_id"))
                .originalCreatedAt(toInstant(rs.getTimestamp("original_created_at")))
                .reason(rs.getString("reason"))
                .deadLetteredAt(toInstant(rs.getTimestamp("dead_lettered_at")))
                .build();
    }
}
