package com.acme.workqueue.persistence.jdbc.deadletter;

import static org.assertj.core.api.Assertions.*;

import com.acme.workqueue.core.StorageException;
import com.acme.workqueue.domain.QueueName;
import com.acme.workqueue.persistence.jdbc.H2RepositoryFaultyTestBase;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Exception handling tests for JdbcDeadLetterRepository against a database with no tables. */
class H2DeadLetterRepositoryExceptionTests extends H2RepositoryFaultyTestBase {

    private static final QueueName QUEUE = QueueName.of("orders");

    @Test
    @DisplayName("every operation should surface a StorageException")
    void testOperationsFail() {
        JdbcDeadLetterRepository repository = new JdbcDeadLetterRepository(getDataSource());

        assertThatThrownBy(() -> repository.findByQueue(QUEUE, 10)).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> repository.findById(QUEUE, 1L)).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> repository.count(QUEUE)).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> repository.requeue(QUEUE, 1L, Instant.now()))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("requeue dead-letter record");
    }
}
