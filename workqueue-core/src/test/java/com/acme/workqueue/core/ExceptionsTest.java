package com.acme.workqueue.core;

import static org.assertj.core.api.Assertions.*;

import com.acme.workqueue.domain.MessageStatus;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for the queue exception taxonomy */
class ExceptionsTest {

  @Nested
  @DisplayName("StorageException Tests")
  class StorageExceptionTests {

    @Test
    @DisplayName("transient and permanent variants are storage exceptions")
    void hierarchy() {
      assertThat(new TransientStorageException("t")).isInstanceOf(StorageException.class);
      assertThat(new PermanentStorageException("p")).isInstanceOf(StorageException.class);
      assertThat(new StorageException("s")).isInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("only the transient variant reports itself as transient")
    void transientFlag() {
      assertThat(new TransientStorageException("t").isTransient()).isTrue();
      assertThat(new PermanentStorageException("p").isTransient()).isFalse();
      assertThat(new StorageException("s").isTransient()).isFalse();
    }

    @Test
    @DisplayName("keeps the underlying cause")
    void keepsCause() {
      SQLException cause = new SQLException("connection reset", "08006");

      assertThat(new TransientStorageException("claim failed", cause)).hasCause(cause);
    }
  }

  @Nested
  @DisplayName("InvalidStateException Tests")
  class InvalidStateExceptionTests {

    @Test
    @DisplayName("notProcessing describes the observed status")
    void describesStatus() {
      InvalidStateException e = InvalidStateException.notProcessing("q", 7L, MessageStatus.COMPLETED);

      assertThat(e.getQueueName()).isEqualTo("q");
      assertThat(e.getMessageId()).isEqualTo(7L);
      assertThat(e.getActualStatus()).isEqualTo(MessageStatus.COMPLETED);
      assertThat(e).hasMessage("Message 7 in queue 'q' is not PROCESSING (status COMPLETED)");
    }

    @Test
    @DisplayName("notProcessing describes a missing row")
    void describesMissingRow() {
      InvalidStateException e = InvalidStateException.notProcessing("q", 8L, null);

      assertThat(e.getActualStatus()).isNull();
      assertThat(e).hasMessageContaining("no active message");
    }
  }

  @Test
  @DisplayName("ValidationException is unchecked")
  void validationIsUnchecked() {
    assertThatThrownBy(
            () -> {
              throw new ValidationException("body must not be empty");
            })
        .isInstanceOf(RuntimeException.class)
        .hasMessage("body must not be empty");
  }
}
