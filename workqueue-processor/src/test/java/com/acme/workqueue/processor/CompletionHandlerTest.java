package com.acme.workqueue.processor;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.workqueue.core.InvalidStateException;
import com.acme.workqueue.domain.Message;
import com.acme.workqueue.domain.MessageStatus;
import com.acme.workqueue.domain.QueueName;
import com.acme.workqueue.repository.QueueRepository;
import com.acme.workqueue.retry.BackoffPolicy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("CompletionHandler Tests")
class CompletionHandlerTest {

  private static final QueueName QUEUE = QueueName.of("orders");
  private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

  @Mock private QueueRepository repository;

  private CompletionHandler handler;

  @BeforeEach
  void setup() {
    handler =
        new CompletionHandler(
            repository,
            new BackoffPolicy(Duration.ofSeconds(60), Duration.ofHours(1)),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static Message processing(long id, int retryCount, int maxRetries) {
    return Message.builder()
        .id(id)
        .queueName("orders")
        .type("OrderPlaced")
        .body("{}")
        .status(MessageStatus.PROCESSING)
        .retryCount(retryCount)
        .maxRetries(maxRetries)
        .claimantId("w-1")
        .createdAt(NOW.minusSeconds(30))
        .scheduledAt(NOW.minusSeconds(30))
        .claimStartedAt(NOW.minusSeconds(1))
        .build();
  }

  @Nested
  @DisplayName("Success")
  class SuccessTests {

    @Test
    @DisplayName("should mark the message completed at the current time")
    void testSuccess() {
      when(repository.findById(QUEUE, 7L)).thenReturn(Optional.of(processing(7L, 0, 3)));
      when(repository.markCompleted(QUEUE, 7L, "w-1", NOW)).thenReturn(true);

      handler.complete(QUEUE, 7L, true, null);

      verify(repository).markCompleted(QUEUE, 7L, "w-1", NOW);
      verify(repository, never()).reschedule(any(), anyLong(), any(), anyInt(), any(), any());
    }

    @Test
    @DisplayName("should reject a second completion")
    void testAlreadyCompleted() {
      Message completed = processing(7L, 0, 3).toBuilder().status(MessageStatus.COMPLETED).build();
      when(repository.findById(QUEUE, 7L)).thenReturn(Optional.of(completed));

      assertThatThrownBy(() -> handler.complete(QUEUE, 7L, true, null))
          .isInstanceOf(InvalidStateException.class)
          .hasMessageContaining("status COMPLETED");
      verify(repository, never()).markCompleted(any(), anyLong(), any(), any());
    }

    @Test
    @DisplayName("should reject an unknown message")
    void testUnknownMessage() {
      when(repository.findById(QUEUE, 99L)).thenReturn(Optional.empty());

      assertThatThrownBy(() -> handler.complete(QUEUE, 99L, true, null))
          .isInstanceOfSatisfying(
              InvalidStateException.class,
              e -> {
                assertThat(e.getActualStatus()).isNull();
                assertThat(e.getMessageId()).isEqualTo(99L);
                assertThat(e.getQueueName()).isEqualTo("orders");
              });
    }

    @Test
    @DisplayName("should report the current state when the guarded update loses")
    void testLostGuard() {
      Message claimed = processing(7L, 0, 3);
      Message completed = claimed.toBuilder().status(MessageStatus.COMPLETED).build();
      when(repository.findById(QUEUE, 7L))
          .thenReturn(Optional.of(claimed))
          .thenReturn(Optional.of(completed));
      when(repository.markCompleted(QUEUE, 7L, "w-1", NOW)).thenReturn(false);

      assertThatThrownBy(() -> handler.complete(QUEUE, 7L, true, null))
          .isInstanceOfSatisfying(
              InvalidStateException.class,
              e -> assertThat(e.getActualStatus()).isEqualTo(MessageStatus.COMPLETED));
    }
  }

  @Nested
  @DisplayName("Claim ownership")
  class ClaimOwnershipTests {

    @Test
    @DisplayName("should reject an outcome from a claimant that no longer holds the message")
    void testFormerClaimantRejected() {
      when(repository.findById(QUEUE, 7L)).thenReturn(Optional.of(processing(7L, 0, 3)));

      assertThatThrownBy(() -> handler.complete(QUEUE, 7L, "w-old", true, null))
          .isInstanceOfSatisfying(
              InvalidStateException.class,
              e -> {
                assertThat(e.getActualStatus()).isEqualTo(MessageStatus.PROCESSING);
                assertThat(e).hasMessage("Message 7 in queue 'orders' is no longer claimed by 'w-old'");
              });
      verify(repository, never()).markCompleted(any(), anyLong(), any(), any());
      verify(repository, never()).reschedule(any(), anyLong(), any(), anyInt(), any(), any());
      verify(repository, never()).moveToDeadLetter(any(), any(), any(), any());
    }

    @Test
    @DisplayName("should accept an outcome from the current claimant")
    void testCurrentClaimantAccepted() {
      when(repository.findById(QUEUE, 7L)).thenReturn(Optional.of(processing(7L, 0, 3)));
      when(repository.markCompleted(QUEUE, 7L, "w-1", NOW)).thenReturn(true);

      handler.complete(QUEUE, 7L, "w-1", true, null);

      verify(repository).markCompleted(QUEUE, 7L, "w-1", NOW);
    }

    @Test
    @DisplayName("should report a lost claim when the message was claimed again mid-completion")
    void testReclaimedDuringCompletion() {
      Message claimed = processing(7L, 0, 3);
      Message reclaimed = claimed.toBuilder().claimantId("w-2").build();
      when(repository.findById(QUEUE, 7L))
          .thenReturn(Optional.of(claimed))
          .thenReturn(Optional.of(reclaimed));
      when(repository.markCompleted(QUEUE, 7L, "w-1", NOW)).thenReturn(false);

      assertThatThrownBy(() -> handler.complete(QUEUE, 7L, true, null))
          .isInstanceOf(InvalidStateException.class)
          .hasMessageContaining("no longer claimed by 'w-1'");
    }
  }

  @Nested
  @DisplayName("Failure with retries left")
  class RetryTests {

    @Test
    @DisplayName("first failure should be retried after the base delay")
    void testFirstRetry() {
      when(repository.findById(QUEUE, 7L)).thenReturn(Optional.of(processing(7L, 0, 3)));
      when(repository.reschedule(QUEUE, 7L, "w-1", 0, "timeout", NOW.plusSeconds(60))).thenReturn(true);

      handler.complete(QUEUE, 7L, false, "timeout");

      verify(repository).reschedule(QUEUE, 7L, "w-1", 0, "timeout", NOW.plusSeconds(60));
    }

    @Test
    @DisplayName("third failure should wait four times the base delay")
    void testBackoffGrows() {
      when(repository.findById(QUEUE, 7L)).thenReturn(Optional.of(processing(7L, 2, 5)));
      when(repository.reschedule(QUEUE, 7L, "w-1", 2, "timeout", NOW.plusSeconds(240))).thenReturn(true);

      handler.complete(QUEUE, 7L, false, "timeout");

      verify(repository).reschedule(QUEUE, 7L, "w-1", 2, "timeout", NOW.plusSeconds(240));
      verify(repository, never()).moveToDeadLetter(any(), any(), any(), any());
    }

    @Test
    @DisplayName("lost reschedule guard should raise InvalidStateException")
    void testRescheduleLostGuard() {
      when(repository.findById(QUEUE, 7L))
          .thenReturn(Optional.of(processing(7L, 0, 3)))
          .thenReturn(Optional.empty());
      when(repository.reschedule(eq(QUEUE), eq(7L), eq("w-1"), eq(0), any(), any())).thenReturn(false);

      assertThatThrownBy(() -> handler.complete(QUEUE, 7L, false, "timeout"))
          .isInstanceOf(InvalidStateException.class)
          .hasMessageContaining("no active message");
    }
  }

  @Nested
  @DisplayName("Failure with retry budget spent")
  class DeadLetterTests {

    @Test
    @DisplayName("should move the snapshot to the dead-letter store")
    void testDeadLetter() {
      Message message = processing(7L, 2, 2);
      when(repository.findById(QUEUE, 7L)).thenReturn(Optional.of(message));
      when(repository.moveToDeadLetter(message, "max retries exceeded", "bad payload", NOW))
          .thenReturn(true);

      handler.complete(QUEUE, 7L, false, "bad payload");

      verify(repository).moveToDeadLetter(message, "max retries exceeded", "bad payload", NOW);
      verify(repository, never()).reschedule(any(), anyLong(), any(), anyInt(), any(), any());
    }

    @Test
    @DisplayName("zero retry budget should dead-letter on the first failure")
    void testZeroRetries() {
      Message message = processing(7L, 0, 0);
      when(repository.findById(QUEUE, 7L)).thenReturn(Optional.of(message));
      when(repository.moveToDeadLetter(any(), any(), any(), any())).thenReturn(true);

      handler.complete(QUEUE, 7L, false, "bad payload");

      verify(repository).moveToDeadLetter(message, "max retries exceeded", "bad payload", NOW);
    }

    @Test
    @DisplayName("should reject a message that is still PENDING")
    void testPendingRejected() {
      Message pending = processing(7L, 1, 3).toBuilder().status(MessageStatus.PENDING).build();
      when(repository.findById(QUEUE, 7L)).thenReturn(Optional.of(pending));

      assertThatThrownBy(() -> handler.complete(QUEUE, 7L, false, "x"))
          .isInstanceOf(InvalidStateException.class)
          .hasMessage("Message 7 in queue 'orders' is not PROCESSING (status PENDING)");
      verifyNoMoreInteractions(ignoreStubs(repository));
    }
  }
}
