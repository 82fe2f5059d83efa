package com.acme.workqueue.processor;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.workqueue.config.ConsumerConfig;
import com.acme.workqueue.core.InvalidStateException;
import com.acme.workqueue.domain.Message;
import com.acme.workqueue.domain.MessageStatus;
import com.acme.workqueue.handler.MessageHandlerRegistry;
import com.acme.workqueue.service.QueueService;
import com.acme.workqueue.spi.MessageHandler;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueueConsumer Tests")
class QueueConsumerTest {

  @Mock private QueueService queueService;
  @Mock private MessageHandler emailHandler;

  private MessageHandlerRegistry registry;
  private ConsumerConfig config;
  private QueueConsumer consumer;

  @BeforeEach
  void setup() {
    registry = new MessageHandlerRegistry();
    config = new ConsumerConfig();
    config.setQueue("emails");
    config.setTypeFilter("EmailSend");
    config.setPollInterval(Duration.ofMillis(10));
    consumer = new QueueConsumer(queueService, registry, config);
  }

  private static Message claimed(long id, String type) {
    return Message.builder()
        .id(id)
        .queueName("emails")
        .type(type)
        .body("{}")
        .status(MessageStatus.PROCESSING)
        .claimantId("c-" + id)
        .build();
  }

  private void registerEmailHandler() {
    when(emailHandler.type()).thenReturn("EmailSend");
    registry.register(emailHandler);
  }

  @Nested
  @DisplayName("pollOnce Tests")
  class PollOnceTests {

    @Test
    @DisplayName("should report success when the handler returns")
    void testSuccess() throws Exception {
      registerEmailHandler();
      Message message = claimed(1L, "EmailSend");
      when(queueService.claim("emails", "EmailSend", "c-1")).thenReturn(Optional.of(message));

      assertThat(consumer.pollOnce("c-1")).isTrue();

      verify(emailHandler).handle(message);
      verify(queueService).complete("emails", 1L, "c-1", true, null);
    }

    @Test
    @DisplayName("should report failure with the exception message when the handler throws")
    void testHandlerFailure() throws Exception {
      registerEmailHandler();
      Message message = claimed(2L, "EmailSend");
      when(queueService.claim(any(), any(), any())).thenReturn(Optional.of(message));
      doThrow(new IllegalStateException("smtp down")).when(emailHandler).handle(message);

      consumer.pollOnce(null);

      verify(queueService).complete("emails", 2L, "c-2", false, "smtp down");
    }

    @Test
    @DisplayName("should fall back to the exception class when the message is empty")
    void testHandlerFailureWithoutMessage() throws Exception {
      registerEmailHandler();
      Message message = claimed(3L, "EmailSend");
      when(queueService.claim(any(), any(), any())).thenReturn(Optional.of(message));
      doThrow(new NullPointerException()).when(emailHandler).handle(message);

      consumer.pollOnce(null);

      verify(queueService).complete("emails", 3L, "c-3", false, "java.lang.NullPointerException");
    }

    @Test
    @DisplayName("should fail messages without a registered handler")
    void testMissingHandler() {
      when(queueService.claim(any(), any(), any())).thenReturn(Optional.of(claimed(4L, "Unknown")));

      consumer.pollOnce(null);

      verify(queueService).complete("emails", 4L, "c-4", false, "No handler registered for type Unknown");
    }

    @Test
    @DisplayName("should return false on an empty queue")
    void testEmptyQueue() {
      when(queueService.claim(any(), any(), any())).thenReturn(Optional.empty());

      assertThat(consumer.pollOnce(null)).isFalse();
      verify(queueService, never()).complete(any(), anyLong(), any(), anyBoolean(), any());
    }

    @Test
    @DisplayName("should tolerate a rejected completion")
    void testRejectedCompletion() {
      registerEmailHandler();
      when(queueService.claim(any(), any(), any())).thenReturn(Optional.of(claimed(5L, "EmailSend")));
      doThrow(InvalidStateException.notProcessing("emails", 5L, MessageStatus.PENDING))
          .when(queueService)
          .complete("emails", 5L, "c-5", true, null);

      assertThatCode(() -> consumer.pollOnce(null)).doesNotThrowAnyException();
    }
  }

  @Nested
  @DisplayName("Lifecycle Tests")
  class LifecycleTests {

    @Test
    @DisplayName("start and stop should toggle the running flag")
    void testStartStop() {
      lenient().when(queueService.claim(any(), any(), any())).thenReturn(Optional.empty());
      config.setThreads(2);
      config.setClaimantPrefix("test");

      consumer.start();
      assertThat(consumer.isRunning()).isTrue();

      consumer.stop();
      assertThat(consumer.isRunning()).isFalse();
    }

    @Test
    @DisplayName("stop without start should be a no-op")
    void testStopWithoutStart() {
      assertThatCode(() -> consumer.stop()).doesNotThrowAnyException();
    }
  }
}
