package com.acme.workqueue.sample;

import com.acme.workqueue.core.Jsons;
import com.acme.workqueue.domain.Message;
import com.acme.workqueue.spi.MessageHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sample handler for {@code EmailSend} messages. Stands in for a real mail gateway: it validates
 * the payload and logs the send. A payload without a recipient fails the attempt.
 */
@Singleton
public class EmailMessageHandler implements MessageHandler {
  private static final Logger LOG = LoggerFactory.getLogger(EmailMessageHandler.class);

  public static final String TYPE = "EmailSend";

  public record EmailPayload(String to, String subject, String body) {}

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public void handle(Message message) {
    EmailPayload email = Jsons.fromJson(message.getBody(), EmailPayload.class);
    if (email.to() == null || email.to().isBlank()) {
      throw new IllegalArgumentException("Email recipient is missing");
    }
    LOG.info(
        "Sent email: messageId={}, to={}, subject={}", message.getId(), email.to(), email.subject());
  }
}
