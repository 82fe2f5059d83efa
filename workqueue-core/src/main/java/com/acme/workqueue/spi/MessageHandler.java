package com.acme.workqueue.spi;

import com.acme.workqueue.domain.Message;

/**
 * Business logic for one message type. Returning normally completes the message; throwing fails
 * it, which reschedules or dead-letters it depending on its retry budget.
 */
public interface MessageHandler {

  /** Message type this handler processes */
  String type();

  void handle(Message message) throws Exception;
}
