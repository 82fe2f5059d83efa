package com.acme.workqueue.core;

import com.acme.workqueue.domain.MessageStatus;

/**
 * A completion or requeue was requested for a message that is not in the required state, e.g. a
 * second completion of the same claim. Nothing is changed when this is thrown.
 */
public class InvalidStateException extends RuntimeException {

  private final String queueName;
  private final long messageId;
  private final MessageStatus actualStatus;

  public InvalidStateException(
      String queueName, long messageId, MessageStatus actualStatus, String message) {
    super(message);
    this.queueName = queueName;
    this.messageId = messageId;
    this.actualStatus = actualStatus;
  }

  public static InvalidStateException notProcessing(
      String queueName, long messageId, MessageStatus actualStatus) {
    String observed = actualStatus == null ? "no active message" : "status " + actualStatus;
    return new InvalidStateException(
        queueName,
        messageId,
        actualStatus,
        String.format(
            "Message %d in queue '%s' is not PROCESSING (%s)", messageId, queueName, observed));
  }

  /** The message is PROCESSING, but under a claim other than the one reporting the outcome. */
  public static InvalidStateException claimLost(
      String queueName, long messageId, String claimantId) {
    return new InvalidStateException(
        queueName,
        messageId,
        MessageStatus.PROCESSING,
        String.format(
            "Message %d in queue '%s' is no longer claimed by '%s'",
            messageId, queueName, claimantId));
  }

  public String getQueueName() {
    return queueName;
  }

  public long getMessageId() {
    return messageId;
  }

  /** Status observed when the transition was rejected, null when no active row exists. */
  public MessageStatus getActualStatus() {
    return actualStatus;
  }
}
