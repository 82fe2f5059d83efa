package com.acme.workqueue.core;

/** Rejected caller input. Raised before anything is persisted and never retried. */
public class ValidationException extends RuntimeException {
  public ValidationException(String message) {
    super(message);
  }
}
