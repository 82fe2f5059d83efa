package com.acme.workqueue.core;

/**
 * Persistence-layer failure. Surfaced unchanged to the caller of enqueue, claim and complete; the
 * queue never retries storage operations on its own.
 */
public class StorageException extends RuntimeException {
  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable e) {
    super(message, e);
  }

  /** Whether the same call may succeed if the caller tries again later. */
  public boolean isTransient() {
    return false;
  }
}
