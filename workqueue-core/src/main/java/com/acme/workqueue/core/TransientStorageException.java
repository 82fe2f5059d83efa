package com.acme.workqueue.core;

public class TransientStorageException extends StorageException {
  public TransientStorageException(String message) {
    super(message);
  }

  public TransientStorageException(String message, Throwable e) {
    super(message, e);
  }

  @Override
  public boolean isTransient() {
    return true;
  }
}
