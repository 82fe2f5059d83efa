package com.acme.workqueue.core;

public class PermanentStorageException extends StorageException {
  public PermanentStorageException(String message) {
    super(message);
  }

  public PermanentStorageException(String message, Throwable e) {
    super(message, e);
  }
}
