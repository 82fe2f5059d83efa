package com.acme.workqueue.domain;

import com.acme.workqueue.core.ValidationException;
import java.util.regex.Pattern;

/**
 * Validated queue name. Queue names only ever travel to the database as bound parameters, but
 * they also show up in logs, metrics and URLs, so the accepted alphabet is kept narrow.
 */
public record QueueName(String value) {

  public static final int MAX_LENGTH = 128;

  private static final Pattern VALID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

  public QueueName {
    if (value == null || !VALID.matcher(value).matches()) {
      throw new ValidationException(
          "Invalid queue name '" + value + "': expected 1-" + MAX_LENGTH
              + " characters of [A-Za-z0-9_.-] starting with a letter or digit");
    }
  }

  public static QueueName of(String value) {
    return new QueueName(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
