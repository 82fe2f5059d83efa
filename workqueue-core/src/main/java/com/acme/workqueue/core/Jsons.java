package com.acme.workqueue.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new ValidationException("Payload is not serializable to JSON: " + e.getMessage());
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new IllegalArgumentException(
          "Cannot read " + clazz.getSimpleName() + " from JSON: " + e.getMessage(), e);
    }
  }
}
