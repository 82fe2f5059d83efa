package com.acme.workqueue.handler;

import com.acme.workqueue.spi.MessageHandler;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of message handlers - maps message types to their handlers. Pure POJO - no framework
 * dependencies.
 */
public class MessageHandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(MessageHandlerRegistry.class);

  private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Register a handler under its {@link MessageHandler#type()}
   *
   * @throws IllegalStateException if a handler is already registered for this type
   */
  public void register(MessageHandler handler) {
    String type = handler.type();
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException(
          "Handler " + handler.getClass().getName() + " declares no message type");
    }
    MessageHandler existing = handlers.putIfAbsent(type, handler);
    if (existing != null) {
      String error = "Handler already registered for message type: " + type;
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registered handler for message type: {}", type);
  }

  public Optional<MessageHandler> find(String type) {
    return type == null ? Optional.empty() : Optional.ofNullable(handlers.get(type));
  }

  public Set<String> registeredTypes() {
    return new TreeSet<>(handlers.keySet());
  }
}
