package com.acme.workqueue.web;

import com.acme.workqueue.core.ValidationException;
import com.acme.workqueue.domain.QueueStats;
import com.acme.workqueue.service.DeadLetterService;
import com.acme.workqueue.service.QueueService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.QueryValue;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator and producer endpoints over one queue. Queue names in the path go through the same
 * validation as every service call.
 */
@Controller("/queues/{queue}")
public class QueueAdminController {
  private static final Logger LOG = LoggerFactory.getLogger(QueueAdminController.class);

  private final QueueService queueService;
  private final DeadLetterService deadLetterService;

  public QueueAdminController(QueueService queueService, DeadLetterService deadLetterService) {
    this.queueService = queueService;
    this.deadLetterService = deadLetterService;
  }

  @Post("/messages")
  public HttpResponse<IdResponse> enqueue(
      @PathVariable String queue, @Body EnqueueMessageRequest request) {
    if (request == null) {
      throw new ValidationException("Request body is required");
    }
    long id = queueService.enqueue(queue, request.toDomain());
    LOG.debug("Enqueued over HTTP: queue={}, id={}", queue, id);
    return HttpResponse.<IdResponse>status(HttpStatus.CREATED).body(new IdResponse(id));
  }

  @Get("/messages/{id}")
  public HttpResponse<MessageView> message(@PathVariable String queue, @PathVariable long id) {
    return queueService
        .findMessage(queue, id)
        .map(m -> HttpResponse.ok(MessageView.from(m)))
        .orElseGet(HttpResponse::notFound);
  }

  @Get("/messages{?correlationId}")
  public List<MessageView> byCorrelationId(
      @PathVariable String queue, @QueryValue String correlationId) {
    return queueService.findByCorrelationId(queue, correlationId).stream()
        .map(MessageView::from)
        .toList();
  }

  @Get("/stats")
  public QueueStats stats(@PathVariable String queue) {
    return queueService.stats(queue);
  }

  @Get("/dead-letters{?limit}")
  public List<DeadLetterView> deadLetters(
      @PathVariable String queue, @QueryValue(defaultValue = "50") int limit) {
    return deadLetterService.list(queue, limit).stream().map(DeadLetterView::from).toList();
  }

  @Get("/dead-letters/{id}")
  public HttpResponse<DeadLetterView> deadLetter(@PathVariable String queue, @PathVariable long id) {
    return deadLetterService
        .find(queue, id)
        .map(r -> HttpResponse.ok(DeadLetterView.from(r)))
        .orElseGet(HttpResponse::notFound);
  }

  @Post("/dead-letters/{id}/requeue")
  public IdResponse requeue(@PathVariable String queue, @PathVariable long id) {
    return new IdResponse(deadLetterService.requeue(queue, id));
  }
}
