package com.acme.workqueue.web;

import com.acme.workqueue.core.StorageException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/**
 * Database failures: 503 SERVICE UNAVAILABLE. The driver detail was already logged by the
 * repository, so the body carries only a generic message.
 */
@Produces
@Singleton
public class StorageExceptionHandler
    implements ExceptionHandler<StorageException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, StorageException exception) {
    String message =
        exception.isTransient()
            ? "Queue storage temporarily unavailable"
            : "Queue storage rejected the operation";
    return HttpResponse.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorResponse(message, HttpStatus.SERVICE_UNAVAILABLE.getCode()));
  }
}
