package com.acme.workqueue.web;

import com.acme.workqueue.core.InvalidStateException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/** Transition requested on a message in the wrong state: 409 CONFLICT. */
@Produces
@Singleton
public class InvalidStateExceptionHandler
    implements ExceptionHandler<InvalidStateException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, InvalidStateException exception) {
    return HttpResponse.status(HttpStatus.CONFLICT)
        .body(new ErrorResponse(exception.getMessage(), HttpStatus.CONFLICT.getCode()));
  }
}
