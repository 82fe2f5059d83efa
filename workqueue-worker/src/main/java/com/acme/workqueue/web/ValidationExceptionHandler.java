package com.acme.workqueue.web;

import com.acme.workqueue.core.ValidationException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/** Rejected input: 400 BAD REQUEST. */
@Produces
@Singleton
public class ValidationExceptionHandler
    implements ExceptionHandler<ValidationException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, ValidationException exception) {
    return HttpResponse.badRequest(
        new ErrorResponse(exception.getMessage(), HttpStatus.BAD_REQUEST.getCode()));
  }
}
