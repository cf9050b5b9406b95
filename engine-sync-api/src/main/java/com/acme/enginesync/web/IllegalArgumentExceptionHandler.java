package com.acme.enginesync.web;

import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/** Maps rejected input (blank ids, missing response) to 400 BAD REQUEST. */
@Produces
@Singleton
@Requires(classes = {IllegalArgumentException.class, ExceptionHandler.class})
public class IllegalArgumentExceptionHandler
    implements ExceptionHandler<IllegalArgumentException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, IllegalArgumentException exception) {
    String message = exception.getMessage();
    return HttpResponse.badRequest(
        ErrorResponse.of(HttpStatus.BAD_REQUEST, message != null ? message : "Invalid request"));
  }
}
