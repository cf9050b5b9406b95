package com.acme.enginesync.web;

import com.acme.enginesync.core.TransportException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Redis unreachable while dispatching or publishing: 503 so callers can retry later. */
@Produces
@Singleton
@Requires(classes = {TransportException.class, ExceptionHandler.class})
public class TransportExceptionHandler
    implements ExceptionHandler<TransportException, HttpResponse<ErrorResponse>> {
  private static final Logger LOG = LoggerFactory.getLogger(TransportExceptionHandler.class);

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, TransportException exception) {
    LOG.error("Transport failure on {} {}", request.getMethod(), request.getPath(), exception);
    return HttpResponse.<ErrorResponse>status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ErrorResponse.of(HttpStatus.SERVICE_UNAVAILABLE, exception.getMessage()));
  }
}
