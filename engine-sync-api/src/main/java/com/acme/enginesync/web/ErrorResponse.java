package com.acme.enginesync.web;

import io.micronaut.http.HttpStatus;

/** Body of the 4xx/5xx answers produced by the exception handlers. */
public record ErrorResponse(String message, int statusCode) {

  static ErrorResponse of(HttpStatus status, String message) {
    return new ErrorResponse(message != null ? message : status.getReason(), status.getCode());
  }
}
