package com.acme.enginesync.core;

/** Raised when an inbound payload cannot be decoded into an envelope. Retrying will not help. */
public class MalformedEnvelopeException extends RuntimeException {
  public MalformedEnvelopeException(String message) {
    super(message);
  }

  public MalformedEnvelopeException(String message, Throwable e) {
    super(message, e);
  }
}
