package com.acme.enginesync.core;

/** The pub/sub bus or job queue could not be reached. */
public class TransportException extends RuntimeException {
  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable e) {
    super(message, e);
  }
}
