package com.acme.enginesync.spi;

import java.util.UUID;

/** Source of globally unique opaque ids. */
@FunctionalInterface
public interface IdGenerator {

  String nextId();

  static IdGenerator uuid() {
    return () -> UUID.randomUUID().toString();
  }
}
