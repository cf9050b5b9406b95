package com.acme.enginesync.spi;

@FunctionalInterface
public interface MessageListener {
  void onMessage(String channel, String message);
}
