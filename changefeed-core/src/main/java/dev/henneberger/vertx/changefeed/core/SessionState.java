package dev.henneberger.vertx.changefeed.core;

public enum SessionState {
  IDLE,
  OPENING,
  LIVE,
  FAILING,
  ENDING,
  CLOSING,
  REOPENING,
  SHUT_DOWN
}
