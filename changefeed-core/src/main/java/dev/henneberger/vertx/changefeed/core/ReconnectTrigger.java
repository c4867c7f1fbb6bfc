package dev.henneberger.vertx.changefeed.core;

public enum ReconnectTrigger {
  ERROR,
  END,
  CLOSE,
  SERVER_ELECTION,
  OPEN_FAILURE
}
