package dev.henneberger.vertx.changefeed.core;

import java.util.Optional;

public final class ResumeTracker {
  private volatile String token;

  public void recordToken(String token) {
    if (token == null || token.isBlank()) {
      return;
    }
    this.token = token;
  }

  public void clear() {
    token = null;
  }

  public Optional<String> currentToken() {
    return Optional.ofNullable(token);
  }
}
