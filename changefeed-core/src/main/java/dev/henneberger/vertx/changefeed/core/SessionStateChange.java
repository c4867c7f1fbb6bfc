package dev.henneberger.vertx.changefeed.core;

public final class SessionStateChange {
  private final String sessionId;
  private final SessionState previousState;
  private final SessionState state;
  private final ReconnectTrigger trigger;
  private final Throwable cause;

  public SessionStateChange(String sessionId,
                            SessionState previousState,
                            SessionState state,
                            ReconnectTrigger trigger,
                            Throwable cause) {
    this.sessionId = sessionId;
    this.previousState = previousState;
    this.state = state;
    this.trigger = trigger;
    this.cause = cause;
  }

  public String sessionId() {
    return sessionId;
  }

  public SessionState previousState() {
    return previousState;
  }

  public SessionState state() {
    return state;
  }

  public ReconnectTrigger trigger() {
    return trigger;
  }

  public Throwable cause() {
    return cause;
  }

  @Override
  public String toString() {
    return sessionId + ": " + previousState + " -> " + state + (trigger == null ? "" : " (" + trigger + ")");
  }
}
