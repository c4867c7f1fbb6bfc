package dev.henneberger.vertx.changefeed.core;

public enum FailureKind {
  TRANSIENT,
  HISTORY_LOST;

  public static FailureKind classify(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof ChangeFeedException) {
        return ((ChangeFeedException) current).kind();
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return TRANSIENT;
  }
}
