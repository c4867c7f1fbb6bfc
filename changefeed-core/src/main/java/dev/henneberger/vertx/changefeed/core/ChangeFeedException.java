package dev.henneberger.vertx.changefeed.core;

import java.util.Objects;

public class ChangeFeedException extends RuntimeException {

  private final FailureKind kind;
  private final int code;
  private final String codeName;

  public ChangeFeedException(FailureKind kind, int code, String codeName, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.code = code;
    this.codeName = codeName == null ? "" : codeName;
  }

  public ChangeFeedException(FailureKind kind, String message) {
    this(kind, 0, null, message, null);
  }

  public FailureKind kind() {
    return kind;
  }

  public int code() {
    return code;
  }

  public String codeName() {
    return codeName;
  }
}
