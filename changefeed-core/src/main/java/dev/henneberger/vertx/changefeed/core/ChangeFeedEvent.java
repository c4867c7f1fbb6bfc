package dev.henneberger.vertx.changefeed.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class ChangeFeedEvent {

  public enum Operation {
    INSERT,
    UPDATE,
    REPLACE,
    DELETE,
    INVALIDATE,
    OTHER
  }

  private final String source;
  private final Operation operation;
  private final Map<String, Object> before;
  private final Map<String, Object> after;
  private final String resumeToken;
  private final Instant clusterTime;
  private final Map<String, Object> metadata;

  public ChangeFeedEvent(String source,
                         Operation operation,
                         Map<String, Object> before,
                         Map<String, Object> after,
                         String resumeToken,
                         Instant clusterTime,
                         Map<String, Object> metadata) {
    this.source = Objects.requireNonNull(source, "source");
    this.operation = Objects.requireNonNull(operation, "operation");
    this.before = immutableCopy(before);
    this.after = immutableCopy(after);
    this.resumeToken = resumeToken;
    this.clusterTime = clusterTime;
    this.metadata = immutableCopy(metadata);
  }

  public String getSource() { return source; }
  public Operation getOperation() { return operation; }
  public Map<String, Object> getBefore() { return before; }
  public Map<String, Object> getAfter() { return after; }
  public String getResumeToken() { return resumeToken; }
  public Instant getClusterTime() { return clusterTime; }
  public Map<String, Object> getMetadata() { return metadata; }

  public boolean hasResumeToken() {
    return resumeToken != null && !resumeToken.isBlank();
  }

  @Override
  public String toString() {
    return "ChangeFeedEvent{source=" + source + ", operation=" + operation + ", resumeToken=" + resumeToken + '}';
  }

  private static Map<String, Object> immutableCopy(Map<String, Object> input) {
    if (input == null || input.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(input));
  }
}
