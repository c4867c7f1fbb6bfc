package dev.henneberger.vertx.changefeed.core;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SessionRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

  private final Vertx vertx;
  private final List<FeedSession> sessions = new CopyOnWriteArrayList<>();
  private final Map<String, ChangeFeedHandle> handles = new ConcurrentHashMap<>();

  public SessionRegistry(Vertx vertx) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
  }

  public FeedSession create(SessionOptions options, JsonObject meta) {
    return new FeedSession(vertx, options, meta, this);
  }

  public void register(String sessionId, ChangeFeedHandle handle) {
    handles.put(Objects.requireNonNull(sessionId, "sessionId"), Objects.requireNonNull(handle, "handle"));
  }

  public List<FeedSession> sessions() {
    return List.copyOf(sessions);
  }

  public Map<String, ChangeFeedHandle> handles() {
    return Map.copyOf(handles);
  }

  /**
   * Shuts every session down and closes every registered handle. Never fails; close failures are logged.
   */
  public Future<Void> shutdownAll() {
    LOG.info("Shutting down {} change stream session(s)", sessions.size());
    List<Future<Void>> pending = new ArrayList<>();
    for (FeedSession session : sessions) {
      pending.add(shutdownQuietly(session));
    }
    for (Map.Entry<String, ChangeFeedHandle> entry : handles.entrySet()) {
      pending.add(closeQuietly(entry.getKey(), entry.getValue()));
    }

    Future<Void> all = Future.succeededFuture();
    for (Future<Void> future : pending) {
      all = all.transform(ignored -> future);
    }
    return all;
  }

  void track(FeedSession session) {
    sessions.add(Objects.requireNonNull(session, "session"));
  }

  private static Future<Void> shutdownQuietly(FeedSession session) {
    try {
      return session.shutdown().transform(ar -> {
        if (ar.failed()) {
          LOG.warn("Failed to shut down change stream session {}", session.id(), ar.cause());
        }
        return Future.<Void>succeededFuture();
      });
    } catch (RuntimeException e) {
      LOG.warn("Failed to shut down change stream session {}", session.id(), e);
      return Future.succeededFuture();
    }
  }

  private static Future<Void> closeQuietly(String sessionId, ChangeFeedHandle handle) {
    try {
      handle.removeAllHandlers();
      if (handle.isClosed()) {
        return Future.succeededFuture();
      }
      Future<Void> closing = handle.close();
      if (closing == null) {
        return Future.succeededFuture();
      }
      return closing.transform(ar -> {
        if (ar.failed()) {
          LOG.warn("Failed to close change stream of {}", sessionId, ar.cause());
        }
        return Future.<Void>succeededFuture();
      });
    } catch (RuntimeException e) {
      LOG.warn("Failed to close change stream of {}", sessionId, e);
      return Future.succeededFuture();
    }
  }
}
