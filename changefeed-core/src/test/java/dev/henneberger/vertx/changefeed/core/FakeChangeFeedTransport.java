package dev.henneberger.vertx.changefeed.core;

import static org.junit.jupiter.api.Assertions.assertNotNull;

import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted transport: every open hands out a {@link FakeHandle} the test drives by hand, and every interaction is
 * written to a journal so tests can check ordering across generations.
 */
final class FakeChangeFeedTransport implements ChangeFeedTransport {

  final List<String> journal = new CopyOnWriteArrayList<>();

  private final BlockingQueue<OpenCall> opens = new LinkedBlockingQueue<>();
  private final List<Handler<TopologyChange>> topologyHandlers = new CopyOnWriteArrayList<>();
  private final Queue<OpenFailure> openFailures = new ConcurrentLinkedQueue<>();
  private final AtomicInteger openCount = new AtomicInteger();

  @Override
  public Future<ChangeFeedHandle> open(String collection, List<JsonObject> pipeline, JsonObject options) {
    int number = openCount.incrementAndGet();
    journal.add("open#" + number);

    OpenFailure failure = openFailures.poll();
    if (failure != null) {
      opens.add(new OpenCall(number, collection, pipeline, options.copy(), null));
      if (failure.synchronous) {
        throw failure.error;
      }
      return Future.failedFuture(failure.error);
    }

    FakeHandle handle = new FakeHandle(number, Vertx.currentContext(), journal);
    opens.add(new OpenCall(number, collection, new ArrayList<>(pipeline), options.copy(), handle));
    return Future.succeededFuture(handle);
  }

  @Override
  public FeedSubscription onTopologyChange(Handler<TopologyChange> handler) {
    topologyHandlers.add(handler);
    return () -> topologyHandlers.remove(handler);
  }

  void failNextOpen(RuntimeException error, boolean synchronous) {
    openFailures.add(new OpenFailure(error, synchronous));
  }

  void emitTopologyChange(TopologyChange change) {
    for (Handler<TopologyChange> handler : topologyHandlers) {
      handler.handle(change);
    }
  }

  int topologyListenerCount() {
    return topologyHandlers.size();
  }

  int openCount() {
    return openCount.get();
  }

  OpenCall awaitOpen() throws InterruptedException {
    OpenCall call = opens.poll(5, TimeUnit.SECONDS);
    assertNotNull(call, "expected the session to open a change stream");
    return call;
  }

  OpenCall pollOpen(Duration timeout) throws InterruptedException {
    return opens.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  static ChangeFeedEvent event(String token) {
    return event(token, ChangeFeedEvent.Operation.INSERT);
  }

  static ChangeFeedEvent event(String token, ChangeFeedEvent.Operation operation) {
    return new ChangeFeedEvent(
      "app.orders",
      operation,
      Map.of(),
      Map.of("_id", token),
      token,
      Instant.parse("2026-02-15T20:00:00Z"),
      Map.of("adapter", "fake"));
  }

  static final class OpenCall {
    final int number;
    final String collection;
    final List<JsonObject> pipeline;
    final JsonObject options;
    final FakeHandle handle;

    private OpenCall(int number, String collection, List<JsonObject> pipeline, JsonObject options, FakeHandle handle) {
      this.number = number;
      this.collection = collection;
      this.pipeline = pipeline;
      this.options = options;
      this.handle = handle;
    }
  }

  private static final class OpenFailure {
    private final RuntimeException error;
    private final boolean synchronous;

    private OpenFailure(RuntimeException error, boolean synchronous) {
      this.error = error;
      this.synchronous = synchronous;
    }
  }

  static class FakeHandle implements ChangeFeedHandle {
    final int number;
    private final Context context;
    private final List<String> journal;

    private volatile Handler<ChangeFeedEvent> changeHandler;
    private volatile Handler<Throwable> exceptionHandler;
    private volatile Handler<Void> endHandler;
    private volatile Handler<Void> closeHandler;
    private volatile boolean closed;

    FakeHandle(int number, Context context, List<String> journal) {
      this.number = number;
      this.context = context;
      this.journal = journal;
    }

    @Override
    public ChangeFeedHandle changeHandler(Handler<ChangeFeedEvent> handler) {
      this.changeHandler = handler;
      return this;
    }

    @Override
    public ChangeFeedHandle exceptionHandler(Handler<Throwable> handler) {
      this.exceptionHandler = handler;
      return this;
    }

    @Override
    public ChangeFeedHandle endHandler(Handler<Void> handler) {
      this.endHandler = handler;
      return this;
    }

    @Override
    public ChangeFeedHandle closeHandler(Handler<Void> handler) {
      this.closeHandler = handler;
      return this;
    }

    @Override
    public void removeAllHandlers() {
      journal.add("detach#" + number);
      changeHandler = null;
      exceptionHandler = null;
      endHandler = null;
      closeHandler = null;
    }

    @Override
    public Future<Void> close() {
      if (closed) {
        return Future.succeededFuture();
      }
      closed = true;
      journal.add("close#" + number);
      Handler<Void> handler = closeHandler;
      if (handler != null) {
        context.runOnContext(v -> handler.handle(null));
      }
      return Future.succeededFuture();
    }

    @Override
    public boolean isClosed() {
      return closed;
    }

    boolean hasHandlers() {
      return changeHandler != null || exceptionHandler != null || endHandler != null || closeHandler != null;
    }

    void emitChange(ChangeFeedEvent event) {
      context.runOnContext(v -> {
        Handler<ChangeFeedEvent> handler = changeHandler;
        if (handler != null) {
          handler.handle(event);
        }
      });
    }

    void emitError(Throwable error) {
      context.runOnContext(v -> {
        Handler<Throwable> handler = exceptionHandler;
        if (handler != null) {
          handler.handle(error);
        }
      });
    }

    void emitEnd() {
      context.runOnContext(v -> {
        Handler<Void> handler = endHandler;
        if (handler != null) {
          handler.handle(null);
        }
      });
    }

    void emitClose() {
      context.runOnContext(v -> {
        Handler<Void> handler = closeHandler;
        if (handler != null) {
          handler.handle(null);
        }
      });
    }
  }
}
