package dev.henneberger.vertx.changefeed.mongodb;

import com.mongodb.MongoNamespace;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.OperationType;
import dev.henneberger.vertx.changefeed.core.ChangeFeedEvent;
import dev.henneberger.vertx.changefeed.core.ChangeFeedHandle;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class MongoChangeFeedHandle implements ChangeFeedHandle {

  private static final Logger LOG = LoggerFactory.getLogger(MongoChangeFeedHandle.class);

  private final Context context;
  private final MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor;
  private final String source;
  private final Thread reader;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final Promise<Void> stopped = Promise.promise();

  private volatile Handler<ChangeFeedEvent> changeHandler;
  private volatile Handler<Throwable> exceptionHandler;
  private volatile Handler<Void> endHandler;
  private volatile Handler<Void> closeHandler;

  MongoChangeFeedHandle(Context context,
                        MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor,
                        String source) {
    this.context = Objects.requireNonNull(context, "context");
    this.cursor = Objects.requireNonNull(cursor, "cursor");
    this.source = Objects.requireNonNull(source, "source");
    this.reader = new Thread(this::readLoop, "mongodb-change-feed-" + source);
    this.reader.setDaemon(true);
  }

  @Override
  public ChangeFeedHandle changeHandler(Handler<ChangeFeedEvent> handler) {
    this.changeHandler = handler;
    if (handler != null && !closed.get() && started.compareAndSet(false, true)) {
      reader.start();
    }
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
    changeHandler = null;
    exceptionHandler = null;
    endHandler = null;
    closeHandler = null;
  }

  @Override
  public Future<Void> close() {
    if (!closed.compareAndSet(false, true)) {
      return stopped.future();
    }
    if (started.compareAndSet(false, true)) {
      // the reader never ran, so nobody else will close the cursor
      context.owner().executeBlocking(() -> {
        closeCursor();
        return null;
      }, false).onComplete(ar -> stopped.tryComplete());
    }
    deliver(() -> closeHandler, null);
    return stopped.future();
  }

  @Override
  public boolean isClosed() {
    return closed.get();
  }

  private void readLoop() {
    try {
      while (!closed.get()) {
        ChangeStreamDocument<Document> change = cursor.tryNext();
        if (change == null) {
          continue;
        }
        ChangeFeedEvent event = toEvent(source, change);
        if (!deliverAndAwait(event)) {
          return;
        }
        if (event.getOperation() == ChangeFeedEvent.Operation.INVALIDATE) {
          LOG.info("Change stream on {} was invalidated", source);
          deliver(() -> endHandler, null);
          return;
        }
      }
    } catch (RuntimeException e) {
      if (closed.get()) {
        LOG.debug("Change stream reader for {} stopped while closing", source, e);
        return;
      }
      deliver(() -> exceptionHandler, MongoFailures.classify(e));
    } finally {
      closeCursor();
      context.runOnContext(v -> stopped.tryComplete());
    }
  }

  private boolean deliverAndAwait(ChangeFeedEvent event) {
    CountDownLatch handled = new CountDownLatch(1);
    context.runOnContext(v -> {
      try {
        Handler<ChangeFeedEvent> handler = changeHandler;
        if (handler != null) {
          handler.handle(event);
        }
      } finally {
        handled.countDown();
      }
    });
    try {
      while (!handled.await(100, TimeUnit.MILLISECONDS)) {
        if (closed.get()) {
          return false;
        }
      }
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private <T> void deliver(Supplier<Handler<T>> slot, T value) {
    context.runOnContext(v -> {
      Handler<T> handler = slot.get();
      if (handler != null) {
        handler.handle(value);
      }
    });
  }

  private void closeCursor() {
    try {
      cursor.close();
    } catch (RuntimeException e) {
      LOG.debug("Failed to close change stream cursor for {}", source, e);
    }
  }

  static ChangeFeedEvent toEvent(String source, ChangeStreamDocument<Document> change) {
    String rawOperation = change.getOperationTypeString() == null ? "" : change.getOperationTypeString();
    Map<String, Object> before = change.getFullDocumentBeforeChange() == null
      ? Collections.emptyMap()
      : change.getFullDocumentBeforeChange();
    Map<String, Object> after = change.getFullDocument() == null
      ? Collections.emptyMap()
      : change.getFullDocument();
    String token = change.getResumeToken() == null ? null : change.getResumeToken().toJson();

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("adapter", "mongodb");
    metadata.put("rawOperation", rawOperation);
    if (change.getDocumentKey() != null) {
      metadata.put("documentKey", change.getDocumentKey().toJson());
    }
    MongoNamespace namespace = change.getNamespace();
    String resolvedSource = namespace == null ? source : namespace.getFullName();

    return new ChangeFeedEvent(
      resolvedSource,
      mapOperation(change.getOperationType()),
      before,
      after,
      token,
      toInstant(change.getClusterTime()),
      metadata);
  }

  static ChangeFeedEvent.Operation mapOperation(OperationType type) {
    if (type == null) {
      return ChangeFeedEvent.Operation.OTHER;
    }
    switch (type) {
      case INSERT:
        return ChangeFeedEvent.Operation.INSERT;
      case UPDATE:
        return ChangeFeedEvent.Operation.UPDATE;
      case REPLACE:
        return ChangeFeedEvent.Operation.REPLACE;
      case DELETE:
        return ChangeFeedEvent.Operation.DELETE;
      case INVALIDATE:
        return ChangeFeedEvent.Operation.INVALIDATE;
      default:
        return ChangeFeedEvent.Operation.OTHER;
    }
  }

  private static Instant toInstant(BsonTimestamp ts) {
    return ts == null ? null : Instant.ofEpochSecond(ts.getTime());
  }
}
