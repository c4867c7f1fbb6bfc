package dev.henneberger.vertx.changefeed.core;

import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A long-lived subscription to the change feed of one collection.
 *
 * <p>The session owns at most one {@link ChangeFeedHandle} at a time. Whenever the feed errors, ends or closes,
 * or the cluster elects a new primary, the current handle is detached and closed and a new one is opened after the
 * delay chosen by the {@link ReconnectPolicy}, resuming after the last seen token when the server still has it.
 *
 * <p>All state is confined to the Vert.x context captured at construction. Public methods may be called from any
 * thread and hop onto that context.
 */
public class FeedSession implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(FeedSession.class);

  private static final long NO_TIMER = -1L;

  private final Vertx vertx;
  private final Context context;
  private final SessionOptions options;
  private final SessionRegistry registry;
  private final String id;
  private final JsonObject meta;
  private final ResumeTracker resumeTracker = new ResumeTracker();
  private final TopologyWatcher topologyWatcher;
  private final List<Handler<SessionStateChange>> stateHandlers = new CopyOnWriteArrayList<>();

  private volatile SessionState state = SessionState.IDLE;
  private volatile boolean shutDown;

  // confined to the session context
  private ChangeFeedHandle handle;
  private long generation;
  private long reopenTimer = NO_TIMER;

  public FeedSession(Vertx vertx, SessionOptions options, JsonObject meta, SessionRegistry registry) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new SessionOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.registry = Objects.requireNonNull(registry, "registry");

    JsonObject resolvedMeta = new JsonObject().put("origin", "FeedSession-" + this.options.getCollection());
    if (meta != null) {
      resolvedMeta.mergeIn(meta.copy());
    }
    this.meta = resolvedMeta;
    this.id = resolvedMeta.getString("origin");
    this.context = vertx.getOrCreateContext();

    if (this.options.isResumeEnabled()) {
      resumeTracker.recordToken(this.options.getInitialResumeToken());
    }
    this.topologyWatcher = this.options.isReopenOnServerElection()
      ? new TopologyWatcher(this, this.options.getTransport())
      : null;
    registry.track(this);
  }

  public String id() {
    return id;
  }

  public JsonObject meta() {
    return meta.copy();
  }

  public SessionState state() {
    return state;
  }

  public boolean isShutDown() {
    return shutDown;
  }

  public Optional<String> resumeToken() {
    return resumeTracker.currentToken();
  }

  public FeedSubscription onStateChange(Handler<SessionStateChange> handler) {
    Handler<SessionStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  public void open(boolean isReopen) {
    runOnSessionContext(() -> doOpen(isReopen));
  }

  /**
   * Drops the current handle and schedules a new open after the delay for {@code trigger}.
   */
  public void reopen(ReconnectTrigger trigger) {
    Objects.requireNonNull(trigger, "trigger");
    runOnSessionContext(() -> doReopen(trigger, null));
  }

  public Future<Void> shutdown() {
    shutDown = true;
    Promise<Void> promise = Promise.promise();
    runOnSessionContext(() -> {
      cancelReopenTimer();
      generation++;
      if (topologyWatcher != null) {
        topologyWatcher.detach();
      }
      ChangeFeedHandle current = handle;
      handle = null;
      transition(SessionState.SHUT_DOWN, null, null);
      LOG.info("{}: change stream session shut down", id);
      detachAndClose(current).onComplete(promise);
    });
    return promise.future();
  }

  @Override
  public void close() {
    shutdown();
  }

  TopologyWatcher topologyWatcher() {
    return topologyWatcher;
  }

  private void doOpen(boolean isReopen) {
    if (shutDown) {
      LOG.debug("{}: session is shut down, not opening", id);
      return;
    }
    if (!isReopen && topologyWatcher != null) {
      topologyWatcher.attach();
    }
    if (handle != null) {
      ChangeFeedHandle previous = handle;
      handle = null;
      detachAndClose(previous);
    }

    long openGeneration = ++generation;
    transition(SessionState.OPENING, null, null);
    JsonObject openOptions = openOptions();

    Future<ChangeFeedHandle> opening;
    try {
      opening = options.getTransport().open(
        options.getCollection(),
        Collections.unmodifiableList(options.getPipeline()),
        openOptions);
      if (opening == null) {
        opening = Future.failedFuture(new IllegalStateException("transport returned no change stream"));
      }
    } catch (RuntimeException e) {
      opening = Future.failedFuture(e);
    }

    opening.onComplete(ar -> runOnSessionContext(() -> {
      if (ar.succeeded()) {
        onOpened(openGeneration, ar.result(), isReopen, openOptions);
      } else {
        onOpenFailed(openGeneration, ar.cause());
      }
    }));
  }

  private void onOpened(long openGeneration, ChangeFeedHandle opened, boolean isReopen, JsonObject openOptions) {
    if (shutDown || openGeneration != generation) {
      LOG.debug("{}: discarding change stream opened for a superseded generation", id);
      detachAndClose(opened);
      return;
    }
    handle = opened;
    registry.register(id, opened);
    opened.changeHandler(event -> onChange(openGeneration, event))
      .exceptionHandler(err -> onError(openGeneration, err))
      .endHandler(v -> onEnd(openGeneration))
      .closeHandler(v -> onClose(openGeneration));
    transition(SessionState.LIVE, null, null);

    LOG.info("{}: started watching change stream events (reopen={}, resumeAfter={}, meta={})",
      id, isReopen, openOptions.getString(SessionOptions.RESUME_AFTER_OPTION), meta.encode());
  }

  private void onOpenFailed(long openGeneration, Throwable cause) {
    if (shutDown || openGeneration != generation) {
      return;
    }
    LOG.error("{}: could not open change stream, reopen will be triggered (meta={})", id, meta.encode(), cause);
    doReopen(ReconnectTrigger.OPEN_FAILURE, cause);
  }

  private void onChange(long eventGeneration, ChangeFeedEvent event) {
    if (isStale(eventGeneration)) {
      return;
    }
    // the token of an invalidate cannot be resumed after
    if (options.isResumeEnabled() && event.getOperation() != ChangeFeedEvent.Operation.INVALIDATE) {
      resumeTracker.recordToken(event.getResumeToken());
    }
    LOG.trace("{}: received change stream event {}", id, event);
    invokeListener("onChange", options.getListeners().changeHandler(), event);
  }

  private void onError(long eventGeneration, Throwable error) {
    if (isStale(eventGeneration)) {
      return;
    }
    FailureKind kind = FailureKind.classify(error);
    transition(SessionState.FAILING, null, error);
    if (kind == FailureKind.HISTORY_LOST) {
      // the position cannot be rebuilt, the next open starts wherever the server decides
      resumeTracker.clear();
      LOG.warn("{}: resume point is no longer in the server history, discarding resume token", id);
    }
    LOG.error("{}: change stream errored ({}), this is recoverable and needs no action (meta={})",
      id, kind, meta.encode(), error);

    invokeListener("onError", options.getListeners().errorHandler(), error);
    if (options.isReopenOnError()) {
      doReopen(ReconnectTrigger.ERROR, error);
    }
  }

  private void onEnd(long eventGeneration) {
    if (isStale(eventGeneration)) {
      return;
    }
    transition(SessionState.ENDING, null, null);
    LOG.warn("{}: change stream ended (meta={})", id, meta.encode());

    invokeListener("onEnd", options.getListeners().endHandler(), null);
    if (options.isReopenOnEnd()) {
      doReopen(ReconnectTrigger.END, null);
    }
  }

  private void onClose(long eventGeneration) {
    if (isStale(eventGeneration)) {
      return;
    }
    transition(SessionState.CLOSING, null, null);
    LOG.info("{}: change stream closed (meta={})", id, meta.encode());

    invokeListener("onClose", options.getListeners().closeHandler(), null);
    if (options.isReopenOnClose()) {
      doReopen(ReconnectTrigger.CLOSE, null);
    }
  }

  private void doReopen(ReconnectTrigger trigger, Throwable cause) {
    if (shutDown) {
      return;
    }
    // the old handle must be silent before anything else happens
    ChangeFeedHandle previous = handle;
    handle = null;
    generation++;
    detachAndClose(previous);
    cancelReopenTimer();

    Duration delay = options.getReconnectPolicy().delayFor(trigger);
    transition(SessionState.REOPENING, trigger, cause);
    LOG.warn("{}: reopen triggered by {}, reopening in {} ms", id, trigger, delay.toMillis());

    long scheduledGeneration = generation;
    reopenTimer = vertx.setTimer(Math.max(1L, delay.toMillis()), timerId -> {
      if (reopenTimer == timerId) {
        reopenTimer = NO_TIMER;
      }
      if (shutDown || scheduledGeneration != generation) {
        return;
      }
      doOpen(true);
      if (trigger == ReconnectTrigger.SERVER_ELECTION) {
        LOG.info("{}: re-initialized the change stream after a primary election", id);
      } else {
        LOG.info("{}: re-initialized the change stream after {}", id, trigger);
      }
    });
  }

  private Future<Void> detachAndClose(ChangeFeedHandle previous) {
    if (previous == null) {
      return Future.succeededFuture();
    }
    Future<Void> closing;
    try {
      previous.removeAllHandlers();
      closing = previous.close();
    } catch (RuntimeException e) {
      closing = Future.failedFuture(e);
    }
    if (closing == null) {
      return Future.succeededFuture();
    }
    return closing.transform(ar -> {
      if (ar.failed()) {
        LOG.warn("{}: failed to close change stream", id, ar.cause());
      }
      return Future.<Void>succeededFuture();
    });
  }

  private JsonObject openOptions() {
    JsonObject openOptions = options.getOpenOptions().copy();
    if (options.isResumeEnabled()) {
      resumeTracker.currentToken()
        .ifPresent(token -> openOptions.put(SessionOptions.RESUME_AFTER_OPTION, token));
    }
    return openOptions;
  }

  private boolean isStale(long eventGeneration) {
    return shutDown || eventGeneration != generation;
  }

  private void cancelReopenTimer() {
    if (reopenTimer != NO_TIMER) {
      vertx.cancelTimer(reopenTimer);
      reopenTimer = NO_TIMER;
    }
  }

  private <T> void invokeListener(String name, Handler<T> listener, T value) {
    if (listener == null) {
      return;
    }
    try {
      listener.handle(value);
    } catch (RuntimeException e) {
      LOG.error("{}: {} listener failed", id, name, e);
    }
  }

  private void transition(SessionState nextState, ReconnectTrigger trigger, Throwable cause) {
    SessionState previous = state;
    if (previous == SessionState.SHUT_DOWN || (shutDown && nextState != SessionState.SHUT_DOWN)) {
      return;
    }
    if (previous == nextState && trigger == null && cause == null) {
      return;
    }
    state = nextState;

    SessionStateChange change = new SessionStateChange(id, previous, nextState, trigger, cause);
    for (Handler<SessionStateChange> stateHandler : stateHandlers) {
      context.runOnContext(v -> stateHandler.handle(change));
    }
  }

  private void runOnSessionContext(Runnable action) {
    if (Vertx.currentContext() == context) {
      action.run();
    } else {
      context.runOnContext(v -> action.run());
    }
  }
}
