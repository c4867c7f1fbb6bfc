package dev.henneberger.vertx.changefeed.core;

import io.vertx.core.Handler;

public final class FeedListeners {
  private Handler<ChangeFeedEvent> onChange;
  private Handler<Throwable> onError;
  private Handler<Void> onEnd;
  private Handler<Void> onClose;

  public FeedListeners() {
  }

  public FeedListeners(FeedListeners other) {
    this.onChange = other.onChange;
    this.onError = other.onError;
    this.onEnd = other.onEnd;
    this.onClose = other.onClose;
  }

  public FeedListeners onChange(Handler<ChangeFeedEvent> handler) {
    this.onChange = handler;
    return this;
  }

  public FeedListeners onError(Handler<Throwable> handler) {
    this.onError = handler;
    return this;
  }

  public FeedListeners onEnd(Handler<Void> handler) {
    this.onEnd = handler;
    return this;
  }

  public FeedListeners onClose(Handler<Void> handler) {
    this.onClose = handler;
    return this;
  }

  public Handler<ChangeFeedEvent> changeHandler() {
    return onChange;
  }

  public Handler<Throwable> errorHandler() {
    return onError;
  }

  public Handler<Void> endHandler() {
    return onEnd;
  }

  public Handler<Void> closeHandler() {
    return onClose;
  }
}
