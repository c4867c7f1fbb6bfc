package dev.henneberger.vertx.changefeed.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;

public interface ChangeFeedHandle {

  ChangeFeedHandle changeHandler(Handler<ChangeFeedEvent> handler);

  ChangeFeedHandle exceptionHandler(Handler<Throwable> handler);

  ChangeFeedHandle endHandler(Handler<Void> handler);

  ChangeFeedHandle closeHandler(Handler<Void> handler);

  void removeAllHandlers();

  /**
   * Closes the underlying cursor. Idempotent; closing an already closed handle succeeds.
   */
  Future<Void> close();

  boolean isClosed();
}
