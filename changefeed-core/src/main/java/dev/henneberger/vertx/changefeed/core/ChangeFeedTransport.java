package dev.henneberger.vertx.changefeed.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * The database side of a change feed. Implementations may throw from {@link #open} or fail the returned future;
 * a session treats both the same way.
 */
public interface ChangeFeedTransport {

  Future<ChangeFeedHandle> open(String collection, List<JsonObject> pipeline, JsonObject options);

  FeedSubscription onTopologyChange(Handler<TopologyChange> handler);
}
