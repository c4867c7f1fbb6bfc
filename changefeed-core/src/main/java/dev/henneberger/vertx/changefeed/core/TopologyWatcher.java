package dev.henneberger.vertx.changefeed.core;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class TopologyWatcher {

  private static final Logger LOG = LoggerFactory.getLogger(TopologyWatcher.class);

  private final FeedSession session;
  private final ChangeFeedTransport transport;

  private volatile boolean attached;
  private volatile FeedSubscription subscription;

  TopologyWatcher(FeedSession session, ChangeFeedTransport transport) {
    this.session = Objects.requireNonNull(session, "session");
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  synchronized void attach() {
    if (attached) {
      return;
    }
    attached = true;
    subscription = transport.onTopologyChange(this::onTopologyChange);
    LOG.debug("{}: watching cluster topology for primary elections", session.id());
  }

  synchronized void detach() {
    FeedSubscription current = subscription;
    subscription = null;
    if (current != null) {
      current.cancel();
    }
  }

  boolean isAttached() {
    return attached;
  }

  void onTopologyChange(TopologyChange change) {
    if (!change.isPrimaryElected()) {
      return;
    }
    if (session.isShutDown()) {
      return;
    }
    LOG.info("{}: server election, new primary elected at {}", session.id(), change.address());
    session.reopen(ReconnectTrigger.SERVER_ELECTION);
  }
}
