package dev.henneberger.vertx.changefeed.core;

@FunctionalInterface
public interface FeedSubscription {
  void cancel();
}
