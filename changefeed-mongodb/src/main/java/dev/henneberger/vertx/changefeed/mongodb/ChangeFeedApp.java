package dev.henneberger.vertx.changefeed.mongodb;

import dev.henneberger.vertx.changefeed.core.FeedSession;
import dev.henneberger.vertx.changefeed.core.SessionOptions;
import dev.henneberger.vertx.changefeed.core.SessionRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ChangeFeedApp {

  private static final Logger LOG = LoggerFactory.getLogger(ChangeFeedApp.class);

  private final Vertx vertx;
  private final ChangeFeedAppConfig config;
  private final MongoChangeFeedTransport transport;
  private final SessionRegistry registry;

  public ChangeFeedApp(Vertx vertx, ChangeFeedAppConfig config) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.config = Objects.requireNonNull(config, "config");
    this.transport = new MongoChangeFeedTransport(vertx, config.toTransportOptions());
    this.registry = new SessionRegistry(vertx);
  }

  public void start() {
    if (config.collections().isEmpty()) {
      throw new IllegalStateException("FEED_COLLECTIONS must list at least one collection");
    }
    for (String collection : config.collections()) {
      SessionOptions options = config.toSessionOptions(collection).setTransport(transport);
      options.getListeners().onChange(event -> LOG.info("{} {} {} at {}",
        event.getSource(), event.getOperation(), event.getMetadata().get("documentKey"), event.getClusterTime()));
      FeedSession session = registry.create(options, new JsonObject().put("database", config.database()));
      session.open(false);
    }
    LOG.info("Watching {} collection(s) of {}", config.collections().size(), config.database());
  }

  public Future<Void> stop() {
    return registry.shutdownAll().onComplete(ar -> transport.close());
  }

  public SessionRegistry registry() {
    return registry;
  }

  public static void main(String[] args) {
    Vertx vertx = Vertx.vertx();
    ChangeFeedApp app = new ChangeFeedApp(vertx, ChangeFeedAppConfig.fromEnv());
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      try {
        app.stop().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
      } catch (Exception e) {
        LOG.warn("Change feed shutdown did not complete cleanly", e);
      }
    }, "change-feed-shutdown"));
    app.start();
  }
}
