package dev.henneberger.vertx.changefeed.mongodb;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.event.ServerDescriptionChangedEvent;
import com.mongodb.event.ServerListener;
import dev.henneberger.vertx.changefeed.core.ChangeFeedHandle;
import dev.henneberger.vertx.changefeed.core.ChangeFeedTransport;
import dev.henneberger.vertx.changefeed.core.FeedSubscription;
import dev.henneberger.vertx.changefeed.core.TopologyChange;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MongoChangeFeedTransport implements ChangeFeedTransport, AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(MongoChangeFeedTransport.class);

  private final Vertx vertx;
  private final MongoTransportOptions options;
  private final List<Handler<TopologyChange>> topologyHandlers = new CopyOnWriteArrayList<>();
  private final MongoClient client;
  private final MongoDatabase database;

  public MongoChangeFeedTransport(Vertx vertx, MongoTransportOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new MongoTransportOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();

    MongoClientSettings settings = MongoClientSettings.builder()
      .applyConnectionString(new ConnectionString(this.options.getConnectionString()))
      .applyToServerSettings(builder -> builder.addServerListener(new TopologyListener()))
      .build();
    this.client = MongoClients.create(settings);
    this.database = client.getDatabase(this.options.getDatabase());
  }

  @Override
  public Future<ChangeFeedHandle> open(String collection, List<JsonObject> pipeline, JsonObject openOptions) {
    Objects.requireNonNull(collection, "collection");
    List<Bson> stages = toStages(pipeline);
    MongoOpenOptions parsed = MongoOpenOptions.parse(openOptions);
    if (!parsed.unsupported().isEmpty()) {
      LOG.warn("Ignoring unsupported change stream options {} for {}", parsed.unsupported(), collection);
    }

    Context context = vertx.getOrCreateContext();
    String source = options.getDatabase() + "." + collection;
    return vertx.executeBlocking(() -> {
      ChangeStreamIterable<Document> iterable = database.getCollection(collection)
        .watch(stages)
        .batchSize(options.getBatchSize())
        .maxAwaitTime(options.getPollIntervalMs(), TimeUnit.MILLISECONDS);
      MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor = parsed.applyTo(iterable).cursor();
      LOG.debug("Opened change stream cursor on {}", source);
      return (ChangeFeedHandle) new MongoChangeFeedHandle(context, cursor, source);
    }, false);
  }

  @Override
  public FeedSubscription onTopologyChange(Handler<TopologyChange> handler) {
    Handler<TopologyChange> resolved = Objects.requireNonNull(handler, "handler");
    topologyHandlers.add(resolved);
    return () -> topologyHandlers.remove(resolved);
  }

  @Override
  public void close() {
    topologyHandlers.clear();
    client.close();
  }

  static List<Bson> toStages(List<JsonObject> pipeline) {
    List<Bson> stages = new ArrayList<>();
    if (pipeline == null) {
      return stages;
    }
    for (JsonObject stage : pipeline) {
      stages.add(BsonDocument.parse(Objects.requireNonNull(stage, "stage").encode()));
    }
    return stages;
  }

  private final class TopologyListener implements ServerListener {
    @Override
    public void serverDescriptionChanged(ServerDescriptionChangedEvent event) {
      TopologyChange change = MongoTopologyEvents.toTopologyChange(event);
      LOG.debug("Server description changed: {}", change);
      for (Handler<TopologyChange> handler : topologyHandlers) {
        try {
          handler.handle(change);
        } catch (RuntimeException e) {
          LOG.warn("Topology listener failed for {}", change, e);
        }
      }
    }
  }
}
