package dev.henneberger.vertx.changefeed.mongodb;

import dev.henneberger.vertx.changefeed.core.OptionValidation;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;

@DataObject
@JsonGen(publicConverter = false)
public class MongoTransportOptions {

  public static final String DEFAULT_CONNECTION_STRING = "mongodb://localhost:27017";

  private String connectionString;
  private String database;
  private int batchSize;
  private long pollIntervalMs;

  public MongoTransportOptions() {
    init();
  }

  public MongoTransportOptions(JsonObject json) {
    init();
    MongoTransportOptionsConverter.fromJson(json, this);
  }

  public MongoTransportOptions(MongoTransportOptions other) {
    this.connectionString = other.connectionString;
    this.database = other.database;
    this.batchSize = other.batchSize;
    this.pollIntervalMs = other.pollIntervalMs;
  }

  public String getConnectionString() {
    return connectionString;
  }

  public MongoTransportOptions setConnectionString(String connectionString) {
    this.connectionString = connectionString;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public MongoTransportOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public MongoTransportOptions setBatchSize(int batchSize) {
    this.batchSize = batchSize;
    return this;
  }

  /**
   * How long a single cursor poll waits on the server for new events, which also bounds how long closing a
   * handle takes.
   */
  public long getPollIntervalMs() {
    return pollIntervalMs;
  }

  public MongoTransportOptions setPollIntervalMs(long pollIntervalMs) {
    this.pollIntervalMs = pollIntervalMs;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    MongoTransportOptionsConverter.toJson(this, json);
    return json;
  }

  void validate() {
    OptionValidation.require("connectionString", connectionString);
    OptionValidation.require("database", database);
    OptionValidation.requireMin("batchSize", batchSize, 1);
    OptionValidation.requireMin("pollIntervalMs", pollIntervalMs, 1L);
  }

  private void init() {
    connectionString = DEFAULT_CONNECTION_STRING;
    batchSize = 256;
    pollIntervalMs = 1000L;
  }
}
