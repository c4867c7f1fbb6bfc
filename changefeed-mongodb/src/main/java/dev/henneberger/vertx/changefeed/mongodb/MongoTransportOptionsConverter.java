package dev.henneberger.vertx.changefeed.mongodb;

import io.vertx.core.json.JsonObject;

final class MongoTransportOptionsConverter {

  private MongoTransportOptionsConverter() {
  }

  static void fromJson(JsonObject json, MongoTransportOptions options) {
    if (json == null) {
      return;
    }
    if (json.containsKey("connectionString")) {
      options.setConnectionString(json.getString("connectionString"));
    }
    if (json.containsKey("database")) {
      options.setDatabase(json.getString("database"));
    }
    if (json.containsKey("batchSize")) {
      options.setBatchSize(json.getInteger("batchSize"));
    }
    if (json.containsKey("pollIntervalMs")) {
      options.setPollIntervalMs(json.getLong("pollIntervalMs"));
    }
  }

  static void toJson(MongoTransportOptions options, JsonObject json) {
    json.put("connectionString", options.getConnectionString());
    json.put("database", options.getDatabase());
    json.put("batchSize", options.getBatchSize());
    json.put("pollIntervalMs", options.getPollIntervalMs());
  }
}
