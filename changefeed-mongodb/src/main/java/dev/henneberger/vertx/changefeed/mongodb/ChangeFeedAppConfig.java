package dev.henneberger.vertx.changefeed.mongodb;

import dev.henneberger.vertx.changefeed.core.ReconnectPolicy;
import dev.henneberger.vertx.changefeed.core.SessionOptions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class ChangeFeedAppConfig {

  private final String mongoUri;
  private final String database;
  private final List<String> collections;
  private final boolean resumeEnabled;
  private final long electionDelayMs;
  private final long recoveryDelayMs;

  private ChangeFeedAppConfig(String mongoUri,
                              String database,
                              List<String> collections,
                              boolean resumeEnabled,
                              long electionDelayMs,
                              long recoveryDelayMs) {
    this.mongoUri = mongoUri;
    this.database = database;
    this.collections = Collections.unmodifiableList(collections);
    this.resumeEnabled = resumeEnabled;
    this.electionDelayMs = electionDelayMs;
    this.recoveryDelayMs = recoveryDelayMs;
  }

  public static ChangeFeedAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static ChangeFeedAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    String uri = envOrDefault(env, "MONGO_URI", MongoTransportOptions.DEFAULT_CONNECTION_STRING);
    String database = envOrDefault(env, "MONGO_DATABASE", "app");
    List<String> collections = listEnv(env, "FEED_COLLECTIONS");
    boolean resume = boolEnvOrDefault(env, "FEED_RESUME", true);
    long electionDelay = longEnvOrDefault(env, "FEED_ELECTION_DELAY_MS",
      ReconnectPolicy.DEFAULT_ELECTION_DELAY.toMillis());
    long recoveryDelay = longEnvOrDefault(env, "FEED_RECOVERY_DELAY_MS",
      ReconnectPolicy.DEFAULT_RECOVERY_DELAY.toMillis());

    return new ChangeFeedAppConfig(uri, database, collections, resume, electionDelay, recoveryDelay);
  }

  public String mongoUri() {
    return mongoUri;
  }

  public String database() {
    return database;
  }

  public List<String> collections() {
    return collections;
  }

  public boolean resumeEnabled() {
    return resumeEnabled;
  }

  public long electionDelayMs() {
    return electionDelayMs;
  }

  public long recoveryDelayMs() {
    return recoveryDelayMs;
  }

  public MongoTransportOptions toTransportOptions() {
    return new MongoTransportOptions()
      .setConnectionString(mongoUri)
      .setDatabase(database);
  }

  public SessionOptions toSessionOptions(String collection) {
    return new SessionOptions()
      .setCollection(collection)
      .setResumeEnabled(resumeEnabled)
      .setReconnectPolicy(ReconnectPolicy.fixedDelays(
        Duration.ofMillis(electionDelayMs),
        Duration.ofMillis(recoveryDelayMs)));
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static long longEnvOrDefault(Map<String, String> env, String key, long defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }

  private static List<String> listEnv(Map<String, String> env, String key) {
    List<String> values = new ArrayList<>();
    String value = env.get(key);
    if (value == null) {
      return values;
    }
    for (String part : value.split(",")) {
      if (!part.isBlank()) {
        values.add(part.trim());
      }
    }
    return values;
  }
}
