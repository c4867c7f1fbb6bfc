package dev.henneberger.vertx.changefeed.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

final class SessionOptionsConverter {

  private SessionOptionsConverter() {
  }

  static void fromJson(JsonObject json, SessionOptions options) {
    if (json == null) {
      return;
    }
    if (json.containsKey("collection")) {
      options.setCollection(json.getString("collection"));
    }
    JsonArray pipelineJson = json.getJsonArray("pipeline");
    if (pipelineJson != null) {
      List<JsonObject> stages = new ArrayList<>();
      for (int i = 0; i < pipelineJson.size(); i++) {
        stages.add(pipelineJson.getJsonObject(i));
      }
      options.setPipeline(stages);
    }
    JsonObject openOptionsJson = json.getJsonObject("openOptions");
    if (openOptionsJson != null) {
      options.setOpenOptions(openOptionsJson);
    }
    if (json.containsKey("resumeEnabled")) {
      options.setResumeEnabled(json.getBoolean("resumeEnabled"));
    }
    if (json.containsKey("initialResumeToken")) {
      options.setInitialResumeToken(json.getString("initialResumeToken"));
    }
    if (json.containsKey("reopenOnError")) {
      options.setReopenOnError(json.getBoolean("reopenOnError"));
    }
    if (json.containsKey("reopenOnEnd")) {
      options.setReopenOnEnd(json.getBoolean("reopenOnEnd"));
    }
    if (json.containsKey("reopenOnClose")) {
      options.setReopenOnClose(json.getBoolean("reopenOnClose"));
    }
    if (json.containsKey("reopenOnServerElection")) {
      options.setReopenOnServerElection(json.getBoolean("reopenOnServerElection"));
    }

    JsonObject reconnectJson = json.getJsonObject("reconnectPolicy");
    if (reconnectJson != null) {
      options.setReconnectPolicy(ReconnectPolicy.fixedDelays(
        Duration.ofMillis(reconnectJson.getLong("electionDelayMs",
          ReconnectPolicy.DEFAULT_ELECTION_DELAY.toMillis())),
        Duration.ofMillis(reconnectJson.getLong("recoveryDelayMs",
          ReconnectPolicy.DEFAULT_RECOVERY_DELAY.toMillis()))));
    }
  }

  static void toJson(SessionOptions options, JsonObject json) {
    json.put("collection", options.getCollection());
    JsonArray pipeline = new JsonArray();
    for (JsonObject stage : options.getPipeline()) {
      pipeline.add(stage);
    }
    json.put("pipeline", pipeline);
    json.put("openOptions", options.getOpenOptions().copy());
    json.put("resumeEnabled", options.isResumeEnabled());
    if (options.getInitialResumeToken() != null) {
      json.put("initialResumeToken", options.getInitialResumeToken());
    }
    json.put("reopenOnError", options.isReopenOnError());
    json.put("reopenOnEnd", options.isReopenOnEnd());
    json.put("reopenOnClose", options.isReopenOnClose());
    json.put("reopenOnServerElection", options.isReopenOnServerElection());

    ReconnectPolicy policy = options.getReconnectPolicy();
    if (policy != null) {
      json.put("reconnectPolicy", new JsonObject()
        .put("electionDelayMs", policy.getElectionDelay().toMillis())
        .put("recoveryDelayMs", policy.getRecoveryDelay().toMillis()));
    }
  }
}
