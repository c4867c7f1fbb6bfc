package dev.henneberger.vertx.changefeed.core;

import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@DataObject
@JsonGen(publicConverter = false)
public class SessionOptions {

  public static final String RESUME_AFTER_OPTION = "resumeAfter";
  public static final String FULL_DOCUMENT_OPTION = "fullDocument";
  public static final String DEFAULT_FULL_DOCUMENT = "updateLookup";

  private String collection;
  private List<JsonObject> pipeline;
  private JsonObject openOptions;
  private boolean resumeEnabled;
  private String initialResumeToken;
  private boolean reopenOnError;
  private boolean reopenOnEnd;
  private boolean reopenOnClose;
  private boolean reopenOnServerElection;
  private ReconnectPolicy reconnectPolicy;
  private FeedListeners listeners;
  private ChangeFeedTransport transport;

  public SessionOptions() {
    init();
  }

  public SessionOptions(JsonObject json) {
    init();
    SessionOptionsConverter.fromJson(json, this);
  }

  public SessionOptions(SessionOptions other) {
    this.collection = other.collection;
    this.pipeline = new ArrayList<>();
    for (JsonObject stage : other.pipeline) {
      this.pipeline.add(stage.copy());
    }
    this.openOptions = other.openOptions.copy();
    this.resumeEnabled = other.resumeEnabled;
    this.initialResumeToken = other.initialResumeToken;
    this.reopenOnError = other.reopenOnError;
    this.reopenOnEnd = other.reopenOnEnd;
    this.reopenOnClose = other.reopenOnClose;
    this.reopenOnServerElection = other.reopenOnServerElection;
    this.reconnectPolicy = other.reconnectPolicy.copy();
    this.listeners = new FeedListeners(other.listeners);
    this.transport = other.transport;
  }

  public String getCollection() {
    return collection;
  }

  public SessionOptions setCollection(String collection) {
    this.collection = collection;
    return this;
  }

  public List<JsonObject> getPipeline() {
    return pipeline;
  }

  public SessionOptions setPipeline(List<JsonObject> pipeline) {
    this.pipeline = new ArrayList<>(Objects.requireNonNull(pipeline, "pipeline"));
    return this;
  }

  public SessionOptions addPipelineStage(JsonObject stage) {
    pipeline.add(Objects.requireNonNull(stage, "stage"));
    return this;
  }

  /**
   * Options passed to the transport on every open, {@code fullDocument=updateLookup} unless overridden.
   */
  public JsonObject getOpenOptions() {
    return openOptions;
  }

  public SessionOptions setOpenOptions(JsonObject openOptions) {
    this.openOptions = new JsonObject()
      .put(FULL_DOCUMENT_OPTION, DEFAULT_FULL_DOCUMENT)
      .mergeIn(Objects.requireNonNull(openOptions, "openOptions"));
    return this;
  }

  public boolean isResumeEnabled() {
    return resumeEnabled;
  }

  public SessionOptions setResumeEnabled(boolean resumeEnabled) {
    this.resumeEnabled = resumeEnabled;
    return this;
  }

  public String getInitialResumeToken() {
    return initialResumeToken;
  }

  public SessionOptions setInitialResumeToken(String initialResumeToken) {
    this.initialResumeToken = initialResumeToken;
    return this;
  }

  public boolean isReopenOnError() {
    return reopenOnError;
  }

  public SessionOptions setReopenOnError(boolean reopenOnError) {
    this.reopenOnError = reopenOnError;
    return this;
  }

  public boolean isReopenOnEnd() {
    return reopenOnEnd;
  }

  public SessionOptions setReopenOnEnd(boolean reopenOnEnd) {
    this.reopenOnEnd = reopenOnEnd;
    return this;
  }

  public boolean isReopenOnClose() {
    return reopenOnClose;
  }

  public SessionOptions setReopenOnClose(boolean reopenOnClose) {
    this.reopenOnClose = reopenOnClose;
    return this;
  }

  public boolean isReopenOnServerElection() {
    return reopenOnServerElection;
  }

  public SessionOptions setReopenOnServerElection(boolean reopenOnServerElection) {
    this.reopenOnServerElection = reopenOnServerElection;
    return this;
  }

  public ReconnectPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  @GenIgnore
  public SessionOptions setReconnectPolicy(ReconnectPolicy reconnectPolicy) {
    this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
    return this;
  }

  @GenIgnore
  public FeedListeners getListeners() {
    return listeners;
  }

  @GenIgnore
  public SessionOptions setListeners(FeedListeners listeners) {
    this.listeners = Objects.requireNonNull(listeners, "listeners");
    return this;
  }

  @GenIgnore
  public ChangeFeedTransport getTransport() {
    return transport;
  }

  @GenIgnore
  public SessionOptions setTransport(ChangeFeedTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport");
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    SessionOptionsConverter.toJson(this, json);
    return json;
  }

  void validate() {
    OptionValidation.require("collection", collection);
    if (openOptions.containsKey(RESUME_AFTER_OPTION)) {
      throw new IllegalArgumentException(
        RESUME_AFTER_OPTION + " is managed by the session, use initialResumeToken instead");
    }
    for (JsonObject stage : pipeline) {
      if (stage == null || stage.isEmpty()) {
        throw new IllegalArgumentException("pipeline stages must not be empty");
      }
    }
    Objects.requireNonNull(reconnectPolicy, "reconnectPolicy").validate();
    Objects.requireNonNull(listeners, "listeners");
    Objects.requireNonNull(transport, "transport");
  }

  private void init() {
    pipeline = new ArrayList<>();
    openOptions = new JsonObject().put(FULL_DOCUMENT_OPTION, DEFAULT_FULL_DOCUMENT);
    resumeEnabled = true;
    reopenOnError = true;
    reopenOnEnd = true;
    reopenOnClose = true;
    reopenOnServerElection = true;
    reconnectPolicy = ReconnectPolicy.fixedDelays();
    listeners = new FeedListeners();
  }
}
