package dev.henneberger.vertx.changefeed.mongodb;

import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.model.changestream.FullDocument;
import com.mongodb.client.model.changestream.FullDocumentBeforeChange;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.bson.BsonDocument;

final class MongoOpenOptions {

  private FullDocument fullDocument;
  private FullDocumentBeforeChange fullDocumentBeforeChange;
  private BsonDocument resumeAfter;
  private BsonDocument startAfter;
  private Integer batchSize;
  private Long maxAwaitTimeMs;
  private Boolean showExpandedEvents;
  private final List<String> unsupported = new ArrayList<>();

  private MongoOpenOptions() {
  }

  static MongoOpenOptions parse(JsonObject json) {
    MongoOpenOptions parsed = new MongoOpenOptions();
    if (json == null) {
      return parsed;
    }
    for (String key : json.fieldNames()) {
      switch (key) {
        case "fullDocument":
          parsed.fullDocument = FullDocument.fromString(json.getString(key));
          break;
        case "fullDocumentBeforeChange":
          parsed.fullDocumentBeforeChange = FullDocumentBeforeChange.fromString(json.getString(key));
          break;
        case "resumeAfter":
          parsed.resumeAfter = token(json, key);
          break;
        case "startAfter":
          parsed.startAfter = token(json, key);
          break;
        case "batchSize":
          parsed.batchSize = json.getInteger(key);
          break;
        case "maxAwaitTimeMS":
          parsed.maxAwaitTimeMs = json.getLong(key);
          break;
        case "showExpandedEvents":
          parsed.showExpandedEvents = json.getBoolean(key);
          break;
        default:
          parsed.unsupported.add(key);
      }
    }
    return parsed;
  }

  <T> ChangeStreamIterable<T> applyTo(ChangeStreamIterable<T> iterable) {
    if (fullDocument != null) {
      iterable.fullDocument(fullDocument);
    }
    if (fullDocumentBeforeChange != null) {
      iterable.fullDocumentBeforeChange(fullDocumentBeforeChange);
    }
    if (resumeAfter != null) {
      iterable.resumeAfter(resumeAfter);
    }
    if (startAfter != null) {
      iterable.startAfter(startAfter);
    }
    if (batchSize != null) {
      iterable.batchSize(batchSize);
    }
    if (maxAwaitTimeMs != null) {
      iterable.maxAwaitTime(maxAwaitTimeMs, TimeUnit.MILLISECONDS);
    }
    if (showExpandedEvents != null) {
      iterable.showExpandedEvents(showExpandedEvents);
    }
    return iterable;
  }

  FullDocument fullDocument() {
    return fullDocument;
  }

  FullDocumentBeforeChange fullDocumentBeforeChange() {
    return fullDocumentBeforeChange;
  }

  BsonDocument resumeAfter() {
    return resumeAfter;
  }

  BsonDocument startAfter() {
    return startAfter;
  }

  Integer batchSize() {
    return batchSize;
  }

  Long maxAwaitTimeMs() {
    return maxAwaitTimeMs;
  }

  List<String> unsupported() {
    return Collections.unmodifiableList(unsupported);
  }

  private static BsonDocument token(JsonObject json, String key) {
    Object value = json.getValue(key);
    if (value instanceof JsonObject) {
      return BsonDocument.parse(((JsonObject) value).encode());
    }
    if (value instanceof String) {
      return BsonDocument.parse((String) value);
    }
    throw new IllegalArgumentException(key + " must be a resume token document");
  }
}
