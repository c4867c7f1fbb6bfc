package dev.henneberger.vertx.changefeed.mongodb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.mongodb.client.model.changestream.FullDocument;
import com.mongodb.client.model.changestream.FullDocumentBeforeChange;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

class MongoOpenOptionsTest {

  @Test
  void parsesKnownOptions() {
    MongoOpenOptions parsed = MongoOpenOptions.parse(new JsonObject()
      .put("fullDocument", "updateLookup")
      .put("fullDocumentBeforeChange", "whenAvailable")
      .put("batchSize", 32)
      .put("maxAwaitTimeMS", 500));

    assertEquals(FullDocument.UPDATE_LOOKUP, parsed.fullDocument());
    assertEquals(FullDocumentBeforeChange.WHEN_AVAILABLE, parsed.fullDocumentBeforeChange());
    assertEquals(32, parsed.batchSize());
    assertEquals(500L, parsed.maxAwaitTimeMs());
    assertTrue(parsed.unsupported().isEmpty());
  }

  @Test
  void parsesResumeTokenFromStringOrObject() {
    String token = "{\"_data\": \"8263A1\"}";

    MongoOpenOptions fromString = MongoOpenOptions.parse(new JsonObject().put("resumeAfter", token));
    assertEquals("8263A1", fromString.resumeAfter().getString("_data").getValue());

    MongoOpenOptions fromObject = MongoOpenOptions.parse(new JsonObject()
      .put("startAfter", new JsonObject().put("_data", "8263A2")));
    assertEquals("8263A2", fromObject.startAfter().getString("_data").getValue());
    assertNull(fromObject.resumeAfter());
  }

  @Test
  void rejectsNonDocumentToken() {
    assertThrows(IllegalArgumentException.class,
      () -> MongoOpenOptions.parse(new JsonObject().put("resumeAfter", 42)));
  }

  @Test
  void collectsUnsupportedKeys() {
    MongoOpenOptions parsed = MongoOpenOptions.parse(new JsonObject()
      .put("fullDocument", "default")
      .put("collation", new JsonObject()));

    assertEquals(List.of("collation"), parsed.unsupported());
  }

  @Test
  void emptyWhenNoOptions() {
    MongoOpenOptions parsed = MongoOpenOptions.parse(null);
    assertNull(parsed.fullDocument());
    assertTrue(parsed.unsupported().isEmpty());
  }
}
