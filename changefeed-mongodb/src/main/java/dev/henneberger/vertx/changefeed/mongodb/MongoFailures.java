package dev.henneberger.vertx.changefeed.mongodb;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import dev.henneberger.vertx.changefeed.core.ChangeFeedException;
import dev.henneberger.vertx.changefeed.core.FailureKind;

final class MongoFailures {

  static final int CHANGE_STREAM_HISTORY_LOST = 286;
  static final String CHANGE_STREAM_HISTORY_LOST_NAME = "ChangeStreamHistoryLost";

  private MongoFailures() {
  }

  static ChangeFeedException classify(Throwable error) {
    if (error instanceof ChangeFeedException) {
      return (ChangeFeedException) error;
    }
    int code = error instanceof MongoException ? ((MongoException) error).getCode() : 0;
    String codeName = error instanceof MongoCommandException
      ? ((MongoCommandException) error).getErrorCodeName()
      : "";

    FailureKind kind = code == CHANGE_STREAM_HISTORY_LOST || CHANGE_STREAM_HISTORY_LOST_NAME.equals(codeName)
      ? FailureKind.HISTORY_LOST
      : FailureKind.TRANSIENT;
    String message = error == null ? "change stream failed" : error.getMessage();
    return new ChangeFeedException(kind, code, codeName, message, error);
  }
}
