package dev.henneberger.vertx.changefeed.mongodb;

import com.mongodb.connection.ServerDescription;
import com.mongodb.connection.ServerType;
import com.mongodb.event.ServerDescriptionChangedEvent;
import dev.henneberger.vertx.changefeed.core.TopologyChange;

final class MongoTopologyEvents {

  private MongoTopologyEvents() {
  }

  static TopologyChange toTopologyChange(ServerDescriptionChangedEvent event) {
    return new TopologyChange(
      event.getServerId().getAddress().toString(),
      role(event.getPreviousDescription()),
      role(event.getNewDescription()));
  }

  static TopologyChange.Role role(ServerDescription description) {
    if (description == null) {
      return TopologyChange.Role.UNKNOWN;
    }
    ServerType type = description.getType();
    if (type == ServerType.REPLICA_SET_PRIMARY) {
      return TopologyChange.Role.PRIMARY;
    }
    if (type == ServerType.REPLICA_SET_SECONDARY) {
      return TopologyChange.Role.SECONDARY;
    }
    if (type == ServerType.UNKNOWN) {
      return TopologyChange.Role.UNKNOWN;
    }
    return TopologyChange.Role.OTHER;
  }
}
