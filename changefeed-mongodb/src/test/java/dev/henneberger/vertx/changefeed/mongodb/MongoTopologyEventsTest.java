package dev.henneberger.vertx.changefeed.mongodb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.mongodb.ServerAddress;
import com.mongodb.connection.ClusterId;
import com.mongodb.connection.ServerConnectionState;
import com.mongodb.connection.ServerDescription;
import com.mongodb.connection.ServerId;
import com.mongodb.connection.ServerType;
import com.mongodb.event.ServerDescriptionChangedEvent;
import dev.henneberger.vertx.changefeed.core.TopologyChange;
import org.junit.jupiter.api.Test;

class MongoTopologyEventsTest {

  private static final ServerAddress ADDRESS = new ServerAddress("mongo-1", 27017);

  @Test
  void secondaryBecomingPrimaryIsAnElection() {
    TopologyChange change = MongoTopologyEvents.toTopologyChange(
      changed(ServerType.REPLICA_SET_SECONDARY, ServerType.REPLICA_SET_PRIMARY));

    assertEquals("mongo-1:27017", change.address());
    assertEquals(TopologyChange.Role.SECONDARY, change.previousRole());
    assertEquals(TopologyChange.Role.PRIMARY, change.newRole());
    assertTrue(change.isPrimaryElected());
  }

  @Test
  void primaryStayingPrimaryIsNotAnElection() {
    TopologyChange change = MongoTopologyEvents.toTopologyChange(
      changed(ServerType.REPLICA_SET_PRIMARY, ServerType.REPLICA_SET_PRIMARY));

    assertFalse(change.isPrimaryElected());
  }

  @Test
  void mapsServerTypesToRoles() {
    assertEquals(TopologyChange.Role.UNKNOWN, MongoTopologyEvents.role(null));
    assertEquals(TopologyChange.Role.UNKNOWN, MongoTopologyEvents.role(description(ServerType.UNKNOWN)));
    assertEquals(TopologyChange.Role.OTHER, MongoTopologyEvents.role(description(ServerType.REPLICA_SET_ARBITER)));
    assertEquals(TopologyChange.Role.OTHER, MongoTopologyEvents.role(description(ServerType.STANDALONE)));
  }

  private static ServerDescriptionChangedEvent changed(ServerType previous, ServerType next) {
    return new ServerDescriptionChangedEvent(
      new ServerId(new ClusterId(), ADDRESS),
      description(next),
      description(previous));
  }

  private static ServerDescription description(ServerType type) {
    return ServerDescription.builder()
      .address(ADDRESS)
      .state(ServerConnectionState.CONNECTED)
      .type(type)
      .build();
  }
}
