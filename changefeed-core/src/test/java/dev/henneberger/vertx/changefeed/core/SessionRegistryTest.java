package dev.henneberger.vertx.changefeed.core;

import static dev.henneberger.vertx.changefeed.core.FeedSessionTest.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionRegistryTest {

  private Vertx vertx;
  private FakeChangeFeedTransport transport;
  private SessionRegistry registry;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
    transport = new FakeChangeFeedTransport();
    registry = new SessionRegistry(vertx);
  }

  @AfterEach
  void tearDown() throws Exception {
    await(vertx.close());
  }

  @Test
  void shutdownAllClosesEveryLiveSession() throws Exception {
    FeedSession orders = registry.create(options("orders"), null);
    FeedSession invoices = registry.create(options("invoices"), null);
    orders.open(false);
    FakeChangeFeedTransport.OpenCall first = transport.awaitOpen();
    invoices.open(false);
    FakeChangeFeedTransport.OpenCall second = transport.awaitOpen();

    await(registry.shutdownAll());

    assertTrue(first.handle.isClosed());
    assertTrue(second.handle.isClosed());
    assertFalse(first.handle.hasHandlers());
    assertFalse(second.handle.hasHandlers());
    assertEquals(SessionState.SHUT_DOWN, orders.state());
    assertEquals(SessionState.SHUT_DOWN, invoices.state());

    first.handle.emitError(new IllegalStateException("late"));
    second.handle.emitEnd();
    assertNull(transport.pollOpen(Duration.ofMillis(300)));
  }

  @Test
  void shutdownAllStopsSessionsWaitingToReopen() throws Exception {
    FeedSession orders = registry.create(options("orders"), null);
    orders.open(false);
    transport.awaitOpen().handle.emitEnd();

    await(registry.shutdownAll());

    assertNull(transport.pollOpen(Duration.ofMillis(400)));
    assertEquals(1, transport.openCount());
    assertTrue(orders.isShutDown());
  }

  @Test
  void shutdownAllToleratesBrokenAndClosedHandles() throws Exception {
    FakeChangeFeedTransport.FakeHandle broken = new FakeChangeFeedTransport.FakeHandle(
      90, vertx.getOrCreateContext(), new ArrayList<>()) {
      @Override
      public Future<Void> close() {
        throw new IllegalStateException("socket already gone");
      }
    };
    FakeChangeFeedTransport.FakeHandle failing = new FakeChangeFeedTransport.FakeHandle(
      91, vertx.getOrCreateContext(), new ArrayList<>()) {
      @Override
      public Future<Void> close() {
        return Future.failedFuture("close timed out");
      }
    };
    FakeChangeFeedTransport.FakeHandle closed = new FakeChangeFeedTransport.FakeHandle(
      92, vertx.getOrCreateContext(), new ArrayList<>());
    await(closed.close());

    registry.register("broken", broken);
    registry.register("failing", failing);
    registry.register("closed", closed);

    await(registry.shutdownAll());
    await(registry.shutdownAll());
    assertEquals(3, registry.handles().size());
  }

  @Test
  void tracksSessionsItCreates() {
    FeedSession orders = registry.create(options("orders"), new JsonObject().put("tenant", "acme"));
    new FeedSession(vertx, options("invoices"), null, registry);

    assertEquals(2, registry.sessions().size());
    assertEquals(orders, registry.sessions().get(0));
    assertEquals("acme", orders.meta().getString("tenant"));
  }

  private SessionOptions options(String collection) {
    return new SessionOptions()
      .setCollection(collection)
      .setTransport(transport)
      .setReconnectPolicy(ReconnectPolicy.fixedDelays(Duration.ofMillis(20), Duration.ofMillis(100)));
  }
}
