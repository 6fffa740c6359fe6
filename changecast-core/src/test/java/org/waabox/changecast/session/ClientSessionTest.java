package org.waabox.changecast.session;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createNiceMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.waabox.changecast.auth.StreamPrincipal;
import org.waabox.changecast.bus.EventBus;
import org.waabox.changecast.event.ChangeEvent;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.metrics.ChangeCastMetrics;
import org.waabox.changecast.metrics.NoopChangeCastMetrics;

/**
 * Tests for {@link ClientSession}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ClientSessionTest {

  private static final Duration HEARTBEAT = Duration.ofMillis(100);

  private static final Duration WAIT = Duration.ofSeconds(5);

  private static final StreamPrincipal PRINCIPAL = new StreamPrincipal(
      "registrar@campus.edu", EnumSet.allOf(WatchedTable.class), null);

  private final ExecutorService writers = Executors.newCachedThreadPool();

  private final EventBus bus = new EventBus();

  private final AtomicInteger closedCallbacks = new AtomicInteger();

  @AfterEach
  void tearDown() {
    writers.shutdownNow();
  }

  private ClientSession session(final RecordingTransport transport,
      final ChangeCastMetrics metrics, final WatchedTable... tables) {
    return new ClientSession(PRINCIPAL, EnumSet.of(tables[0], tables), bus,
        transport, HEARTBEAT, 16, metrics, Clock.systemUTC(),
        closed -> closedCallbacks.incrementAndGet());
  }

  @Test
  void whenOpening_shouldSubscribeAndConfirmConnection() throws Exception {
    final RecordingTransport transport = new RecordingTransport();
    final ClientSession session = session(transport,
        new NoopChangeCastMetrics(), WatchedTable.STUDENTS, WatchedTable.MARKS);

    session.open();

    assertEquals(SessionState.STREAMING, session.state());
    assertEquals(1, bus.subscriberCount());
    final StreamFrame frame = transport.next(WAIT);
    assertEquals(StreamFrame.CONNECTION_ESTABLISHED, frame.type());
    final JsonNode data = (JsonNode) frame.data();
    assertEquals(session.id(), data.get("sessionId").asText());
    assertEquals(session.subscriber().id(), data.get("subscriberId").asLong());
    assertEquals("registrar@campus.edu", data.get("principal").asText());
    assertEquals("students", data.get("tables").get(0).asText());
    assertEquals("marks", data.get("tables").get(1).asText());
    assertEquals(100, data.get("heartbeatIntervalMillis").asLong());
    assertEquals(1, session.framesWritten());
  }

  @Test
  void whenOpening_givenOpenedSession_shouldFail() throws Exception {
    final ClientSession session = session(new RecordingTransport(),
        new NoopChangeCastMetrics(), WatchedTable.STUDENTS);
    session.open();

    assertThrows(IllegalStateException.class, session::open);
  }

  @Test
  void whenStreaming_givenStudentUpdate_shouldWriteEventFrame()
      throws Exception {
    final RecordingTransport transport = new RecordingTransport();
    final ClientSession session = session(transport,
        new NoopChangeCastMetrics(), WatchedTable.STUDENTS);
    session.open();
    writers.submit(session::run);
    transport.next(WAIT);

    final Instant committedAt = Instant.parse("2024-06-10T12:00:00Z");
    bus.publish(ChangeEvent.updated(WatchedTable.STUDENTS,
        Map.of("id", 42, "status", "active"),
        Map.of("id", 42, "status", "graduated"), committedAt));

    final StreamFrame frame = transport.nextNonHeartbeat(WAIT);
    assertEquals("student_updated", frame.type());
    assertEquals(committedAt, frame.timestamp());
    final JsonNode data = (JsonNode) frame.data();
    assertEquals("UPDATE", data.get("operation").asText());
    assertEquals(42, data.get("new").get("id").asInt());
    assertEquals("graduated", data.get("new").get("status").asText());
    assertEquals("active", data.get("old").get("status").asText());

    session.close();
    assertTrue(session.awaitClosed(WAIT));
  }

  @Test
  void whenIdle_shouldWriteHeartbeatEveryInterval() throws Exception {
    final ChangeCastMetrics metrics = createNiceMock(ChangeCastMetrics.class);
    metrics.heartbeatSent(anyObject(String.class));
    expectLastCall().atLeastOnce();
    replay(metrics);

    final RecordingTransport transport = new RecordingTransport();
    final ClientSession session = session(transport, metrics,
        WatchedTable.COURSES);
    session.open();
    writers.submit(session::run);
    transport.next(WAIT);

    final StreamFrame first = transport.next(HEARTBEAT.multipliedBy(5));
    final StreamFrame second = transport.next(HEARTBEAT.multipliedBy(5));

    assertNotNull(first);
    assertNotNull(second);
    assertTrue(first.isHeartbeat());
    assertTrue(second.isHeartbeat());

    session.close();
    assertTrue(session.awaitClosed(WAIT));
    verify(metrics);
  }

  @Test
  void whenTransportBreaks_shouldUnsubscribeWithinOneHeartbeat()
      throws Exception {
    final ChangeCastMetrics metrics = createNiceMock(ChangeCastMetrics.class);
    metrics.sessionClosed(anyObject(String.class), eq("write-failure"));
    expectLastCall().once();
    replay(metrics);

    final RecordingTransport transport = new RecordingTransport();
    final ClientSession session = session(transport, metrics,
        WatchedTable.ATTENDANCE);
    session.open();
    writers.submit(session::run);
    assertEquals(1, bus.subscriberCount());

    transport.disconnect();

    assertTrue(session.awaitClosed(HEARTBEAT.multipliedBy(10)));
    assertEquals(SessionState.CLOSED, session.state());
    assertEquals("write-failure", session.closeReason());
    assertEquals(0, bus.subscriberCount());
    assertEquals(1, transport.closeCalls());
    assertEquals(1, closedCallbacks.get());
    verify(metrics);
  }

  @Test
  void whenOpening_givenBrokenTransport_shouldReleaseSubscriber() {
    final RecordingTransport transport = new RecordingTransport();
    transport.disconnect();
    final ClientSession session = session(transport,
        new NoopChangeCastMetrics(), WatchedTable.EXAMS);

    assertThrows(IOException.class, session::open);
    assertEquals(SessionState.CLOSED, session.state());
    assertEquals(0, bus.subscriberCount());
  }

  @Test
  void whenClosing_givenNotRunning_shouldReleaseImmediately()
      throws Exception {
    final RecordingTransport transport = new RecordingTransport();
    final ClientSession session = session(transport,
        new NoopChangeCastMetrics(), WatchedTable.FACULTY);
    session.open();

    session.close();
    session.close();

    assertEquals(SessionState.CLOSED, session.state());
    assertEquals(0, bus.subscriberCount());
    assertEquals(1, transport.closeCalls());
    assertEquals(1, closedCallbacks.get());
  }

  @Test
  void whenClosing_givenRunningSession_shouldDrainAndClose() throws Exception {
    final RecordingTransport transport = new RecordingTransport();
    final ClientSession session = session(transport,
        new NoopChangeCastMetrics(), WatchedTable.NOTIFICATIONS);
    session.open();
    writers.submit(session::run);

    session.close();

    assertTrue(session.awaitClosed(HEARTBEAT.multipliedBy(10)));
    assertEquals("cancelled", session.closeReason());
    assertEquals(0, bus.subscriberCount());
    assertTrue(transport.awaitClosed(WAIT));
  }

  @Test
  void whenClosing_givenConfirmationInFlight_shouldCloseAfterTheWrite()
      throws Exception {
    final CountDownLatch sending = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final RecordingTransport transport = new RecordingTransport() {
      @Override
      public void send(final StreamFrame frame) throws IOException {
        sending.countDown();
        try {
          release.await();
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IOException("Interrupted", e);
        }
        super.send(frame);
      }
    };
    final ClientSession session = session(transport,
        new NoopChangeCastMetrics(), WatchedTable.ADMISSIONS);
    final Future<?> opening = writers.submit(() -> {
      session.open();
      return null;
    });
    assertTrue(sending.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));

    session.close();

    assertEquals(SessionState.DRAINING, session.state());
    assertEquals(1, bus.subscriberCount());
    assertEquals(0, transport.closeCalls());

    release.countDown();
    opening.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

    assertEquals(SessionState.CLOSED, session.state());
    assertEquals("cancelled", session.closeReason());
    assertEquals(0, bus.subscriberCount());
    assertEquals(1, transport.closeCalls());
    assertEquals(1, closedCallbacks.get());
    assertEquals(StreamFrame.CONNECTION_ESTABLISHED,
        transport.next(WAIT).type());
  }
}
