package org.waabox.changecast.endpoint;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.waabox.changecast.auth.AuthenticationFailureException;
import org.waabox.changecast.auth.AuthenticationFailureException.Reason;
import org.waabox.changecast.auth.StreamAuthenticator;
import org.waabox.changecast.auth.StreamPrincipal;
import org.waabox.changecast.bus.EventBus;
import org.waabox.changecast.event.ChangeEvent;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.metrics.NoopChangeCastMetrics;
import org.waabox.changecast.session.ClientSession;
import org.waabox.changecast.session.RecordingTransport;
import org.waabox.changecast.session.StreamFrame;

/**
 * Tests for {@link StreamEndpoint}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class StreamEndpointTest {

  private static final Instant NOW = Instant.parse("2024-09-01T09:00:00Z");

  private static final Duration WAIT = Duration.ofSeconds(5);

  private final EventBus bus = new EventBus();

  private final ExecutorService writers = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    writers.shutdownNow();
  }

  private StreamEndpoint endpoint(final StreamAuthenticator authenticator) {
    return new StreamEndpoint(bus, authenticator,
        EnumSet.of(WatchedTable.STUDENTS, WatchedTable.MARKS,
            WatchedTable.ATTENDANCE),
        Duration.ofMillis(100), 32, new NoopChangeCastMetrics(),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void whenOpening_givenNoCredential_shouldRefuseWithoutSubscribing() {
    final StreamAuthenticator authenticator =
        createMock(StreamAuthenticator.class);
    replay(authenticator);

    final AuthenticationFailureException e = assertThrows(
        AuthenticationFailureException.class,
        () -> endpoint(authenticator).open(" ", new RecordingTransport()));

    assertEquals(Reason.MISSING_CREDENTIAL, e.reason());
    assertFalse(e.isForbidden());
    assertEquals(0, bus.subscriberCount());
    verify(authenticator);
  }

  @Test
  void whenOpening_givenRejectedCredential_shouldPropagateFailure() {
    final StreamAuthenticator authenticator =
        createMock(StreamAuthenticator.class);
    expect(authenticator.authenticate("forged")).andThrow(
        new AuthenticationFailureException(Reason.INVALID_CREDENTIAL,
            "unknown token"));
    replay(authenticator);

    final AuthenticationFailureException e = assertThrows(
        AuthenticationFailureException.class,
        () -> endpoint(authenticator).open("forged", new RecordingTransport()));

    assertEquals(Reason.INVALID_CREDENTIAL, e.reason());
    assertEquals(0, bus.subscriberCount());
    verify(authenticator);
  }

  @Test
  void whenOpening_givenExpiredPrincipal_shouldRefuse() {
    final StreamAuthenticator authenticator = credential ->
        new StreamPrincipal("late", EnumSet.of(WatchedTable.MARKS),
            NOW.minusSeconds(1));

    final AuthenticationFailureException e = assertThrows(
        AuthenticationFailureException.class,
        () -> endpoint(authenticator).open("t", new RecordingTransport()));

    assertEquals(Reason.EXPIRED_CREDENTIAL, e.reason());
    assertEquals(0, bus.subscriberCount());
  }

  @Test
  void whenOpening_givenScopeOutsideWatchedTables_shouldForbid() {
    final StreamAuthenticator authenticator = credential ->
        new StreamPrincipal("cashier", EnumSet.of(WatchedTable.FEE_PAYMENTS),
            null);

    final AuthenticationFailureException e = assertThrows(
        AuthenticationFailureException.class,
        () -> endpoint(authenticator).open("t", new RecordingTransport()));

    assertEquals(Reason.FORBIDDEN_SCOPE, e.reason());
    assertTrue(e.isForbidden());
    assertEquals(0, bus.subscriberCount());
  }

  @Test
  void whenOpening_givenPartialScope_shouldStreamTheIntersection()
      throws Exception {
    final StreamAuthenticator authenticator = credential ->
        new StreamPrincipal("lecturer",
            EnumSet.of(WatchedTable.MARKS, WatchedTable.FEE_PAYMENTS),
            NOW.plusSeconds(3600));
    final StreamEndpoint endpoint = endpoint(authenticator);
    final RecordingTransport transport = new RecordingTransport();

    final ClientSession session = endpoint.open("t", transport);
    writers.submit(session::run);

    assertEquals(EnumSet.of(WatchedTable.MARKS), session.tables());
    assertEquals(1, endpoint.activeSessions().size());
    assertSame(session, endpoint.activeSessions().get(0));
    assertEquals(StreamFrame.CONNECTION_ESTABLISHED,
        transport.next(WAIT).type());

    bus.publish(ChangeEvent.inserted(WatchedTable.STUDENTS, Map.of("id", 1),
        NOW));
    bus.publish(ChangeEvent.inserted(WatchedTable.MARKS, Map.of("id", 2),
        NOW));

    assertEquals("mark_created", transport.nextNonHeartbeat(WAIT).type());
  }

  @Test
  void whenClosingAll_shouldReleaseEverySession() throws Exception {
    final StreamEndpoint endpoint = endpoint(credential ->
        new StreamPrincipal("admin", EnumSet.allOf(WatchedTable.class), null));
    final ClientSession first = endpoint.open("a", new RecordingTransport());
    final ClientSession second = endpoint.open("b", new RecordingTransport());
    writers.submit(first::run);
    writers.submit(second::run);
    assertEquals(2, bus.subscriberCount());

    endpoint.closeAll();

    assertTrue(first.awaitClosed(WAIT));
    assertTrue(second.awaitClosed(WAIT));
    assertTrue(endpoint.activeSessions().isEmpty());
    assertEquals(0, bus.subscriberCount());
  }
}
