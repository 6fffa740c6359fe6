package org.waabox.changecast.example.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import org.waabox.changecast.ChangeCast;
import org.waabox.changecast.auth.AuthenticationFailureException;
import org.waabox.changecast.auth.AuthenticationFailureException.Reason;
import org.waabox.changecast.auth.StreamPrincipal;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.session.ClientSession;
import org.waabox.changecast.source.ChangeFeed;
import org.waabox.changecast.source.ChangeSource;
import org.waabox.changecast.source.NativeChange;

/** Unit tests for {@link ChangeStreamController}.
 *
 * <p>Uses a real ChangeCast over a change source that never produces
 * changes, outside of any servlet container.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChangeStreamControllerTest {

  private ChangeCast changeCast;

  private ExecutorService executor;

  private ChangeStreamController controller;

  @BeforeEach
  void setUp() {
    changeCast = ChangeCast.builder()
        .changeSource(new IdleChangeSource())
        .authenticator(credential -> "lecturer-token".equals(credential)
            ? new StreamPrincipal("lecturer",
                EnumSet.of(WatchedTable.MARKS, WatchedTable.ATTENDANCE), null)
            : null)
        .tables(EnumSet.of(WatchedTable.STUDENTS, WatchedTable.MARKS))
        .heartbeatInterval(Duration.ofMillis(100))
        .build();
    changeCast.start();
    executor = Executors.newCachedThreadPool();
    controller = new ChangeStreamController(changeCast, executor);
  }

  @AfterEach
  void tearDown() {
    changeCast.stop();
    executor.shutdownNow();
  }

  @Test
  void whenStreaming_givenValidToken_shouldOpenSessionOnAllowedTables() throws Exception {
    final ResponseEntity<SseEmitter> response =
        controller.stream("Bearer lecturer-token", null);

    assertNotNull(response.getBody());
    assertEquals("no-cache, no-transform",
        response.getHeaders().getCacheControl());
    assertEquals("no", response.getHeaders().getFirst("X-Accel-Buffering"));

    final List<ClientSession> sessions =
        changeCast.endpoint().activeSessions();
    assertEquals(1, sessions.size());
    assertEquals(EnumSet.of(WatchedTable.MARKS), sessions.get(0).tables());
    assertEquals(1, changeCast.eventBus().subscriberCount());
  }

  @Test
  void whenStreaming_givenUnknownToken_shouldRefuseWithoutSubscribing() {
    final AuthenticationFailureException e = assertThrows(
        AuthenticationFailureException.class,
        () -> controller.stream(null, "wrong"));

    assertEquals(Reason.INVALID_CREDENTIAL, e.reason());
    assertEquals(0, changeCast.eventBus().subscriberCount());
  }

  @Test
  void whenHandlingFailure_givenMissingCredential_shouldReturn401() {
    final ResponseEntity<Map<String, String>> response =
        controller.handleAuthenticationFailure(
            new AuthenticationFailureException(Reason.MISSING_CREDENTIAL,
                "No bearer credential was provided"));

    assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
    assertEquals("Bearer",
        response.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE));
    assertEquals("MISSING_CREDENTIAL", response.getBody().get("error"));
  }

  @Test
  void whenHandlingFailure_givenForbiddenScope_shouldReturn403() {
    final ResponseEntity<Map<String, String>> response =
        controller.handleAuthenticationFailure(
            new AuthenticationFailureException(Reason.FORBIDDEN_SCOPE,
                "No table"));

    assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
    assertNull(response.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE));
    assertEquals("FORBIDDEN_SCOPE", response.getBody().get("error"));
  }

  @Test
  void whenReadingStatus_givenOpenSession_shouldReportIt() throws Exception {
    controller.stream(null, "lecturer-token");

    final Map<String, Object> status = controller.status();

    assertEquals(true, status.get("running"));
    assertEquals(List.of("students", "marks"), status.get("tables"));
    assertEquals(1, status.get("subscribers"));
    final List<?> sessions = (List<?>) status.get("sessions");
    assertEquals(1, sessions.size());
    assertEquals("lecturer", ((Map<?, ?>) sessions.get(0)).get("principal"));
  }

  @Test
  void whenExtractingCredential_givenHeaderOrParameter_shouldPreferHeader() {
    assertEquals("abc", ChangeStreamController.credential("Bearer abc", "x"));
    assertEquals("abc", ChangeStreamController.credential("bearer  abc ", null));
    assertEquals("x", ChangeStreamController.credential("Basic abc", "x"));
    assertNull(ChangeStreamController.credential(null, null));
    assertEquals("y", ChangeStreamController.credential("Bearer", "y"));
  }

  /** A change source whose feeds never produce a change. */
  private static final class IdleChangeSource implements ChangeSource {

    @Override
    public void start() {
    }

    @Override
    public ChangeFeed open(final WatchedTable table) {
      return new ChangeFeed() {
        @Override
        public NativeChange poll(final Duration timeout)
            throws InterruptedException {
          Thread.sleep(Math.min(timeout.toMillis(), 50L));
          return null;
        }

        @Override
        public void close() {
        }
      };
    }

    @Override
    public void stop() {
    }
  }
}
