package org.waabox.changecast.example.application;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import org.waabox.changecast.ChangeCast;
import org.waabox.changecast.auth.AuthenticationFailureException;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.session.ClientSession;

/** REST controller that exposes the ChangeCast stream endpoint over
 * server-sent events.
 *
 * <p>This controller provides two endpoints:
 * <ul>
 *   <li>{@code GET /api/realtime/stream} - opens a change stream for the
 *       bearer token of the request</li>
 *   <li>{@code GET /api/realtime/status} - returns the watched tables and
 *       the open sessions</li>
 * </ul>
 *
 * <p>The token is read from the {@code Authorization: Bearer} header or,
 * for {@code EventSource} clients, from the {@code access_token} query
 * parameter. Each session writes from a thread of the stream executor.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
@RequestMapping("/api/realtime")
public class ChangeStreamController {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ChangeStreamController.class);

  /** Emitter timeout meaning the stream never times out. */
  private static final long NO_TIMEOUT = 0L;

  /** The header that turns off response buffering in nginx proxies. */
  private static final String ACCEL_BUFFERING_HEADER = "X-Accel-Buffering";

  /** The scheme prefix of a bearer authorization header. */
  private static final String BEARER_PREFIX = "bearer ";

  /** The ChangeCast instance, never null. */
  private final ChangeCast changeCast;

  /** The executor running session writer loops, never null. */
  private final Executor streamExecutor;

  /** Creates a new ChangeStreamController.
   *
   * @param theChangeCast     the ChangeCast instance, never null
   * @param theStreamExecutor the executor running session writer loops,
   *        never null
   */
  public ChangeStreamController(final ChangeCast theChangeCast,
      @Qualifier("changeStreamExecutor") final Executor theStreamExecutor) {
    changeCast = Objects.requireNonNull(theChangeCast,
        "changeCast cannot be null");
    streamExecutor = Objects.requireNonNull(theStreamExecutor,
        "streamExecutor cannot be null");
  }

  /** Opens a change stream.
   *
   * @param authorization the Authorization header, may be null
   * @param accessToken   the access_token query parameter, may be null
   *
   * @return the emitter of the stream with caching and proxy buffering
   *     disabled, never null
   *
   * @throws IOException if the connection frame cannot be written
   */
  @GetMapping("/stream")
  public ResponseEntity<SseEmitter> stream(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false)
          final String authorization,
      @RequestParam(value = "access_token", required = false)
          final String accessToken) throws IOException {

    final SseEmitter emitter = new SseEmitter(NO_TIMEOUT);
    final ClientSession session = changeCast.endpoint().open(
        credential(authorization, accessToken),
        new SseEmitterTransport(emitter));

    emitter.onCompletion(session::close);
    emitter.onTimeout(session::close);
    emitter.onError(e -> session.close());

    try {
      streamExecutor.execute(session::run);
    } catch (final RejectedExecutionException e) {
      log.warn("No thread available for session {}", session.id());
      session.close();
      throw e;
    }
    return ResponseEntity.ok()
        .cacheControl(CacheControl.noCache().noTransform())
        .header(ACCEL_BUFFERING_HEADER, "no")
        .body(emitter);
  }

  /** Returns the state of the realtime bridge.
   *
   * <p>The response includes:
   * <ul>
   *   <li>{@code running} - whether the change feeds are running</li>
   *   <li>{@code tables} - the watched tables</li>
   *   <li>{@code connectedTables} - the tables with an open change feed</li>
   *   <li>{@code subscribers} - the number of bus subscribers</li>
   *   <li>{@code sessions} - one entry per open stream</li>
   * </ul>
   *
   * @return the status, never null
   */
  @GetMapping("/status")
  public Map<String, Object> status() {
    final Set<WatchedTable> connected = EnumSet.noneOf(WatchedTable.class);
    for (final WatchedTable table : changeCast.tables()) {
      if (changeCast.isConnected(table)) {
        connected.add(table);
      }
    }

    final List<Map<String, Object>> sessions = new ArrayList<>();
    for (final ClientSession session
        : changeCast.endpoint().activeSessions()) {
      final Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", session.id());
      entry.put("principal", session.principal().name());
      entry.put("tables", tableNames(session.tables()));
      entry.put("state", session.state().name());
      entry.put("framesWritten", session.framesWritten());
      sessions.add(entry);
    }

    final Map<String, Object> result = new LinkedHashMap<>();
    result.put("running", changeCast.isRunning());
    result.put("tables", tableNames(changeCast.tables()));
    result.put("connectedTables", tableNames(connected));
    result.put("subscribers", changeCast.eventBus().subscriberCount());
    result.put("sessions", sessions);
    return result;
  }

  /** Maps a refused stream request to a 401 or 403 JSON response.
   *
   * @param e the failure, never null
   *
   * @return the error response, never null
   */
  @ExceptionHandler(AuthenticationFailureException.class)
  public ResponseEntity<Map<String, String>> handleAuthenticationFailure(
      final AuthenticationFailureException e) {
    final ResponseEntity.BodyBuilder builder = ResponseEntity
        .status(e.isForbidden() ? HttpStatus.FORBIDDEN : HttpStatus.UNAUTHORIZED)
        .contentType(MediaType.APPLICATION_JSON);
    if (!e.isForbidden()) {
      builder.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    }
    final Map<String, String> body = new LinkedHashMap<>();
    body.put("error", e.reason().name());
    body.put("message", e.getMessage());
    return builder.body(body);
  }

  /** Extracts the bearer credential of a request.
   *
   * @param authorization the Authorization header, may be null
   * @param accessToken   the access_token parameter, may be null
   *
   * @return the credential, null if the request carries none
   */
  static String credential(final String authorization,
      final String accessToken) {
    if (authorization != null
        && authorization.length() > BEARER_PREFIX.length()
        && authorization.regionMatches(true, 0, BEARER_PREFIX, 0,
            BEARER_PREFIX.length())) {
      return authorization.substring(BEARER_PREFIX.length()).trim();
    }
    return accessToken;
  }

  private static List<String> tableNames(final Set<WatchedTable> tables) {
    final List<String> names = new ArrayList<>();
    for (final WatchedTable table : tables) {
      names.add(table.tableName());
    }
    return names;
  }
}
