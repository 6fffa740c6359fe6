package org.waabox.changecast.endpoint;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changecast.auth.AuthenticationFailureException;
import org.waabox.changecast.auth.AuthenticationFailureException.Reason;
import org.waabox.changecast.auth.StreamAuthenticator;
import org.waabox.changecast.auth.StreamPrincipal;
import org.waabox.changecast.bus.EventBus;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.metrics.ChangeCastMetrics;
import org.waabox.changecast.session.ClientSession;
import org.waabox.changecast.session.StreamTransport;

/**
 * Accepts stream requests and turns them into client sessions.
 *
 * <p>The credential is checked once, when the stream opens. The session
 * streams the watched tables that the principal's scope allows; a
 * principal whose scope shares no table with the deployment is refused.
 * No subscriber is created for a refused request.
 *
 * <p>Transports (the JDK HTTP server, a Spring MVC controller) call
 * {@link #stream(String, StreamTransport)} from the request thread, or
 * {@link #open(String, StreamTransport)} followed by
 * {@link ClientSession#run()} on a thread of their choice.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StreamEndpoint {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(StreamEndpoint.class);

  /** The bus sessions subscribe to, never null. */
  private final EventBus bus;

  /** The credential resolver, never null. */
  private final StreamAuthenticator authenticator;

  /** The tables of this deployment, never null or empty. */
  private final Set<WatchedTable> watchedTables;

  /** The session heartbeat interval, never null. */
  private final Duration heartbeatInterval;

  /** The inbox capacity of every session subscriber. */
  private final int inboxCapacity;

  /** The metrics reporter, never null. */
  private final ChangeCastMetrics metrics;

  /** The clock used for expiry checks and frame stamps, never null. */
  private final Clock clock;

  /** The open sessions, keyed by session id. */
  private final Map<String, ClientSession> sessions =
      new ConcurrentHashMap<>();

  /**
   * Creates a new endpoint.
   *
   * @param theBus               the event bus, never null
   * @param theAuthenticator     the credential resolver, never null
   * @param theWatchedTables     the deployment's tables, never null or empty
   * @param theHeartbeatInterval the session heartbeat interval, never null
   * @param theInboxCapacity     the subscriber inbox capacity, positive
   * @param theMetrics           the metrics reporter, never null
   * @param theClock             the clock, never null
   */
  public StreamEndpoint(final EventBus theBus,
      final StreamAuthenticator theAuthenticator,
      final Set<WatchedTable> theWatchedTables,
      final Duration theHeartbeatInterval, final int theInboxCapacity,
      final ChangeCastMetrics theMetrics, final Clock theClock) {
    bus = Objects.requireNonNull(theBus, "bus cannot be null");
    authenticator = Objects.requireNonNull(theAuthenticator,
        "authenticator cannot be null");
    Objects.requireNonNull(theWatchedTables, "watchedTables cannot be null");
    if (theWatchedTables.isEmpty()) {
      throw new IllegalArgumentException("watchedTables cannot be empty");
    }
    watchedTables = Collections.unmodifiableSet(
        EnumSet.copyOf(theWatchedTables));
    heartbeatInterval = Objects.requireNonNull(theHeartbeatInterval,
        "heartbeatInterval cannot be null");
    inboxCapacity = theInboxCapacity;
    metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
  }

  /**
   * Authenticates a request and opens its session.
   *
   * <p>On return the connection confirmation frame was written and the
   * session is streaming; the caller must then invoke
   * {@link ClientSession#run()} to forward events.
   *
   * @param credential the bearer credential, null if the request had none
   * @param transport  the client connection, never null
   *
   * @return the opened session, never null
   *
   * @throws AuthenticationFailureException if the credential is missing,
   *     invalid or expired, or the principal may not see any watched table
   * @throws IOException if the confirmation frame could not be written
   */
  public ClientSession open(final String credential,
      final StreamTransport transport) throws IOException {
    Objects.requireNonNull(transport, "transport cannot be null");

    final StreamPrincipal principal = authenticate(credential);
    final Set<WatchedTable> filter = EnumSet.noneOf(WatchedTable.class);
    for (final WatchedTable table : principal.scope()) {
      if (watchedTables.contains(table)) {
        filter.add(table);
      }
    }
    if (filter.isEmpty()) {
      log.info("Stream refused for '{}': no watched table in scope {}",
          principal.name(), principal.scope());
      throw new AuthenticationFailureException(Reason.FORBIDDEN_SCOPE,
          "Principal '" + principal.name()
              + "' may not observe any watched table");
    }

    final ClientSession session = new ClientSession(principal, filter, bus,
        transport, heartbeatInterval, inboxCapacity, metrics, clock,
        closed -> sessions.remove(closed.id(), closed));
    sessions.put(session.id(), session);
    try {
      session.open();
    } catch (final IOException | RuntimeException e) {
      session.close();
      sessions.remove(session.id(), session);
      throw e;
    }
    return session;
  }

  /**
   * Authenticates a request and streams to it on the calling thread until
   * the session ends.
   *
   * @param credential the bearer credential, null if the request had none
   * @param transport  the client connection, never null
   *
   * @throws AuthenticationFailureException if the request is refused
   * @throws IOException if the confirmation frame could not be written
   */
  public void stream(final String credential,
      final StreamTransport transport) throws IOException {
    open(credential, transport).run();
  }

  /**
   * Returns a snapshot of the open sessions.
   *
   * @return an unmodifiable list, never null
   */
  public List<ClientSession> activeSessions() {
    return Collections.unmodifiableList(new ArrayList<>(sessions.values()));
  }

  /**
   * Requests every open session to close. Each writer loop releases its
   * session within one heartbeat interval.
   */
  public void closeAll() {
    final List<ClientSession> current = new ArrayList<>(sessions.values());
    for (final ClientSession session : current) {
      session.close();
    }
    if (!current.isEmpty()) {
      log.info("Closing {} stream sessions", current.size());
    }
  }

  /**
   * Returns the tables this endpoint can stream.
   *
   * @return an unmodifiable set, never null or empty
   */
  public Set<WatchedTable> watchedTables() {
    return watchedTables;
  }

  private StreamPrincipal authenticate(final String credential) {
    if (credential == null || credential.isBlank()) {
      throw new AuthenticationFailureException(Reason.MISSING_CREDENTIAL,
          "No bearer credential was provided");
    }
    final StreamPrincipal principal = authenticator.authenticate(credential);
    if (principal == null) {
      throw new AuthenticationFailureException(Reason.INVALID_CREDENTIAL,
          "The bearer credential was not recognized");
    }
    if (principal.isExpiredAt(clock.instant())) {
      throw new AuthenticationFailureException(Reason.EXPIRED_CREDENTIAL,
          "The bearer credential of '" + principal.name() + "' has expired");
    }
    return principal;
  }
}
