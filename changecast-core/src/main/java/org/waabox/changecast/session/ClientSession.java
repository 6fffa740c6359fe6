package org.waabox.changecast.session;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changecast.auth.StreamPrincipal;
import org.waabox.changecast.bus.EventBus;
import org.waabox.changecast.bus.Subscriber;
import org.waabox.changecast.event.ChangeEvent;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.metrics.ChangeCastMetrics;

/**
 * One open stream: a bus subscription bound to a client transport.
 *
 * <p>{@link #open()} registers the subscriber and writes the
 * {@code connection_established} frame. {@link #run()} is the writer
 * loop: it forwards inbox events in order and writes a heartbeat whenever
 * no event arrived during one heartbeat interval. The loop ends when
 * {@link #close()} is called, when a write fails or when the thread is
 * interrupted; in every case the subscriber is removed from the bus and
 * the transport is closed exactly once.
 *
 * <p>Only the thread calling {@link #open()} and then {@link #run()}
 * writes to the transport. {@link #close()} may be called from any thread
 * and is observed by the writer within one heartbeat interval.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ClientSession {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ClientSession.class);

  /** The session id, never null. */
  private final String id;

  /** The authenticated caller, never null. */
  private final StreamPrincipal principal;

  /** The tables streamed to the client, never null or empty. */
  private final Set<WatchedTable> tables;

  /** The bus the session subscribes to, never null. */
  private final EventBus bus;

  /** The client connection, never null. */
  private final StreamTransport transport;

  /** The idle time after which a heartbeat is written, never null. */
  private final Duration heartbeatInterval;

  /** The inbox capacity of the subscriber. */
  private final int inboxCapacity;

  /** The metrics reporter, never null. */
  private final ChangeCastMetrics metrics;

  /** The clock stamping heartbeat and confirmation frames, never null. */
  private final Clock clock;

  /** Invoked once when the session reaches {@link SessionState#CLOSED}. */
  private final Consumer<ClientSession> onClosed;

  /** The current state, never null. */
  private final AtomicReference<SessionState> state =
      new AtomicReference<>(SessionState.CONNECTING);

  /** Whether {@link #run()} was entered. */
  private final AtomicBoolean writerActive = new AtomicBoolean();

  /** Number of frames written, heartbeats included. */
  private final AtomicLong sequence = new AtomicLong();

  /** Released when the session is closed. */
  private final CountDownLatch closedLatch = new CountDownLatch(1);

  /** The bus registration, null before {@link #open()}. */
  private volatile Subscriber subscriber;

  /** Why the session closed, null while open. */
  private volatile String closeReason;

  /**
   * Creates a new session. Nothing is subscribed or written until
   * {@link #open()} is called.
   *
   * @param thePrincipal         the authenticated caller, never null
   * @param theTables            the tables to stream, never null or empty
   * @param theBus               the event bus, never null
   * @param theTransport         the client connection, never null
   * @param theHeartbeatInterval the heartbeat interval, positive
   * @param theInboxCapacity     the subscriber inbox capacity, positive
   * @param theMetrics           the metrics reporter, never null
   * @param theClock             the clock, never null
   * @param theOnClosed          the close callback, never null
   */
  public ClientSession(final StreamPrincipal thePrincipal,
      final Set<WatchedTable> theTables, final EventBus theBus,
      final StreamTransport theTransport, final Duration theHeartbeatInterval,
      final int theInboxCapacity, final ChangeCastMetrics theMetrics,
      final Clock theClock, final Consumer<ClientSession> theOnClosed) {
    principal = Objects.requireNonNull(thePrincipal,
        "principal cannot be null");
    Objects.requireNonNull(theTables, "tables cannot be null");
    if (theTables.isEmpty()) {
      throw new IllegalArgumentException("tables cannot be empty");
    }
    bus = Objects.requireNonNull(theBus, "bus cannot be null");
    transport = Objects.requireNonNull(theTransport,
        "transport cannot be null");
    heartbeatInterval = Objects.requireNonNull(theHeartbeatInterval,
        "heartbeatInterval cannot be null");
    if (theHeartbeatInterval.isZero() || theHeartbeatInterval.isNegative()) {
      throw new IllegalArgumentException(
          "heartbeatInterval must be positive, got: " + theHeartbeatInterval);
    }
    if (theInboxCapacity <= 0) {
      throw new IllegalArgumentException(
          "inboxCapacity must be greater than 0, got: " + theInboxCapacity);
    }
    inboxCapacity = theInboxCapacity;
    metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
    onClosed = Objects.requireNonNull(theOnClosed, "onClosed cannot be null");
    tables = Set.copyOf(theTables);
    id = UUID.randomUUID().toString();
  }

  /**
   * Subscribes to the bus and writes the confirmation frame.
   *
   * <p>On success the session is {@link SessionState#STREAMING}. If the
   * confirmation cannot be written the session closes itself before the
   * exception propagates.
   *
   * @throws IOException if the confirmation frame could not be written
   * @throws IllegalStateException if the session was already opened
   */
  public void open() throws IOException {
    if (state.get() != SessionState.CONNECTING || subscriber != null) {
      throw new IllegalStateException("Session " + id + " already opened");
    }
    subscriber = bus.subscribe(tables, inboxCapacity);
    metrics.sessionOpened(id);
    log.info("Session {} opened for '{}' on tables {}", id, principal.name(),
        tableNames());

    try {
      write(StreamFrame.connectionEstablished(details(), clock.instant()));
    } catch (final IOException e) {
      finish("write-failure");
      throw e;
    }
    if (!state.compareAndSet(SessionState.CONNECTING,
        SessionState.STREAMING)) {
      // closed while the confirmation was being written.
      finish("cancelled");
    }
  }

  /**
   * Runs the writer loop on the calling thread until the session closes.
   *
   * @throws IllegalStateException if the loop already ran or the session
   *     was never opened
   */
  public void run() {
    if (subscriber == null) {
      throw new IllegalStateException("Session " + id + " was not opened");
    }
    if (!writerActive.compareAndSet(false, true)) {
      throw new IllegalStateException("Session " + id + " is already running");
    }

    String reason = "cancelled";
    try {
      while (state.get() == SessionState.STREAMING) {
        final ChangeEvent event = subscriber.poll(heartbeatInterval);
        if (state.get() != SessionState.STREAMING) {
          break;
        }
        if (event == null) {
          write(StreamFrame.heartbeat(clock.instant()));
          metrics.heartbeatSent(id);
        } else {
          write(StreamFrame.of(event));
        }
      }
    } catch (final IOException e) {
      reason = "write-failure";
      log.debug("Session {} write failed: {}", id, e.getMessage());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      reason = "interrupted";
    } catch (final RuntimeException e) {
      reason = "error";
      log.error("Session {} failed", id, e);
    } finally {
      finish(reason);
    }
  }

  /**
   * Requests the session to end. Idempotent, callable from any thread.
   *
   * <p>If the writer loop is running it stops within one heartbeat
   * interval and releases the session itself. A session still writing its
   * confirmation frame is released by {@link #open()} once that write
   * returns. Otherwise the session is released right away.
   */
  public void close() {
    if (state.compareAndSet(SessionState.STREAMING, SessionState.DRAINING)) {
      if (!writerActive.get()) {
        finish("cancelled");
      }
      return;
    }
    state.compareAndSet(SessionState.CONNECTING, SessionState.DRAINING);
  }

  /**
   * Waits for the session to reach {@link SessionState#CLOSED}.
   *
   * @param timeout the maximum time to wait, never null
   *
   * @return true if the session closed within the timeout
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitClosed(final Duration timeout)
      throws InterruptedException {
    return closedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Returns the session id.
   *
   * @return a random UUID string, never null
   */
  public String id() {
    return id;
  }

  /**
   * Returns the authenticated caller.
   *
   * @return the principal, never null
   */
  public StreamPrincipal principal() {
    return principal;
  }

  /**
   * Returns the tables streamed to this client.
   *
   * @return an unmodifiable set, never null or empty
   */
  public Set<WatchedTable> tables() {
    return tables;
  }

  /**
   * Returns the current state.
   *
   * @return the state, never null
   */
  public SessionState state() {
    return state.get();
  }

  /**
   * Returns the bus registration of this session.
   *
   * @return the subscriber, null before {@link #open()}
   */
  public Subscriber subscriber() {
    return subscriber;
  }

  /**
   * Returns the number of frames written so far.
   *
   * @return the frame count
   */
  public long framesWritten() {
    return sequence.get();
  }

  /**
   * Returns why the session closed.
   *
   * @return the reason, null while the session is open
   */
  public String closeReason() {
    return closeReason;
  }

  private void write(final StreamFrame frame) throws IOException {
    transport.send(frame);
    final long seq = sequence.incrementAndGet();
    if (log.isTraceEnabled()) {
      log.trace("Session {} wrote frame #{} of type {}", id, seq,
          frame.type());
    }
  }

  private void finish(final String reason) {
    if (state.getAndSet(SessionState.CLOSED) == SessionState.CLOSED) {
      return;
    }
    closeReason = reason;
    final Subscriber current = subscriber;
    if (current != null) {
      bus.unsubscribe(current.id());
    }
    try {
      transport.close();
    } catch (final RuntimeException e) {
      log.warn("Error closing transport of session {}: {}", id,
          e.getMessage());
    }
    metrics.sessionClosed(id, reason);
    log.info("Session {} closed ({}), {} frames written, {} events dropped",
        id, reason, sequence.get(), current == null ? 0 : current.dropped());
    closedLatch.countDown();
    try {
      onClosed.accept(this);
    } catch (final RuntimeException e) {
      log.warn("Close callback of session {} failed", id, e);
    }
  }

  private Map<String, Object> details() {
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("sessionId", id);
    details.put("subscriberId", subscriber.id());
    details.put("principal", principal.name());
    details.put("tables", tableNames());
    details.put("heartbeatIntervalMillis", heartbeatInterval.toMillis());
    return details;
  }

  private List<String> tableNames() {
    final List<String> names = new ArrayList<>();
    for (final WatchedTable table : WatchedTable.values()) {
      if (tables.contains(table)) {
        names.add(table.tableName());
      }
    }
    return names;
  }

  @Override
  public String toString() {
    return "ClientSession[id=" + id + ", principal=" + principal.name()
        + ", state=" + state.get() + "]";
  }
}
