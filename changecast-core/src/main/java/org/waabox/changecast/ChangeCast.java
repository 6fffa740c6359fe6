package org.waabox.changecast;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changecast.auth.StreamAuthenticator;
import org.waabox.changecast.bus.EventBus;
import org.waabox.changecast.endpoint.StreamEndpoint;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.metrics.ChangeCastMetrics;
import org.waabox.changecast.metrics.NoopChangeCastMetrics;
import org.waabox.changecast.source.ChangeSource;
import org.waabox.changecast.source.ChangeSourceAdapter;

/**
 * The change-notification bridge of one process.
 *
 * <p>A ChangeCast owns the {@link EventBus}, one subscription task per
 * watched table feeding that bus, and the {@link StreamEndpoint} clients
 * connect through. Create one with {@link #builder()}, call
 * {@link #start()} once at boot and {@link #stop()} at shutdown:
 *
 * <pre>{@code
 * ChangeCast changeCast = ChangeCast.builder()
 *     .changeSource(new JdbcChangeLogSource(JdbcChangeLogConfig.create(ds)))
 *     .authenticator(tokenAuthenticator)
 *     .tables(EnumSet.of(WatchedTable.STUDENTS, WatchedTable.MARKS))
 *     .build();
 * changeCast.start();
 * changeCast.endpoint().stream(credential, transport);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangeCast {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(ChangeCast.class);

  /** The default heartbeat interval of client sessions. */
  public static final Duration DEFAULT_HEARTBEAT_INTERVAL =
      Duration.ofSeconds(25);

  /** The change source, never null. */
  private final ChangeSource changeSource;

  /** The watched tables, never null or empty. */
  private final Set<WatchedTable> tables;

  /** The event bus, never null. */
  private final EventBus eventBus;

  /** The per-table subscription tasks, never null. */
  private final ChangeSourceAdapter adapter;

  /** The client entry point, never null. */
  private final StreamEndpoint endpoint;

  /** Whether start was called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether stop was called. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private ChangeCast(final ChangeSource theChangeSource,
      final Set<WatchedTable> theTables, final int inboxCapacity,
      final Duration heartbeatInterval, final BackoffPolicy backoffPolicy,
      final ChangeCastMetrics metrics, final StreamAuthenticator authenticator,
      final Clock clock) {
    changeSource = theChangeSource;
    tables = Collections.unmodifiableSet(EnumSet.copyOf(theTables));
    eventBus = new EventBus(inboxCapacity, metrics);
    adapter = new ChangeSourceAdapter(theChangeSource, backoffPolicy, metrics);
    endpoint = new StreamEndpoint(eventBus, authenticator, tables,
        heartbeatInterval, inboxCapacity, metrics, clock);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the change source and one subscription task per watched table.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("ChangeCast has already been started");
    }
    changeSource.start();
    for (final WatchedTable table : tables) {
      adapter.start(table, eventBus::publish);
    }
    log.info("ChangeCast started, watching {} tables", tables.size());
  }

  /**
   * Stops the subscriptions, closes every client session and stops the
   * change source. Idempotent.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    adapter.stopAll();
    endpoint.closeAll();
    changeSource.stop();
    log.info("ChangeCast stopped");
  }

  /**
   * Checks whether this instance was started and not stopped.
   *
   * @return true while running
   */
  public boolean isRunning() {
    return started.get() && !stopped.get();
  }

  /**
   * Checks whether a watched table currently holds an open change feed.
   *
   * @param table the table, never null
   *
   * @return true if connected
   */
  public boolean isConnected(final WatchedTable table) {
    return adapter.isConnected(table);
  }

  /**
   * Returns the watched tables.
   *
   * @return an unmodifiable set, never null or empty
   */
  public Set<WatchedTable> tables() {
    return tables;
  }

  /**
   * Returns the event bus.
   *
   * @return the bus, never null
   */
  public EventBus eventBus() {
    return eventBus;
  }

  /**
   * Returns the client entry point.
   *
   * @return the endpoint, never null
   */
  public StreamEndpoint endpoint() {
    return endpoint;
  }

  /** Builder for {@link ChangeCast}. */
  public static final class Builder {

    /** The mandatory change source. */
    private ChangeSource changeSource;

    /** The mandatory authenticator. */
    private StreamAuthenticator authenticator;

    /** The optional watched tables, all tables when unset. */
    private Set<WatchedTable> tables;

    /** The subscriber inbox capacity. */
    private int inboxCapacity = EventBus.DEFAULT_INBOX_CAPACITY;

    /** The session heartbeat interval. */
    private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;

    /** The optional reconnection backoff. */
    private BackoffPolicy backoffPolicy;

    /** The optional metrics reporter. */
    private ChangeCastMetrics metrics;

    /** The optional clock. */
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the source of native change feeds.
     *
     * @param theChangeSource the change source, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder changeSource(final ChangeSource theChangeSource) {
      changeSource = Objects.requireNonNull(theChangeSource,
          "changeSource must not be null");
      return this;
    }

    /**
     * Sets the resolver of stream credentials.
     *
     * @param theAuthenticator the authenticator, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder authenticator(final StreamAuthenticator theAuthenticator) {
      authenticator = Objects.requireNonNull(theAuthenticator,
          "authenticator must not be null");
      return this;
    }

    /**
     * Sets the watched tables.
     *
     * <p>If not set, every {@link WatchedTable} is watched.
     *
     * @param theTables the tables, never null or empty
     *
     * @return this builder for chaining, never null
     */
    public Builder tables(final Set<WatchedTable> theTables) {
      Objects.requireNonNull(theTables, "tables must not be null");
      if (theTables.isEmpty()) {
        throw new IllegalArgumentException("tables must not be empty");
      }
      tables = EnumSet.copyOf(theTables);
      return this;
    }

    /**
     * Sets the inbox capacity of every client subscriber. Defaults to
     * {@value EventBus#DEFAULT_INBOX_CAPACITY}.
     *
     * @param theInboxCapacity the capacity, greater than zero
     *
     * @return this builder for chaining, never null
     */
    public Builder inboxCapacity(final int theInboxCapacity) {
      if (theInboxCapacity <= 0) {
        throw new IllegalArgumentException(
            "inboxCapacity must be greater than 0, got: " + theInboxCapacity);
      }
      inboxCapacity = theInboxCapacity;
      return this;
    }

    /**
     * Sets the idle time after which a session writes a heartbeat.
     * Defaults to 25 seconds.
     *
     * @param theHeartbeatInterval the interval, positive
     *
     * @return this builder for chaining, never null
     */
    public Builder heartbeatInterval(final Duration theHeartbeatInterval) {
      Objects.requireNonNull(theHeartbeatInterval,
          "heartbeatInterval must not be null");
      if (theHeartbeatInterval.isZero() || theHeartbeatInterval.isNegative()) {
        throw new IllegalArgumentException(
            "heartbeatInterval must be positive");
      }
      heartbeatInterval = theHeartbeatInterval;
      return this;
    }

    /**
     * Sets the backoff between change feed reconnections.
     *
     * <p>If not set, {@link BackoffPolicy#defaultPolicy()} is used.
     *
     * @param theBackoffPolicy the policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder backoffPolicy(final BackoffPolicy theBackoffPolicy) {
      backoffPolicy = Objects.requireNonNull(theBackoffPolicy,
          "backoffPolicy must not be null");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * <p>If not set, {@link NoopChangeCastMetrics} is used.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final ChangeCastMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets the clock used for expiry checks and frame timestamps.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Builds the ChangeCast instance.
     *
     * @return a new, not yet started instance, never null
     *
     * @throws IllegalStateException if no change source or authenticator
     *     was set
     */
    public ChangeCast build() {
      if (changeSource == null) {
        throw new IllegalStateException("A changeSource is required");
      }
      if (authenticator == null) {
        throw new IllegalStateException("An authenticator is required");
      }
      final Set<WatchedTable> resolvedTables = tables != null
          ? tables : EnumSet.allOf(WatchedTable.class);
      final BackoffPolicy resolvedBackoff = backoffPolicy != null
          ? backoffPolicy : BackoffPolicy.defaultPolicy();
      final ChangeCastMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopChangeCastMetrics();
      final Clock resolvedClock = clock != null ? clock : Clock.systemUTC();

      return new ChangeCast(changeSource, resolvedTables, inboxCapacity,
          heartbeatInterval, resolvedBackoff, resolvedMetrics, authenticator,
          resolvedClock);
    }
  }
}
