package org.waabox.changecast.source;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changecast.BackoffPolicy;
import org.waabox.changecast.ChangeCastException;
import org.waabox.changecast.event.ChangeEvent;
import org.waabox.changecast.event.Operation;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.metrics.ChangeCastMetrics;

/**
 * Keeps one native change subscription per watched table and turns every
 * native change into a {@link ChangeEvent}.
 *
 * <p>Each started table gets its own daemon thread that opens a
 * {@link ChangeFeed}, polls it and invokes the table's callback. Callbacks
 * for one table therefore never run in parallel and observe the order in
 * which the store emitted the changes.
 *
 * <p>When a feed cannot be opened or drops, the thread closes it and opens
 * a new one after the delay given by the {@link BackoffPolicy}. Nothing is
 * emitted while disconnected, and a new feed starts at the live end of the
 * stream: changes committed during the gap are not replayed.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangeSourceAdapter {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ChangeSourceAdapter.class);

  /** The default poll timeout of the per-table loop. */
  private static final Duration DEFAULT_POLL_TIMEOUT =
      Duration.ofMillis(500);

  /** How long {@link #stop(WatchedTable)} waits for a table thread. */
  private static final long JOIN_TIMEOUT_MILLIS = 5_000;

  /** The change source, never null. */
  private final ChangeSource source;

  /** The reconnection backoff, never null. */
  private final BackoffPolicy backoff;

  /** The metrics reporter, never null. */
  private final ChangeCastMetrics metrics;

  /** The poll timeout of the per-table loop, never null. */
  private final Duration pollTimeout;

  /** The clock used when a change carries no commit timestamp. */
  private final Clock clock;

  /** The running tasks, keyed by table. */
  private final Map<WatchedTable, TableTask> tasks = new ConcurrentHashMap<>();

  /**
   * Creates a new adapter with the default poll timeout.
   *
   * @param theSource  the change source, never null
   * @param theBackoff the reconnection backoff, never null
   * @param theMetrics the metrics reporter, never null
   */
  public ChangeSourceAdapter(final ChangeSource theSource,
      final BackoffPolicy theBackoff, final ChangeCastMetrics theMetrics) {
    this(theSource, theBackoff, theMetrics, DEFAULT_POLL_TIMEOUT,
        Clock.systemUTC());
  }

  /**
   * Creates a new adapter.
   *
   * @param theSource      the change source, never null
   * @param theBackoff     the reconnection backoff, never null
   * @param theMetrics     the metrics reporter, never null
   * @param thePollTimeout the feed poll timeout, never null
   * @param theClock       the clock for changes without commit time,
   *                       never null
   */
  public ChangeSourceAdapter(final ChangeSource theSource,
      final BackoffPolicy theBackoff, final ChangeCastMetrics theMetrics,
      final Duration thePollTimeout, final Clock theClock) {
    source = Objects.requireNonNull(theSource, "source cannot be null");
    backoff = Objects.requireNonNull(theBackoff, "backoff cannot be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
    pollTimeout = Objects.requireNonNull(thePollTimeout,
        "pollTimeout cannot be null");
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
  }

  /**
   * Starts the subscription of a table.
   *
   * @param table   the table to observe, never null
   * @param onEvent the callback invoked once per change, on the table's
   *                thread, never null
   *
   * @throws ChangeCastException if the table is already started
   */
  public void start(final WatchedTable table,
      final Consumer<ChangeEvent> onEvent) {
    Objects.requireNonNull(table, "table cannot be null");
    Objects.requireNonNull(onEvent, "onEvent cannot be null");

    final TableTask task = new TableTask(table, onEvent);
    if (tasks.putIfAbsent(table, task) != null) {
      throw new ChangeCastException(
          "Table '" + table.tableName() + "' is already started");
    }
    task.thread.start();
    log.info("Change subscription for table '{}' started",
        table.tableName());
  }

  /**
   * Stops the subscription of a table.
   *
   * <p>Idempotent. Once this method returns the table's callback is not
   * invoked again.
   *
   * @param table the table, never null
   */
  public void stop(final WatchedTable table) {
    Objects.requireNonNull(table, "table cannot be null");
    final TableTask task = tasks.remove(table);
    if (task == null) {
      return;
    }
    task.shutdown();
    log.info("Change subscription for table '{}' stopped",
        table.tableName());
  }

  /** Stops every started table. */
  public void stopAll() {
    for (final WatchedTable table : tasks.keySet()) {
      stop(table);
    }
  }

  /**
   * Checks whether a table was started and not stopped.
   *
   * @param table the table, never null
   *
   * @return true if the table has a running subscription task
   */
  public boolean isRunning(final WatchedTable table) {
    return tasks.containsKey(table);
  }

  /**
   * Checks whether a table currently holds an open feed.
   *
   * @param table the table, never null
   *
   * @return true if connected, false while backing off or when stopped
   */
  public boolean isConnected(final WatchedTable table) {
    final TableTask task = tasks.get(table);
    return task != null && task.feed != null;
  }

  /**
   * Converts a native change of the given table into a change event.
   *
   * @param table      the table the feed was opened for, never null
   * @param change     the native change, never null
   * @param receivedAt the fallback occurrence instant, never null
   *
   * @return the normalized event, never null
   *
   * @throws IllegalArgumentException if the change belongs to another
   *     table, has an unknown operation or carries no record
   */
  static ChangeEvent normalize(final WatchedTable table,
      final NativeChange change, final Instant receivedAt) {
    if (!table.tableName().equalsIgnoreCase(change.table())) {
      throw new IllegalArgumentException("Change of table '"
          + change.table() + "' received on the feed of '"
          + table.tableName() + "'");
    }
    final Operation operation = Operation.fromCode(change.operation());
    final Instant occurredAt = change.commitTimestamp() != null
        ? change.commitTimestamp() : receivedAt;
    return new ChangeEvent(table, operation, change.after(), change.before(),
        occurredAt);
  }

  /** The subscription loop of one table. */
  private final class TableTask implements Runnable {

    /** The observed table. */
    private final WatchedTable table;

    /** The callback, invoked on {@link #thread} only. */
    private final Consumer<ChangeEvent> onEvent;

    /** The thread running this task. */
    private final Thread thread;

    /** Guards {@link #running} against in-flight callbacks. */
    private final Object dispatchLock = new Object();

    /** Whether the task should keep running. */
    private volatile boolean running = true;

    /** The open feed, null while disconnected. */
    private volatile ChangeFeed feed;

    TableTask(final WatchedTable theTable,
        final Consumer<ChangeEvent> theOnEvent) {
      table = theTable;
      onEvent = theOnEvent;
      thread = new Thread(this, "changecast-source-" + theTable.tableName());
      thread.setDaemon(true);
    }

    @Override
    public void run() {
      int failures = 0;
      while (running) {
        final ChangeFeed current;
        try {
          current = source.open(table);
        } catch (final RuntimeException e) {
          failures++;
          subscriptionLost(e, failures);
          if (!pause(failures)) {
            return;
          }
          continue;
        }

        feed = current;
        failures = 0;
        log.debug("Feed for table '{}' opened", table.tableName());

        try {
          while (running) {
            final NativeChange change = current.poll(pollTimeout);
            if (change != null) {
              dispatch(change);
            }
          }
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        } catch (final RuntimeException e) {
          if (running) {
            failures++;
            subscriptionLost(e, failures);
          }
        } finally {
          feed = null;
          closeQuietly(current);
        }

        if (running && failures > 0 && !pause(failures)) {
          return;
        }
      }
    }

    /** Stops the loop, waiting for an in-flight callback to finish. */
    void shutdown() {
      synchronized (dispatchLock) {
        running = false;
      }
      // The feed is closed by its own thread once the interrupt lands.
      if (Thread.currentThread() == thread) {
        return;
      }
      thread.interrupt();
      try {
        thread.join(JOIN_TIMEOUT_MILLIS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for the '{}' subscription to stop",
            table.tableName());
      }
      if (thread.isAlive()) {
        log.warn("Subscription thread of table '{}' did not stop within {} ms",
            table.tableName(), JOIN_TIMEOUT_MILLIS);
      }
    }

    private void dispatch(final NativeChange change) {
      final ChangeEvent event;
      try {
        event = normalize(table, change, clock.instant());
      } catch (final IllegalArgumentException e) {
        log.warn("Skipping malformed change on table '{}': {}",
            table.tableName(), e.getMessage());
        return;
      }
      synchronized (dispatchLock) {
        if (!running) {
          return;
        }
        try {
          onEvent.accept(event);
        } catch (final RuntimeException e) {
          log.error("Callback failed for {} on table '{}'",
              event.eventName(), table.tableName(), e);
        }
      }
    }

    private void subscriptionLost(final RuntimeException cause,
        final int attempt) {
      metrics.subscriptionLost(table, cause);
      log.warn("Subscription of table '{}' lost (attempt {}), retrying in {}"
          + " ms: {}", table.tableName(), attempt,
          backoff.delayFor(attempt).toMillis(), cause.getMessage());
    }

    private boolean pause(final int attempt) {
      try {
        Thread.sleep(backoff.delayFor(attempt).toMillis());
        return running;
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }

    private void closeQuietly(final ChangeFeed current) {
      try {
        current.close();
      } catch (final RuntimeException e) {
        log.warn("Error closing feed of table '{}': {}",
            table.tableName(), e.getMessage(), e);
      }
    }
  }
}
