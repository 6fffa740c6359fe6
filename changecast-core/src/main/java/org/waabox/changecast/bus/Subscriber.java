package org.waabox.changecast.bus;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.waabox.changecast.event.ChangeEvent;
import org.waabox.changecast.event.WatchedTable;

/**
 * One registration with the {@link EventBus}.
 *
 * <p>A subscriber owns a bounded FIFO inbox. Any number of publishing
 * threads may enqueue into it through the bus, but only the owning client
 * session dequeues. When the inbox is full new events are dropped for this
 * subscriber only and counted.
 *
 * <p>Once closed (by {@link EventBus#unsubscribe(long)}), the subscriber
 * accepts no further events; events already enqueued can still be
 * drained by the owner.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Subscriber {

  /** Result of an enqueue attempt. */
  enum Offer {
    /** The event was enqueued. */
    ACCEPTED,
    /** The inbox was full and the event was dropped. */
    DROPPED,
    /** The subscriber is closed. */
    CLOSED
  }

  /** The registration id, unique within the bus. */
  private final long id;

  /** The tables this subscriber observes, never null or empty. */
  private final Set<WatchedTable> tableFilter;

  /** The bounded inbox, never null. */
  private final BlockingQueue<ChangeEvent> inbox;

  /** The inbox capacity. */
  private final int capacity;

  /** Number of events dropped because the inbox was full. */
  private final AtomicLong dropped = new AtomicLong();

  /** Number of events accepted into the inbox. */
  private final AtomicLong delivered = new AtomicLong();

  /** Whether this subscriber was removed from the bus. Guarded by this. */
  private boolean closed;

  /**
   * Creates a new subscriber.
   *
   * @param theId          the registration id
   * @param theTableFilter the observed tables, never null or empty
   * @param theCapacity    the inbox capacity, greater than zero
   */
  Subscriber(final long theId, final Set<WatchedTable> theTableFilter,
      final int theCapacity) {
    Objects.requireNonNull(theTableFilter, "tableFilter cannot be null");
    if (theTableFilter.isEmpty()) {
      throw new IllegalArgumentException("tableFilter cannot be empty");
    }
    if (theCapacity <= 0) {
      throw new IllegalArgumentException(
          "capacity must be greater than 0, got: " + theCapacity);
    }
    id = theId;
    tableFilter = Collections.unmodifiableSet(EnumSet.copyOf(theTableFilter));
    capacity = theCapacity;
    inbox = new ArrayBlockingQueue<>(theCapacity);
  }

  /**
   * Returns the registration id.
   *
   * @return the id
   */
  public long id() {
    return id;
  }

  /**
   * Returns the observed tables.
   *
   * @return an unmodifiable set, never null or empty
   */
  public Set<WatchedTable> tableFilter() {
    return tableFilter;
  }

  /**
   * Checks whether this subscriber observes the given table.
   *
   * @param table the table, never null
   *
   * @return true if events of that table are delivered to this subscriber
   */
  public boolean accepts(final WatchedTable table) {
    return tableFilter.contains(table);
  }

  /**
   * Waits up to the given timeout for the next event in the inbox.
   *
   * @param timeout the maximum time to wait, never null
   *
   * @return the oldest pending event, or null if none arrived in time
   *
   * @throws InterruptedException if the calling thread is interrupted
   *     while waiting
   */
  public ChangeEvent poll(final Duration timeout)
      throws InterruptedException {
    return inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Returns the number of events waiting in the inbox.
   *
   * @return the pending count, between 0 and capacity
   */
  public int pending() {
    return inbox.size();
  }

  /**
   * Returns the inbox capacity.
   *
   * @return the capacity, greater than zero
   */
  public int capacity() {
    return capacity;
  }

  /**
   * Returns the number of events dropped because the inbox was full.
   *
   * @return the drop count
   */
  public long dropped() {
    return dropped.get();
  }

  /**
   * Returns the number of events accepted into the inbox.
   *
   * @return the delivered count
   */
  public long delivered() {
    return delivered.get();
  }

  /**
   * Checks whether this subscriber was removed from the bus.
   *
   * @return true once unsubscribed
   */
  public synchronized boolean isClosed() {
    return closed;
  }

  /**
   * Attempts to enqueue an event without blocking.
   *
   * <p>Synchronized with {@link #close()} so that no event is enqueued
   * after close returns.
   *
   * @param event the event, never null
   *
   * @return the outcome of the attempt, never null
   */
  synchronized Offer offer(final ChangeEvent event) {
    if (closed) {
      return Offer.CLOSED;
    }
    if (inbox.offer(event)) {
      delivered.incrementAndGet();
      return Offer.ACCEPTED;
    }
    dropped.incrementAndGet();
    return Offer.DROPPED;
  }

  /** Marks this subscriber as closed. Idempotent. */
  synchronized void close() {
    closed = true;
  }

  @Override
  public String toString() {
    return "Subscriber[id=" + id + ", tables=" + tableFilter
        + ", pending=" + inbox.size() + "/" + capacity
        + ", dropped=" + dropped.get() + "]";
  }
}
