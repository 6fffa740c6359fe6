package org.waabox.changecast.bus;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changecast.event.ChangeEvent;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.metrics.ChangeCastMetrics;
import org.waabox.changecast.metrics.NoopChangeCastMetrics;

/**
 * In-process fan-out of change events from the change source adapters to
 * every registered {@link Subscriber}.
 *
 * <p>The bus owns no thread: {@link #publish(ChangeEvent)} runs on the
 * calling adapter thread and never blocks on a slow subscriber. A full
 * inbox drops the event for that subscriber only (drop-newest) and bumps
 * its drop counter.
 *
 * <p>Thread safety: this class is thread-safe. The registry is a
 * {@link ConcurrentHashMap} whose weakly consistent iteration lets
 * {@link #subscribe(Set)} and {@link #unsubscribe(long)} run concurrently
 * with an in-flight publish without blocking it. After
 * {@link #unsubscribe(long)} returns, no further event is enqueued for
 * that subscriber.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EventBus {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  /** The default inbox capacity of a subscriber. */
  public static final int DEFAULT_INBOX_CAPACITY = 256;

  /** The registered subscribers, keyed by id. */
  private final Map<Long, Subscriber> subscribers = new ConcurrentHashMap<>();

  /** The id sequence; ids are never reused. */
  private final AtomicLong ids = new AtomicLong();

  /** The inbox capacity used by {@link #subscribe(Set)}. */
  private final int defaultCapacity;

  /** The metrics reporter, never null. */
  private final ChangeCastMetrics metrics;

  /** Creates a bus with the default inbox capacity and no metrics. */
  public EventBus() {
    this(DEFAULT_INBOX_CAPACITY, new NoopChangeCastMetrics());
  }

  /**
   * Creates a new bus.
   *
   * @param theDefaultCapacity the inbox capacity of new subscribers,
   *                           greater than zero
   * @param theMetrics         the metrics reporter, never null
   */
  public EventBus(final int theDefaultCapacity,
      final ChangeCastMetrics theMetrics) {
    if (theDefaultCapacity <= 0) {
      throw new IllegalArgumentException(
          "defaultCapacity must be greater than 0, got: "
              + theDefaultCapacity);
    }
    defaultCapacity = theDefaultCapacity;
    metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
  }

  /**
   * Registers a new subscriber with the default inbox capacity.
   *
   * @param tableFilter the observed tables, never null or empty
   *
   * @return the registered subscriber, never null
   */
  public Subscriber subscribe(final Set<WatchedTable> tableFilter) {
    return subscribe(tableFilter, defaultCapacity);
  }

  /**
   * Registers a new subscriber.
   *
   * @param tableFilter the observed tables, never null or empty
   * @param capacity    the inbox capacity, greater than zero
   *
   * @return the registered subscriber, never null
   */
  public Subscriber subscribe(final Set<WatchedTable> tableFilter,
      final int capacity) {
    final Subscriber subscriber = new Subscriber(ids.incrementAndGet(),
        tableFilter, capacity);
    subscribers.put(subscriber.id(), subscriber);
    log.debug("Registered {}", subscriber);
    return subscriber;
  }

  /**
   * Removes a subscriber from the bus.
   *
   * <p>Safe to call more than once and concurrently with
   * {@link #publish(ChangeEvent)}.
   *
   * @param id the subscriber id
   *
   * @return true if the subscriber was registered before this call
   */
  public boolean unsubscribe(final long id) {
    final Subscriber removed = subscribers.remove(id);
    if (removed == null) {
      return false;
    }
    removed.close();
    log.debug("Unregistered {}", removed);
    return true;
  }

  /**
   * Delivers an event to every subscriber whose filter includes its table.
   *
   * @param event the event, never null
   *
   * @return the number of inboxes that accepted the event
   */
  public int publish(final ChangeEvent event) {
    Objects.requireNonNull(event, "event cannot be null");

    int deliveries = 0;
    for (final Subscriber subscriber : subscribers.values()) {
      if (!subscriber.accepts(event.table())) {
        continue;
      }
      switch (subscriber.offer(event)) {
        case ACCEPTED:
          deliveries++;
          break;
        case DROPPED:
          log.debug("Inbox full, dropped {} for subscriber {}",
              event.eventName(), subscriber.id());
          metrics.eventDropped(subscriber.id(), event.table());
          break;
        default:
          break;
      }
    }
    metrics.eventPublished(event.table(), deliveries);
    return deliveries;
  }

  /**
   * Returns the number of registered subscribers.
   *
   * @return the registry size
   */
  public int subscriberCount() {
    return subscribers.size();
  }

  /**
   * Looks up a registered subscriber.
   *
   * @param id the subscriber id
   *
   * @return the subscriber, or empty if it is not registered
   */
  public Optional<Subscriber> subscriber(final long id) {
    return Optional.ofNullable(subscribers.get(id));
  }
}
