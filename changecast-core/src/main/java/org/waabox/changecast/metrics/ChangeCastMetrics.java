package org.waabox.changecast.metrics;

import org.waabox.changecast.event.WatchedTable;

/**
 * An abstraction for recording operational metrics of the change bridge.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopChangeCastMetrics}
 * when metrics collection is not required.
 *
 * <p>Implementations are called from adapter and session threads and must
 * be thread-safe and non-blocking.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeCastMetrics {

  /**
   * Records an event published on the event bus.
   *
   * @param table      the table of the event, never null
   * @param deliveries the number of inboxes that accepted the event
   */
  void eventPublished(WatchedTable table, int deliveries);

  /**
   * Records an event dropped because a subscriber inbox was full.
   *
   * @param subscriberId the id of the slow subscriber
   * @param table        the table of the dropped event, never null
   */
  void eventDropped(long subscriberId, WatchedTable table);

  /**
   * Records a heartbeat frame written to an idle session.
   *
   * @param sessionId the session identifier, never null
   */
  void heartbeatSent(String sessionId);

  /**
   * Records a newly opened client session.
   *
   * @param sessionId the session identifier, never null
   */
  void sessionOpened(String sessionId);

  /**
   * Records a closed client session.
   *
   * @param sessionId the session identifier, never null
   * @param reason    why the session closed (e.g. "cancelled",
   *                  "write-failure"), never null
   */
  void sessionClosed(String sessionId, String reason);

  /**
   * Records the loss of an upstream change subscription.
   *
   * @param table the table whose subscription dropped, never null
   * @param cause the failure, never null
   */
  void subscriptionLost(WatchedTable table, Throwable cause);
}
