package org.waabox.changecast.metrics;

import org.waabox.changecast.event.WatchedTable;

/**
 * A no-operation implementation of {@link ChangeCastMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopChangeCastMetrics implements ChangeCastMetrics {

  /** {@inheritDoc} */
  @Override
  public void eventPublished(final WatchedTable table, final int deliveries) {
  }

  /** {@inheritDoc} */
  @Override
  public void eventDropped(final long subscriberId, final WatchedTable table) {
  }

  /** {@inheritDoc} */
  @Override
  public void heartbeatSent(final String sessionId) {
  }

  /** {@inheritDoc} */
  @Override
  public void sessionOpened(final String sessionId) {
  }

  /** {@inheritDoc} */
  @Override
  public void sessionClosed(final String sessionId, final String reason) {
  }

  /** {@inheritDoc} */
  @Override
  public void subscriptionLost(final WatchedTable table,
      final Throwable cause) {
  }
}
