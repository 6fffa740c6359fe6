package org.waabox.changecast.source;

import java.time.Duration;

/**
 * A live channel of native row changes for one watched table.
 *
 * <p>A feed is obtained from {@link ChangeSource#open} and consumed by a
 * single thread. It only delivers changes committed after it was opened;
 * there is no replay.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeFeed extends AutoCloseable {

  /**
   * Waits up to the given timeout for the next native change.
   *
   * @param timeout the maximum time to wait, never null
   *
   * @return the next change, or null if none arrived in time
   *
   * @throws InterruptedException if the consuming thread is interrupted
   * @throws SubscriptionLostException if the underlying subscription
   *     dropped; the feed is unusable afterwards
   */
  NativeChange poll(Duration timeout) throws InterruptedException;

  /**
   * Cancels the native subscription and releases its resources.
   *
   * <p>Idempotent.
   */
  @Override
  void close();
}
