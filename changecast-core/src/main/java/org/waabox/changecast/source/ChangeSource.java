package org.waabox.changecast.source;

import org.waabox.changecast.event.WatchedTable;

/**
 * The storage-facing side of the bridge: whatever row-level change
 * notification mechanism the backing store offers (a change-log table,
 * Debezium topics, a logical replication slot).
 *
 * <p>Implementations are explicitly constructed, process-wide
 * dependencies. Typical lifecycle:
 * <ol>
 *   <li>Call {@link #start()} to prepare connections and storage</li>
 *   <li>Call {@link #open(WatchedTable)} once per watched table, and again
 *       after a {@link SubscriptionLostException}</li>
 *   <li>Call {@link #stop()} to release the shared resources</li>
 * </ol>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeSource {

  /**
   * Prepares the source. Called once before any feed is opened.
   */
  void start();

  /**
   * Opens a live subscription to the changes of one table.
   *
   * @param table the table to observe, never null
   *
   * @return a feed positioned at the current end of the change stream,
   *     never null
   *
   * @throws SubscriptionLostException if the subscription cannot be
   *     established right now
   */
  ChangeFeed open(WatchedTable table);

  /**
   * Releases the resources of the source. Feeds still open may fail
   * afterwards.
   */
  void stop();
}
