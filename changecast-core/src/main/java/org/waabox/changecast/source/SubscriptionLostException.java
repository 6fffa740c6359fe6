package org.waabox.changecast.source;

import org.waabox.changecast.ChangeCastException;
import org.waabox.changecast.event.WatchedTable;

/**
 * Thrown by a {@link ChangeSource} or {@link ChangeFeed} when the native
 * change subscription of a table cannot be established or was dropped
 * (network failure, store restart).
 *
 * <p>The {@link ChangeSourceAdapter} recovers from it by re-opening the
 * feed with exponential backoff; it never reaches stream clients.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SubscriptionLostException extends ChangeCastException {

  private static final long serialVersionUID = 1L;

  /** The table whose subscription was lost. */
  private final transient WatchedTable table;

  /**
   * Creates a new exception.
   *
   * @param theTable the table whose subscription was lost, never null
   * @param cause    the underlying failure, may be null
   */
  public SubscriptionLostException(final WatchedTable theTable,
      final Throwable cause) {
    super("Change subscription lost for table '" + theTable.tableName()
        + "'", cause);
    table = theTable;
  }

  /**
   * Returns the table whose subscription was lost.
   *
   * @return the table, never null
   */
  public WatchedTable table() {
    return table;
  }
}
