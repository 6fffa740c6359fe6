package org.waabox.changecast.source;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A row change exactly as a {@link ChangeFeed} received it from the
 * backing store, before normalization into a
 * {@link org.waabox.changecast.event.ChangeEvent}.
 *
 * @param table           the raw table name, never null
 * @param schema          the schema of the table, may be null
 * @param operation       the native operation code (e.g. {@code UPDATE},
 *                        {@code u}), never null
 * @param before          the row before the change, may be null
 * @param after           the row after the change, may be null
 * @param commitTimestamp when the store committed the change, null if
 *                        the store does not report it
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record NativeChange(
    String table,
    String schema,
    String operation,
    Map<String, Object> before,
    Map<String, Object> after,
    Instant commitTimestamp
) {

  /** Validates the mandatory fields. */
  public NativeChange {
    Objects.requireNonNull(table, "table cannot be null");
    Objects.requireNonNull(operation, "operation cannot be null");
  }
}
