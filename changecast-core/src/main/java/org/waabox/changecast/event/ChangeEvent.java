package org.waabox.changecast.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A normalized row change of a watched table.
 *
 * <p>Change events are created by the change source adapter from native
 * change notifications and shared, read-only, by every subscriber. Both
 * record maps are copied into unmodifiable maps on construction; column
 * values inside a record may be null.
 *
 * <p>At least one of {@code newRecord} and {@code oldRecord} is present:
 * inserts carry the new row, deletes the old one, updates usually both.
 *
 * @param table      the table the row belongs to, never null
 * @param operation  the kind of change, never null
 * @param newRecord  the row after the change, null for deletes
 * @param oldRecord  the row before the change, null for inserts
 * @param occurredAt the instant at which the change was committed,
 *                   never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeEvent(
    WatchedTable table,
    Operation operation,
    Map<String, Object> newRecord,
    Map<String, Object> oldRecord,
    Instant occurredAt
) {

  /** Validates and copies the record maps. */
  public ChangeEvent {
    Objects.requireNonNull(table, "table cannot be null");
    Objects.requireNonNull(operation, "operation cannot be null");
    Objects.requireNonNull(occurredAt, "occurredAt cannot be null");
    if (newRecord == null && oldRecord == null) {
      throw new IllegalArgumentException(
          "A change of table '" + table.tableName()
              + "' needs a new or an old record");
    }
    newRecord = copyOf(newRecord);
    oldRecord = copyOf(oldRecord);
  }

  /**
   * Creates an insert event.
   *
   * @param table      the table, never null
   * @param newRecord  the inserted row, never null
   * @param occurredAt the commit instant, never null
   *
   * @return the event, never null
   */
  public static ChangeEvent inserted(final WatchedTable table,
      final Map<String, Object> newRecord, final Instant occurredAt) {
    Objects.requireNonNull(newRecord, "newRecord cannot be null");
    return new ChangeEvent(table, Operation.INSERT, newRecord, null,
        occurredAt);
  }

  /**
   * Creates an update event.
   *
   * @param table      the table, never null
   * @param oldRecord  the row before the update, may be null
   * @param newRecord  the row after the update, never null
   * @param occurredAt the commit instant, never null
   *
   * @return the event, never null
   */
  public static ChangeEvent updated(final WatchedTable table,
      final Map<String, Object> oldRecord,
      final Map<String, Object> newRecord, final Instant occurredAt) {
    Objects.requireNonNull(newRecord, "newRecord cannot be null");
    return new ChangeEvent(table, Operation.UPDATE, newRecord, oldRecord,
        occurredAt);
  }

  /**
   * Creates a delete event.
   *
   * @param table      the table, never null
   * @param oldRecord  the deleted row, never null
   * @param occurredAt the commit instant, never null
   *
   * @return the event, never null
   */
  public static ChangeEvent deleted(final WatchedTable table,
      final Map<String, Object> oldRecord, final Instant occurredAt) {
    Objects.requireNonNull(oldRecord, "oldRecord cannot be null");
    return new ChangeEvent(table, Operation.DELETE, null, oldRecord,
        occurredAt);
  }

  /**
   * Returns the row after the change.
   *
   * @return the new record, empty for deletes
   */
  public Optional<Map<String, Object>> newRecordIfPresent() {
    return Optional.ofNullable(newRecord);
  }

  /**
   * Returns the row before the change.
   *
   * @return the old record, empty for inserts
   */
  public Optional<Map<String, Object>> oldRecordIfPresent() {
    return Optional.ofNullable(oldRecord);
  }

  /**
   * Returns the event type sent to stream clients, e.g.
   * {@code student_updated}.
   *
   * @return the domain event name, never null
   */
  public String eventName() {
    return table.entityName() + "_" + operation.verb();
  }

  private static Map<String, Object> copyOf(final Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }
}
