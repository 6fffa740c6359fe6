package org.waabox.changecast.source.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changecast.ChangeCastException;
import org.waabox.changecast.event.Operation;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.source.ChangeFeed;
import org.waabox.changecast.source.ChangeSource;
import org.waabox.changecast.source.NativeChange;
import org.waabox.changecast.source.SubscriptionLostException;

/**
 * A {@link ChangeSource} that reads row changes from a JDBC change-log
 * table.
 *
 * <p>The change log holds one row per insert, update or delete of a watched
 * table, appended by database triggers or by the CRUD layer through
 * {@link #append(WatchedTable, Operation, Map, Map)}. Old and new rows are
 * stored as JSON text. The table is created automatically on
 * {@link #start()} if it does not already exist.
 *
 * <p>Each feed remembers the highest log id it has seen and periodically
 * queries the rows of its table with a greater id, in id order. A new feed
 * starts after the current maximum id, so rows appended while no feed was
 * open are never replayed.
 *
 * <p>Thread safety: this class is thread-safe; each feed is meant to be
 * polled by a single thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcChangeLogSource implements ChangeSource {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcChangeLogSource.class);

  /** Maximum number of rows a feed reads per query. */
  private static final int BATCH_SIZE = 500;

  /** The JSON type of a stored row. */
  private static final TypeReference<Map<String, Object>> ROW_TYPE =
      new TypeReference<>() { };

  /** Shared ObjectMapper for row serialization. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The configuration for this source, never null. */
  private final JdbcChangeLogConfig config;

  /** The clock stamping appended rows, never null. */
  private final Clock clock;

  /**
   * Creates a new JDBC change-log source.
   *
   * @param theConfig the configuration, never null
   */
  public JdbcChangeLogSource(final JdbcChangeLogConfig theConfig) {
    this(theConfig, Clock.systemUTC());
  }

  /**
   * Creates a new JDBC change-log source.
   *
   * @param theConfig the configuration, never null
   * @param theClock  the clock stamping appended rows, never null
   */
  public JdbcChangeLogSource(final JdbcChangeLogConfig theConfig,
      final Clock theClock) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public void start() {
    createTableIfNotExists();
    log.info("JdbcChangeLogSource started on table '{}', polling every {} ms",
        config.tableName(), config.pollInterval().toMillis());
  }

  /** {@inheritDoc} */
  @Override
  public ChangeFeed open(final WatchedTable table) {
    Objects.requireNonNull(table, "table cannot be null");

    final String sql = "SELECT COALESCE(MAX(id), 0) FROM "
        + config.tableName();

    try (Connection conn = config.dataSource().getConnection();
         PreparedStatement ps = conn.prepareStatement(sql);
         ResultSet rs = ps.executeQuery()) {

      final long startId = rs.next() ? rs.getLong(1) : 0L;
      log.debug("Opened change-log feed for '{}' after id {}",
          table.tableName(), startId);
      return new ChangeLogFeed(table, startId);

    } catch (final SQLException e) {
      throw new SubscriptionLostException(table, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void stop() {
    log.info("JdbcChangeLogSource stopped");
  }

  /**
   * Appends a row change to the change log.
   *
   * @param table     the changed table, never null
   * @param operation the operation, never null
   * @param oldRecord the row before the change, null for inserts
   * @param newRecord the row after the change, null for deletes
   *
   * @return the id of the appended log row
   *
   * @throws IllegalArgumentException if both records are null
   * @throws ChangeCastException if the row cannot be written
   */
  public long append(final WatchedTable table, final Operation operation,
      final Map<String, Object> oldRecord,
      final Map<String, Object> newRecord) {
    Objects.requireNonNull(table, "table cannot be null");
    Objects.requireNonNull(operation, "operation cannot be null");
    if (oldRecord == null && newRecord == null) {
      throw new IllegalArgumentException(
          "oldRecord and newRecord cannot both be null");
    }

    final String sql = "INSERT INTO " + config.tableName()
        + " (table_name, operation, old_record, new_record, created_at)"
        + " VALUES (?, ?, ?, ?, ?)";

    try (Connection conn = config.dataSource().getConnection();
         PreparedStatement ps = conn.prepareStatement(sql,
             Statement.RETURN_GENERATED_KEYS)) {

      ps.setString(1, table.tableName());
      ps.setString(2, operation.name());
      ps.setString(3, toJson(oldRecord));
      ps.setString(4, toJson(newRecord));
      ps.setTimestamp(5, Timestamp.from(clock.instant()));
      ps.executeUpdate();

      try (ResultSet keys = ps.getGeneratedKeys()) {
        final long id = keys.next() ? keys.getLong(1) : -1L;
        log.debug("Appended {} on '{}' as change-log id {}", operation,
            table.tableName(), id);
        return id;
      }

    } catch (final SQLException e) {
      throw new ChangeCastException("Failed to append " + operation
          + " on table '" + table.tableName() + "' to the change log", e);
    }
  }

  /**
   * Creates the change-log table if it does not already exist.
   *
   * <p>Uses {@code CREATE TABLE IF NOT EXISTS} for idempotent DDL.
   */
  private void createTableIfNotExists() {
    final String ddl = "CREATE TABLE IF NOT EXISTS " + config.tableName()
        + " ("
        + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
        + "table_name VARCHAR(64) NOT NULL, "
        + "operation VARCHAR(16) NOT NULL, "
        + "old_record CLOB, "
        + "new_record CLOB, "
        + "created_at TIMESTAMP NOT NULL"
        + ")";

    try (Connection conn = config.dataSource().getConnection();
         PreparedStatement ps = conn.prepareStatement(ddl)) {

      ps.execute();
      log.debug("Ensured change-log table '{}' exists", config.tableName());

    } catch (final SQLException e) {
      throw new ChangeCastException(
          "Failed to create change-log table '" + config.tableName() + "'",
          e);
    }
  }

  private static String toJson(final Map<String, Object> record) {
    if (record == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(record);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Record is not serializable to JSON",
          e);
    }
  }

  private static Map<String, Object> fromJson(final String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(json, ROW_TYPE);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed record JSON: " + json, e);
    }
  }

  /** A feed over the change-log rows of one table. */
  private final class ChangeLogFeed implements ChangeFeed {

    /** The observed table. */
    private final WatchedTable table;

    /** Rows read but not handed out yet. */
    private final Deque<NativeChange> buffer = new ArrayDeque<>();

    /** The highest log id read so far. */
    private long lastId;

    /** Whether the feed was closed. */
    private volatile boolean closed;

    ChangeLogFeed(final WatchedTable theTable, final long theStartId) {
      table = theTable;
      lastId = theStartId;
    }

    @Override
    public NativeChange poll(final Duration timeout)
        throws InterruptedException {
      final long deadline = System.nanoTime() + timeout.toNanos();
      while (buffer.isEmpty() && !closed) {
        fetch();
        if (!buffer.isEmpty()) {
          break;
        }
        final long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return null;
        }
        Thread.sleep(Math.max(1L, Math.min(config.pollInterval().toMillis(),
            remaining / 1_000_000L)));
      }
      return buffer.poll();
    }

    @Override
    public void close() {
      closed = true;
      buffer.clear();
    }

    private void fetch() {
      final String sql = "SELECT id, operation, old_record, new_record,"
          + " created_at FROM " + config.tableName()
          + " WHERE table_name = ? AND id > ? ORDER BY id";

      try (Connection conn = config.dataSource().getConnection();
           PreparedStatement ps = conn.prepareStatement(sql)) {

        ps.setString(1, table.tableName());
        ps.setLong(2, lastId);
        ps.setMaxRows(BATCH_SIZE);

        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            lastId = rs.getLong("id");
            final NativeChange change = toChange(rs);
            if (change != null) {
              buffer.add(change);
            }
          }
        }

      } catch (final SQLException e) {
        throw new SubscriptionLostException(table, e);
      }
    }

    private NativeChange toChange(final ResultSet rs) throws SQLException {
      final Timestamp createdAt = rs.getTimestamp("created_at");
      try {
        return new NativeChange(table.tableName(), null,
            rs.getString("operation"),
            fromJson(rs.getString("old_record")),
            fromJson(rs.getString("new_record")),
            createdAt == null ? null : createdAt.toInstant());
      } catch (final IllegalArgumentException e) {
        log.warn("Skipping change-log row {} of '{}': {}", lastId,
            table.tableName(), e.getMessage());
        return null;
      }
    }
  }
}
