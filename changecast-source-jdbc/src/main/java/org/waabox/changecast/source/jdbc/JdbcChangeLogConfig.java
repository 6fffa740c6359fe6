package org.waabox.changecast.source.jdbc;

import java.time.Duration;
import java.util.Objects;

import javax.sql.DataSource;

/**
 * Configuration for the JDBC change-log source.
 *
 * <p>Holds the {@link DataSource}, the name of the change-log table and the
 * interval at which each feed queries it for new rows.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(DataSource)} and
 * {@link #create(DataSource, String, Duration)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcChangeLogConfig {

  /** Default change-log table name. */
  private static final String DEFAULT_TABLE_NAME = "changecast_change_log";

  /** Default poll interval (1 second). */
  private static final Duration DEFAULT_POLL_INTERVAL =
      Duration.ofSeconds(1);

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The change-log table name, never null. */
  private final String tableName;

  /** The polling interval, never null. */
  private final Duration pollInterval;

  private JdbcChangeLogConfig(final DataSource theDataSource,
      final String theTableName, final Duration thePollInterval) {
    dataSource = theDataSource;
    tableName = theTableName;
    pollInterval = thePollInterval;
  }

  /**
   * Creates a configuration with all custom values.
   *
   * @param dataSource   the JDBC data source, never null
   * @param tableName    the change-log table name, a plain SQL identifier
   * @param pollInterval the polling interval, positive
   *
   * @return a new configuration instance, never null
   */
  public static JdbcChangeLogConfig create(final DataSource dataSource,
      final String tableName, final Duration pollInterval) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    Objects.requireNonNull(tableName, "tableName cannot be null");
    Objects.requireNonNull(pollInterval, "pollInterval cannot be null");

    if (!tableName.matches("[A-Za-z_][A-Za-z0-9_]*")) {
      throw new IllegalArgumentException(
          "tableName must be a plain SQL identifier, got: " + tableName);
    }
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException(
          "pollInterval must be positive, got: " + pollInterval);
    }

    return new JdbcChangeLogConfig(dataSource, tableName, pollInterval);
  }

  /**
   * Creates a configuration with the default table name
   * ({@code changecast_change_log}) and poll interval (1 second).
   *
   * @param dataSource the JDBC data source, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcChangeLogConfig create(final DataSource dataSource) {
    return create(dataSource, DEFAULT_TABLE_NAME, DEFAULT_POLL_INTERVAL);
  }

  /**
   * Returns the JDBC data source.
   *
   * @return the data source, never null
   */
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Returns the change-log table name.
   *
   * @return the table name, never null
   */
  public String tableName() {
    return tableName;
  }

  /**
   * Returns the polling interval.
   *
   * @return the poll interval, never null
   */
  public Duration pollInterval() {
    return pollInterval;
  }
}
