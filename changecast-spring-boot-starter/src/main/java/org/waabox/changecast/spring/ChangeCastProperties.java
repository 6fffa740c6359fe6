package org.waabox.changecast.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for ChangeCast.
 *
 * <p>Properties are bound from the {@code changecast} prefix in the
 * application configuration (e.g., application.yml).
 *
 * <p>Example configuration:
 * <pre>
 * changecast:
 *   tables: students, marks, attendance
 *   heartbeat-interval: 25s
 *   inbox-capacity: 256
 *   backoff:
 *     initial: 1s
 *     max: 30s
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "changecast")
public class ChangeCastProperties {

  /** The watched table names. Empty means every watched table. */
  private List<String> tables = new ArrayList<>();

  /** The idle time after which a stream writes a heartbeat. */
  private Duration heartbeatInterval = Duration.ofSeconds(25);

  /** The number of events buffered per client before dropping. */
  private int inboxCapacity = 256;

  /** The reconnection backoff of the change feeds. */
  private final Backoff backoff = new Backoff();

  public List<String> getTables() {
    return tables;
  }

  public void setTables(final List<String> tables) {
    this.tables = tables;
  }

  public Duration getHeartbeatInterval() {
    return heartbeatInterval;
  }

  public void setHeartbeatInterval(final Duration heartbeatInterval) {
    this.heartbeatInterval = heartbeatInterval;
  }

  public int getInboxCapacity() {
    return inboxCapacity;
  }

  public void setInboxCapacity(final int inboxCapacity) {
    this.inboxCapacity = inboxCapacity;
  }

  public Backoff getBackoff() {
    return backoff;
  }

  /** Reconnection backoff settings. */
  public static class Backoff {

    /** The delay before the first reconnection attempt. */
    private Duration initial = Duration.ofSeconds(1);

    /** The maximum delay between reconnection attempts. */
    private Duration max = Duration.ofSeconds(30);

    public Duration getInitial() {
      return initial;
    }

    public void setInitial(final Duration initial) {
      this.initial = initial;
    }

    public Duration getMax() {
      return max;
    }

    public void setMax(final Duration max) {
      this.max = max;
    }
  }
}
