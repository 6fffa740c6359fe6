package org.waabox.changecast.session;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.waabox.changecast.event.ChangeEvent;

/**
 * One message written to a stream client.
 *
 * @param type      {@value #CONNECTION_ESTABLISHED}, {@value #HEARTBEAT}
 *                  or the domain event name, never null
 * @param data      the payload, null for heartbeats
 * @param timestamp the instant the frame refers to, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StreamFrame(String type, Object data, Instant timestamp) {

  /** The type of the first frame of every stream. */
  public static final String CONNECTION_ESTABLISHED = "connection_established";

  /** The type of the idle liveness frame. */
  public static final String HEARTBEAT = "heartbeat";

  /** Validates the mandatory fields. */
  public StreamFrame {
    Objects.requireNonNull(type, "type cannot be null");
    Objects.requireNonNull(timestamp, "timestamp cannot be null");
  }

  /**
   * Creates the frame that confirms a stream is open.
   *
   * @param details the session details sent to the client, never null
   * @param now     the current instant, never null
   *
   * @return the frame, never null
   */
  public static StreamFrame connectionEstablished(
      final Map<String, Object> details, final Instant now) {
    return new StreamFrame(CONNECTION_ESTABLISHED, details, now);
  }

  /**
   * Creates a heartbeat frame.
   *
   * @param now the current instant, never null
   *
   * @return the frame, never null
   */
  public static StreamFrame heartbeat(final Instant now) {
    return new StreamFrame(HEARTBEAT, null, now);
  }

  /**
   * Creates the frame of a change event, stamped with the instant the
   * change occurred.
   *
   * @param event the change event, never null
   *
   * @return the frame, never null
   */
  public static StreamFrame of(final ChangeEvent event) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("table", event.table().tableName());
    data.put("operation", event.operation().name());
    data.put("new", event.newRecord());
    data.put("old", event.oldRecord());
    return new StreamFrame(event.eventName(), data, event.occurredAt());
  }

  /**
   * Checks whether this is a heartbeat.
   *
   * @return true for heartbeat frames
   */
  public boolean isHeartbeat() {
    return HEARTBEAT.equals(type);
  }
}
