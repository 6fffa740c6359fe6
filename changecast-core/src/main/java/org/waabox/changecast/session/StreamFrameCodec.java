package org.waabox.changecast.session;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class that encodes {@link StreamFrame} instances as
 * server-sent event messages.
 *
 * <p>Every frame becomes a single {@code data:} line holding a JSON object
 * with the fields {@code type}, {@code data} and {@code timestamp},
 * followed by a blank line. The timestamp is an ISO-8601 string. Record
 * values are written through Jackson's tree model, so they must be plain
 * JSON types (strings, numbers, booleans, maps, lists).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StreamFrameCodec {

  /** The prefix of the data line. */
  private static final String DATA_PREFIX = "data: ";

  /** The event terminator, an empty line. */
  private static final String TERMINATOR = "\n\n";

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private StreamFrameCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a frame into its JSON object.
   *
   * @param frame the frame to serialize, never null.
   * @return the JSON text, never null.
   */
  public static String toJson(final StreamFrame frame) {
    Objects.requireNonNull(frame, "frame cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("type", frame.type());
    node.set("data", MAPPER.valueToTree(frame.data()));
    node.put("timestamp", frame.timestamp().toString());

    return node.toString();
  }

  /**
   * Encodes a frame as a complete server-sent event message.
   *
   * @param frame the frame to encode, never null.
   * @return the {@code data: <json>} line plus the blank terminator line.
   */
  public static String encode(final StreamFrame frame) {
    return DATA_PREFIX + toJson(frame) + TERMINATOR;
  }

  /**
   * Parses a frame from its JSON object or from a {@code data:} line.
   *
   * <p>The data payload is returned as a {@link JsonNode}, or null when it
   * is the JSON null.
   *
   * @param text the JSON object, optionally prefixed with {@code data:},
   *     never null.
   * @return the parsed frame, never null.
   * @throws IllegalArgumentException if the text is malformed or misses
   *     the {@code type} or {@code timestamp} field.
   */
  public static StreamFrame decode(final String text) {
    Objects.requireNonNull(text, "text cannot be null");

    String json = text.strip();
    if (json.startsWith("data:")) {
      json = json.substring("data:".length()).strip();
    }
    try {
      final JsonNode node = MAPPER.readTree(json);
      final String type = requireField(node, "type").asText();
      final Instant timestamp = Instant.parse(
          requireField(node, "timestamp").asText());
      final JsonNode data = node.get("data");
      return new StreamFrame(type,
          data == null || data.isNull() ? null : data, timestamp);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed frame: " + text, e);
    }
  }

  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
    return value;
  }
}
