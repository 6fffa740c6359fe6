package org.waabox.changecast.source.kafka;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.waabox.changecast.source.NativeChange;

/**
 * Static utility class that reads Debezium change envelopes.
 *
 * <p>Accepts both the bare envelope ({@code before}, {@code after},
 * {@code op}, {@code source}, {@code ts_ms}) and the envelope wrapped by
 * the JSON converter with schemas enabled ({@code {schema, payload}}).
 * The commit instant is {@code source.ts_ms}, falling back to the
 * top-level {@code ts_ms}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DebeziumEnvelopeCodec {

  /** The JSON type of a row. */
  private static final TypeReference<Map<String, Object>> ROW_TYPE =
      new TypeReference<>() { };

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private DebeziumEnvelopeCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Decodes a Debezium record value.
   *
   * @param json         the record value, may be null for tombstones
   * @param defaultTable the table name to use when the envelope has no
   *     {@code source.table}, never null
   *
   * @return the native change, or null for tombstones and empty payloads
   *
   * @throws IllegalArgumentException if the value is not a JSON object or
   *     carries no {@code op}
   */
  public static NativeChange decode(final String json,
      final String defaultTable) {
    Objects.requireNonNull(defaultTable, "defaultTable cannot be null");
    if (json == null || json.isBlank()) {
      return null;
    }

    final JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed Debezium envelope", e);
    }
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException(
          "Debezium envelope must be a JSON object");
    }

    final JsonNode envelope = root.has("payload") && root.has("schema")
        ? root.get("payload") : root;
    if (envelope == null || envelope.isNull()) {
      return null;
    }

    final String op = envelope.path("op").asText("");
    if (op.isEmpty()) {
      throw new IllegalArgumentException("Debezium envelope has no 'op'");
    }

    final JsonNode source = envelope.path("source");
    final String table = source.path("table").asText(defaultTable);
    final String schema = source.hasNonNull("schema")
        ? source.get("schema").asText() : null;

    return new NativeChange(table, schema, op,
        toRow(envelope.get("before")), toRow(envelope.get("after")),
        commitTimestamp(envelope, source));
  }

  private static Map<String, Object> toRow(final JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    return MAPPER.convertValue(node, ROW_TYPE);
  }

  private static Instant commitTimestamp(final JsonNode envelope,
      final JsonNode source) {
    if (source.hasNonNull("ts_ms")) {
      return Instant.ofEpochMilli(source.get("ts_ms").asLong());
    }
    if (envelope.hasNonNull("ts_ms")) {
      return Instant.ofEpochMilli(envelope.get("ts_ms").asLong());
    }
    return null;
  }
}
