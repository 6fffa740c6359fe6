package org.waabox.changecast.source.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.waabox.changecast.source.NativeChange;

/** Unit tests for {@link DebeziumEnvelopeCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DebeziumEnvelopeCodecTest {

  @Test
  void whenDecoding_givenBareUpdateEnvelope_shouldReadRowsAndCommitTime() {
    final String json = "{\"before\":{\"id\":42,\"year\":1},"
        + "\"after\":{\"id\":42,\"year\":2},"
        + "\"source\":{\"schema\":\"public\",\"table\":\"students\","
        + "\"ts_ms\":1718020800000},"
        + "\"op\":\"u\",\"ts_ms\":1718020801234}";

    final NativeChange change = DebeziumEnvelopeCodec.decode(json, "x");

    assertEquals("students", change.table());
    assertEquals("public", change.schema());
    assertEquals("u", change.operation());
    assertEquals(1, change.before().get("year"));
    assertEquals(2, change.after().get("year"));
    assertEquals(Instant.ofEpochMilli(1718020800000L),
        change.commitTimestamp());
  }

  @Test
  void whenDecoding_givenSchemaWrappedDelete_shouldUnwrapPayload() {
    final String json = "{\"schema\":{\"type\":\"struct\"},"
        + "\"payload\":{\"before\":{\"id\":7},\"after\":null,"
        + "\"op\":\"d\",\"ts_ms\":1700000000000}}";

    final NativeChange change = DebeziumEnvelopeCodec.decode(json, "marks");

    assertEquals("marks", change.table());
    assertNull(change.schema());
    assertEquals("d", change.operation());
    assertEquals(7, change.before().get("id"));
    assertNull(change.after());
    assertEquals(Instant.ofEpochMilli(1700000000000L),
        change.commitTimestamp());
  }

  @Test
  void whenDecoding_givenTombstone_shouldReturnNull() {
    assertNull(DebeziumEnvelopeCodec.decode(null, "marks"));
    assertNull(DebeziumEnvelopeCodec.decode(
        "{\"schema\":null,\"payload\":null}", "marks"));
  }

  @Test
  void whenDecoding_givenNoOperation_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> DebeziumEnvelopeCodec.decode("{\"after\":{\"id\":1}}", "marks"));
  }

  @Test
  void whenDecoding_givenMalformedJson_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> DebeziumEnvelopeCodec.decode("{not json", "marks"));
  }
}
