package org.waabox.changecast.example;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.waabox.changecast.session.StreamFrame;
import org.waabox.changecast.session.StreamFrameCodec;

/** Smoke test that boots the example application and streams a change
 * recorded through the change-log endpoint.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "campus.change-log.poll-interval=50ms",
        "changecast.heartbeat-interval=1s",
        "changecast.tables=students,marks",
        "campus.tokens[0].token=registrar-token",
        "campus.tokens[0].principal=registrar",
        "campus.tokens[0].tables=students,admissions",
        "campus.tokens[1].token=library-token",
        "campus.tokens[1].principal=librarian",
        "campus.tokens[1].tables=notifications"
    })
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class ChangeCastExampleSmokeTest {

  @LocalServerPort
  private int port;

  private final HttpClient client = HttpClient.newBuilder()
      .version(HttpClient.Version.HTTP_1_1)
      .build();

  private URI uri(final String path) {
    return URI.create("http://localhost:" + port + path);
  }

  private static StreamFrame nextFrame(final Iterator<String> lines) {
    while (lines.hasNext()) {
      final String line = lines.next();
      if (line.startsWith("data:")) {
        return StreamFrameCodec.decode(line);
      }
    }
    throw new AssertionError("Stream ended");
  }

  @Test
  void whenStudentIsUpdated_givenRegistrarStream_shouldReceiveUpdate() throws Exception {
    final HttpResponse<Stream<String>> stream = client.send(
        HttpRequest.newBuilder(uri("/api/realtime/stream"))
            .header("Authorization", "Bearer registrar-token")
            .GET().build(),
        HttpResponse.BodyHandlers.ofLines());

    assertEquals(200, stream.statusCode());
    assertTrue(stream.headers().firstValue("Content-Type").orElse("")
        .startsWith("text/event-stream"));
    assertEquals("no-cache, no-transform",
        stream.headers().firstValue("Cache-Control").orElse(""));
    assertEquals("no",
        stream.headers().firstValue("X-Accel-Buffering").orElse(""));

    final Iterator<String> lines = stream.body().iterator();
    final StreamFrame connected = nextFrame(lines);
    assertEquals(StreamFrame.CONNECTION_ESTABLISHED, connected.type());
    assertEquals("registrar",
        ((JsonNode) connected.data()).get("principal").asText());

    final HttpResponse<String> appended = client.send(
        HttpRequest.newBuilder(uri("/api/changes/students"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(
                "{\"operation\":\"UPDATE\","
                + "\"old\":{\"id\":1,\"name\":\"Ann\"},"
                + "\"new\":{\"id\":1,\"name\":\"Anne\"}}"))
            .build(),
        HttpResponse.BodyHandlers.ofString());
    assertEquals(201, appended.statusCode());

    StreamFrame frame = nextFrame(lines);
    while (frame.isHeartbeat()) {
      frame = nextFrame(lines);
    }
    assertEquals("student_updated", frame.type());
    final JsonNode data = (JsonNode) frame.data();
    assertEquals("students", data.get("table").asText());
    assertEquals("UPDATE", data.get("operation").asText());
    assertEquals("Anne", data.get("new").get("name").asText());
    assertEquals("Ann", data.get("old").get("name").asText());

    stream.body().close();
  }

  @Test
  void whenStreaming_givenUnknownToken_shouldReturn401() throws Exception {
    final HttpResponse<String> response = client.send(
        HttpRequest.newBuilder(uri("/api/realtime/stream?access_token=nope"))
            .GET().build(),
        HttpResponse.BodyHandlers.ofString());

    assertEquals(401, response.statusCode());
    assertTrue(response.body().contains("INVALID_CREDENTIAL"));
  }

  @Test
  void whenStreaming_givenTokenOutsideWatchedScope_shouldReturn403() throws Exception {
    final HttpResponse<String> response = client.send(
        HttpRequest.newBuilder(uri("/api/realtime/stream"))
            .header("Authorization", "Bearer library-token")
            .GET().build(),
        HttpResponse.BodyHandlers.ofString());

    assertEquals(403, response.statusCode());
    assertTrue(response.body().contains("FORBIDDEN_SCOPE"));
  }

  @Test
  void whenAppending_givenUnknownTable_shouldReturn400() throws Exception {
    final HttpResponse<String> response = client.send(
        HttpRequest.newBuilder(uri("/api/changes/lockers"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(
                "{\"operation\":\"INSERT\",\"new\":{\"id\":1}}"))
            .build(),
        HttpResponse.BodyHandlers.ofString());

    assertEquals(400, response.statusCode());
  }
}
