package org.waabox.changecast.sse.http;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;

import org.waabox.changecast.session.StreamFrame;
import org.waabox.changecast.session.StreamFrameCodec;
import org.waabox.changecast.session.StreamTransport;

/**
 * Writes stream frames to an {@link HttpExchange} as a server-sent event
 * response.
 *
 * <p>The status line and headers are sent with the first frame, so a
 * request refused before any frame is written can still get an error
 * status. The body is chunked and flushed after every frame.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class ExchangeStreamTransport implements StreamTransport {

  /** HTTP 200 OK status code. */
  private static final int HTTP_OK = 200;

  /** The exchange, never null. */
  private final HttpExchange exchange;

  /** Whether the response headers were sent. */
  private boolean committed;

  /** Whether the exchange was closed. */
  private volatile boolean closed;

  /**
   * Creates a transport over an exchange.
   *
   * @param theExchange the exchange, never null
   */
  ExchangeStreamTransport(final HttpExchange theExchange) {
    exchange = Objects.requireNonNull(theExchange, "exchange cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public void send(final StreamFrame frame) throws IOException {
    if (closed) {
      throw new IOException("Stream already closed");
    }
    if (!committed) {
      final Headers headers = exchange.getResponseHeaders();
      headers.set("Content-Type", "text/event-stream; charset=utf-8");
      headers.set("Cache-Control", "no-cache, no-transform");
      headers.set("X-Accel-Buffering", "no");
      headers.set("Connection", "keep-alive");
      // A zero length selects chunked encoding.
      exchange.sendResponseHeaders(HTTP_OK, 0);
      committed = true;
    }
    final OutputStream body = exchange.getResponseBody();
    body.write(StreamFrameCodec.encode(frame).getBytes(StandardCharsets.UTF_8));
    body.flush();
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    if (!closed) {
      closed = true;
      exchange.close();
    }
  }

  /**
   * Checks whether the response headers were already sent.
   *
   * @return true once the first frame was written
   */
  boolean isCommitted() {
    return committed;
  }
}
