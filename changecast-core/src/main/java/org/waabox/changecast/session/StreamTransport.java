package org.waabox.changecast.session;

import java.io.IOException;

/**
 * The outbound half of one client connection.
 *
 * <p>A {@link ClientSession} writes every frame through its transport from
 * a single thread at a time, so implementations do not need to serialize
 * writes themselves.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface StreamTransport {

  /**
   * Writes a frame and flushes it to the client.
   *
   * @param frame the frame, never null
   *
   * @throws IOException if the client is gone or the write failed; the
   *     session treats this as terminal
   */
  void send(StreamFrame frame) throws IOException;

  /**
   * Completes the response and releases the connection. Idempotent.
   */
  void close();
}
