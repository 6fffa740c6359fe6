package org.waabox.changecast.example.application;

import java.io.IOException;
import java.util.Objects;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import org.waabox.changecast.session.StreamFrame;
import org.waabox.changecast.session.StreamFrameCodec;
import org.waabox.changecast.session.StreamTransport;

/** A {@link StreamTransport} over a Spring MVC {@link SseEmitter}.
 *
 * <p>Each frame is sent as one {@code data:} event carrying the JSON
 * frame. Closing the transport completes the emitter.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SseEmitterTransport implements StreamTransport {

  /** The emitter of the response, never null. */
  private final SseEmitter emitter;

  /** Creates a new transport.
   *
   * @param theEmitter the emitter of the response, never null
   */
  public SseEmitterTransport(final SseEmitter theEmitter) {
    emitter = Objects.requireNonNull(theEmitter, "emitter cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public void send(final StreamFrame frame) throws IOException {
    try {
      emitter.send(SseEmitter.event().data(StreamFrameCodec.toJson(frame)));
    } catch (final IllegalStateException e) {
      // The emitter was already completed by the container.
      throw new IOException("Stream is no longer writable", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    emitter.complete();
  }
}
