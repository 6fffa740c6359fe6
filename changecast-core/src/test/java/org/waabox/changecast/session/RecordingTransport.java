package org.waabox.changecast.session;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A transport that keeps every encoded frame in memory.
 *
 * <p>Once {@link #disconnect()} is called every write fails, like a
 * socket whose peer went away.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RecordingTransport implements StreamTransport {

  /** The encoded frames, in write order. */
  private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();

  /** Released when the transport is closed. */
  private final CountDownLatch closed = new CountDownLatch(1);

  /** Number of close calls. */
  private volatile int closeCalls;

  /** Whether writes fail. */
  private volatile boolean disconnected;

  @Override
  public void send(final StreamFrame frame) throws IOException {
    if (disconnected) {
      throw new IOException("Broken pipe");
    }
    frames.add(StreamFrameCodec.encode(frame));
  }

  @Override
  public void close() {
    closeCalls++;
    closed.countDown();
  }

  /** Makes every following write fail. */
  public void disconnect() {
    disconnected = true;
  }

  /**
   * Waits for the next frame and decodes it.
   *
   * @param timeout the maximum time to wait
   * @return the frame, or null if none was written in time
   * @throws InterruptedException if interrupted
   */
  public StreamFrame next(final Duration timeout)
      throws InterruptedException {
    final String text = frames.poll(timeout.toMillis(),
        TimeUnit.MILLISECONDS);
    return text == null ? null : StreamFrameCodec.decode(text);
  }

  /**
   * Waits for the next frame that is not a heartbeat.
   *
   * @param timeout the maximum time to wait for each frame
   * @return the frame, or null if none was written in time
   * @throws InterruptedException if interrupted
   */
  public StreamFrame nextNonHeartbeat(final Duration timeout)
      throws InterruptedException {
    StreamFrame frame = next(timeout);
    while (frame != null && frame.isHeartbeat()) {
      frame = next(timeout);
    }
    return frame;
  }

  /**
   * Returns the frames not consumed yet, still encoded.
   *
   * @return a copy of the pending frames
   */
  public List<String> pendingFrames() {
    return new ArrayList<>(frames);
  }

  /**
   * Waits for the transport to be closed.
   *
   * @param timeout the maximum time to wait
   * @return true if closed in time
   * @throws InterruptedException if interrupted
   */
  public boolean awaitClosed(final Duration timeout)
      throws InterruptedException {
    return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Returns how many times close was called.
   *
   * @return the close count
   */
  public int closeCalls() {
    return closeCalls;
  }
}
