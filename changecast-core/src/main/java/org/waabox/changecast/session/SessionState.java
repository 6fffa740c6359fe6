package org.waabox.changecast.session;

/**
 * The lifecycle of a {@link ClientSession}.
 *
 * <p>States only move forward:
 * {@code CONNECTING -> STREAMING -> DRAINING -> CLOSED}. A session may
 * jump from any state straight to {@code CLOSED} when a write fails.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SessionState {

  /** Subscribed, the confirmation frame is being written. */
  CONNECTING,

  /** The writer loop forwards events and heartbeats. */
  STREAMING,

  /** Closing was requested, the writer loop is winding down. */
  DRAINING,

  /** Unsubscribed and the transport is released. */
  CLOSED
}
