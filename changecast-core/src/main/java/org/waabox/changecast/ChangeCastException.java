package org.waabox.changecast;

/**
 * Base exception for ChangeCast configuration and lifecycle errors.
 *
 * <p>This is an unchecked exception intended to wrap infrastructure and
 * configuration failures that cannot be meaningfully recovered from at
 * the call site, such as starting a bridge twice or a change source that
 * cannot create its storage.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ChangeCastException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ChangeCastException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ChangeCastException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
