package org.waabox.changecast.auth;

import java.util.Objects;

/**
 * Thrown when a stream request is refused before any stream starts.
 *
 * <p>Transports map {@link Reason#FORBIDDEN_SCOPE} to an access-denied
 * response (403) and every other reason to an authentication challenge
 * (401).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class AuthenticationFailureException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Why the request was refused. */
  public enum Reason {
    /** No credential was sent. */
    MISSING_CREDENTIAL,
    /** The credential is unknown or malformed. */
    INVALID_CREDENTIAL,
    /** The credential is past its expiry. */
    EXPIRED_CREDENTIAL,
    /** The caller may not observe any watched table. */
    FORBIDDEN_SCOPE
  }

  /** The refusal reason, never null. */
  private final Reason reason;

  /**
   * Creates a new exception.
   *
   * @param theReason the refusal reason, never null
   * @param message   the detail message, never null
   */
  public AuthenticationFailureException(final Reason theReason,
      final String message) {
    super(message);
    reason = Objects.requireNonNull(theReason, "reason cannot be null");
  }

  /**
   * Returns why the request was refused.
   *
   * @return the reason, never null
   */
  public Reason reason() {
    return reason;
  }

  /**
   * Checks whether the caller was identified but lacks permissions.
   *
   * @return true for {@link Reason#FORBIDDEN_SCOPE}
   */
  public boolean isForbidden() {
    return reason == Reason.FORBIDDEN_SCOPE;
  }
}
