package org.waabox.changecast.auth;

/**
 * Resolves the bearer credential of a stream request into a principal.
 *
 * <p>Called once per stream, when it opens; events are not re-checked.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface StreamAuthenticator {

  /**
   * Authenticates a bearer credential.
   *
   * @param credential the raw credential, null if the request had none
   *
   * @return the principal and its table scope, never null
   *
   * @throws AuthenticationFailureException if the credential is missing,
   *     unknown or expired
   */
  StreamPrincipal authenticate(String credential);
}
