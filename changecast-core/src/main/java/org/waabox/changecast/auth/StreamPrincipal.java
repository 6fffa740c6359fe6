package org.waabox.changecast.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.waabox.changecast.event.WatchedTable;

/**
 * The caller of a stream request, as resolved by a
 * {@link StreamAuthenticator}.
 *
 * @param name      the principal name (user id, e-mail), never null
 * @param scope     the tables the principal may observe, never null
 * @param expiresAt when the credential stops being valid, null if it
 *                  never expires
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StreamPrincipal(
    String name,
    Set<WatchedTable> scope,
    Instant expiresAt
) {

  /** Validates and copies the scope. */
  public StreamPrincipal {
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(scope, "scope cannot be null");
    scope = scope.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(scope));
  }

  /**
   * Checks whether the credential is expired at the given instant.
   *
   * @param now the reference instant, never null
   *
   * @return true if the principal has an expiry at or before now
   */
  public boolean isExpiredAt(final Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }
}
