package org.waabox.changecast.example.security;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changecast.auth.StreamAuthenticator;
import org.waabox.changecast.auth.StreamPrincipal;
import org.waabox.changecast.event.WatchedTable;

/** A {@link StreamAuthenticator} backed by the tokens of
 * {@link CampusTokenProperties}.
 *
 * <p>Tokens are resolved once, at construction. A token without tables
 * grants every watched table. Expiry is reported through
 * {@link StreamPrincipal#expiresAt()} and enforced by the stream endpoint.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PropertiesTokenAuthenticator implements StreamAuthenticator {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PropertiesTokenAuthenticator.class);

  /** The principals, keyed by token. */
  private final Map<String, StreamPrincipal> principals;

  /** Creates a new authenticator.
   *
   * @param properties the configured tokens, never null
   *
   * @throws IllegalArgumentException if a token has no value, no principal
   *     or an unknown table, or if a token value is repeated
   */
  public PropertiesTokenAuthenticator(final CampusTokenProperties properties) {
    Objects.requireNonNull(properties, "properties cannot be null");

    final Map<String, StreamPrincipal> resolved = new HashMap<>();
    for (final CampusTokenProperties.Token token : properties.getTokens()) {
      if (token.getToken() == null || token.getToken().isBlank()) {
        throw new IllegalArgumentException("campus.tokens entries need a token");
      }
      if (token.getPrincipal() == null || token.getPrincipal().isBlank()) {
        throw new IllegalArgumentException("Token of unnamed principal");
      }
      final StreamPrincipal principal = new StreamPrincipal(
          token.getPrincipal(), scope(token.getTables()),
          token.getExpiresAt());
      if (resolved.putIfAbsent(token.getToken(), principal) != null) {
        throw new IllegalArgumentException("Token of '"
            + token.getPrincipal() + "' is configured more than once");
      }
    }
    principals = Collections.unmodifiableMap(resolved);
    log.info("Loaded {} stream tokens", principals.size());
  }

  /** {@inheritDoc} */
  @Override
  public StreamPrincipal authenticate(final String credential) {
    final StreamPrincipal principal = principals.get(credential);
    if (principal == null) {
      log.debug("Rejected an unknown stream token");
    }
    return principal;
  }

  private static Set<WatchedTable> scope(final List<String> tables) {
    if (tables == null || tables.isEmpty()) {
      return EnumSet.allOf(WatchedTable.class);
    }
    final Set<WatchedTable> scope = EnumSet.noneOf(WatchedTable.class);
    for (final String table : tables) {
      scope.add(WatchedTable.fromTableName(table));
    }
    return scope;
  }
}
