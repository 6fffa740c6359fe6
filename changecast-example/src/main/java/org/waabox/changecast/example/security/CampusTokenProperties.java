package org.waabox.changecast.example.security;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** The bearer tokens accepted by the example deployment.
 *
 * <p>Example configuration:
 * <pre>
 * campus:
 *   tokens:
 *     - token: registrar-token
 *       principal: registrar
 *       tables: students, admissions, fee_payments
 *       expires-at: 2030-01-01T00:00:00Z
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "campus")
public class CampusTokenProperties {

  /** The configured tokens. */
  private List<Token> tokens = new ArrayList<>();

  public List<Token> getTokens() {
    return tokens;
  }

  public void setTokens(final List<Token> tokens) {
    this.tokens = tokens;
  }

  /** One accepted token. */
  public static class Token {

    /** The opaque credential value. */
    private String token;

    /** The name of the principal the token identifies. */
    private String principal;

    /** The table names the principal may observe. Empty means all. */
    private List<String> tables = new ArrayList<>();

    /** When the token stops being accepted, null for never. */
    private Instant expiresAt;

    public String getToken() {
      return token;
    }

    public void setToken(final String token) {
      this.token = token;
    }

    public String getPrincipal() {
      return principal;
    }

    public void setPrincipal(final String principal) {
      this.principal = principal;
    }

    public List<String> getTables() {
      return tables;
    }

    public void setTables(final List<String> tables) {
      this.tables = tables;
    }

    public Instant getExpiresAt() {
      return expiresAt;
    }

    public void setExpiresAt(final Instant expiresAt) {
      this.expiresAt = expiresAt;
    }
  }
}
