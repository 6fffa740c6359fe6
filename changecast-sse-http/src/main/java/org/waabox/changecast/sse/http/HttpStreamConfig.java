package org.waabox.changecast.sse.http;

/**
 * Configuration for the {@link HttpStreamServer}.
 *
 * <p>Holds the port the embedded server listens on and the path of the
 * stream endpoint. Use port {@code 0} to bind an ephemeral port.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpStreamConfig {

  /** The default path of the stream endpoint. */
  private static final String DEFAULT_PATH = "/api/realtime/stream";

  /** The port the HTTP server listens on. */
  private final int port;

  /** The path of the stream endpoint. */
  private final String path;

  /**
   * Private constructor; use the static factory methods.
   *
   * @param port the port, between 0 and 65535
   * @param path the endpoint path, starting with a slash
   */
  private HttpStreamConfig(final int port, final String path) {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
    if (path == null || !path.startsWith("/")) {
      throw new IllegalArgumentException(
          "path must start with '/', got: " + path);
    }
    this.port = port;
    this.path = path;
  }

  /**
   * Creates a configuration using the default path
   * ({@value #DEFAULT_PATH}).
   *
   * @param port the port to listen on
   * @return a new configuration, never null
   */
  public static HttpStreamConfig create(final int port) {
    return new HttpStreamConfig(port, DEFAULT_PATH);
  }

  /**
   * Creates a configuration with a custom path.
   *
   * @param port the port to listen on
   * @param path the endpoint path, starting with a slash
   * @return a new configuration, never null
   */
  public static HttpStreamConfig create(final int port, final String path) {
    return new HttpStreamConfig(port, path);
  }

  /**
   * Returns the configured port.
   *
   * @return the port, 0 for an ephemeral port
   */
  public int port() {
    return port;
  }

  /**
   * Returns the path of the stream endpoint.
   *
   * @return the path, never null
   */
  public String path() {
    return path;
  }
}
