package org.waabox.changecast.sse.http;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.waabox.changecast.auth.AuthenticationFailureException;
import org.waabox.changecast.endpoint.StreamEndpoint;

/**
 * Serves a {@link StreamEndpoint} as a server-sent events endpoint.
 *
 * <p>Uses Java's built-in {@code com.sun.net.httpserver.HttpServer}. Every
 * accepted connection is streamed from its own handler thread for as long
 * as the client stays connected. The bearer credential is read from the
 * {@code Authorization} header or, for browser {@code EventSource} clients
 * that cannot set headers, from the {@code access_token} query parameter.
 *
 * <p>Typical usage:
 * <pre>{@code
 * HttpStreamServer server = new HttpStreamServer(
 *     HttpStreamConfig.create(8085), changeCast.endpoint());
 * server.start();
 * // ... on shutdown
 * changeCast.stop();
 * server.stop();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpStreamServer {

  /** Logger for this class. */
  private static final Logger LOG =
      Logger.getLogger(HttpStreamServer.class.getName());

  /** HTTP 401 Unauthorized status code. */
  private static final int HTTP_UNAUTHORIZED = 401;

  /** HTTP 403 Forbidden status code. */
  private static final int HTTP_FORBIDDEN = 403;

  /** HTTP 405 Method Not Allowed status code. */
  private static final int HTTP_METHOD_NOT_ALLOWED = 405;

  /** HTTP 500 Internal Server Error status code. */
  private static final int HTTP_INTERNAL_ERROR = 500;

  /** The delay in seconds before stopping the HTTP server. */
  private static final int SERVER_STOP_DELAY_SECONDS = 1;

  /** The scheme prefix of a bearer authorization header. */
  private static final String BEARER_PREFIX = "bearer ";

  /** The query parameter carrying the credential. */
  private static final String TOKEN_PARAMETER = "access_token";

  /** Shared ObjectMapper for error bodies. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The configuration of this server. */
  private final HttpStreamConfig config;

  /** The endpoint requests are handed to. */
  private final StreamEndpoint endpoint;

  /** The HTTP server, null until started. */
  private HttpServer server;

  /** The handler threads, null until started. */
  private ExecutorService executor;

  /**
   * Creates a new server.
   *
   * @param config   the server configuration, never null
   * @param endpoint the stream endpoint, never null
   */
  public HttpStreamServer(final HttpStreamConfig config,
      final StreamEndpoint endpoint) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.endpoint = Objects.requireNonNull(endpoint,
        "endpoint cannot be null");
  }

  /**
   * Binds the port and starts accepting stream requests.
   *
   * @throws IllegalStateException if the port cannot be bound
   */
  public void start() {
    final AtomicInteger threads = new AtomicInteger();
    try {
      server = HttpServer.create(new InetSocketAddress(config.port()), 0);
      executor = Executors.newCachedThreadPool(r -> {
        final Thread thread = new Thread(r,
            "changecast-sse-" + threads.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      });
      server.setExecutor(executor);
      server.createContext(config.path(), this::handleStream);
      server.start();

      LOG.info("HttpStreamServer started on port " + port()
          + " at path " + config.path());
    } catch (final IOException e) {
      throw new IllegalStateException(
          "Failed to start HTTP server on port " + config.port(), e);
    }
  }

  /**
   * Stops the server. Open streams are expected to be closed through the
   * endpoint first.
   */
  public void stop() {
    if (server != null) {
      server.stop(SERVER_STOP_DELAY_SECONDS);
      LOG.info("HTTP server stopped");
    }
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  /**
   * Returns the bound port.
   *
   * @return the port, the ephemeral one when configured with 0
   *
   * @throws IllegalStateException if the server was not started
   */
  public int port() {
    if (server == null) {
      throw new IllegalStateException("Server not started");
    }
    return server.getAddress().getPort();
  }

  /**
   * Handles a request on the stream endpoint.
   *
   * <p>Only GET requests are accepted. On success the request thread stays
   * in the session's writer loop until the stream ends.
   *
   * @param exchange the HTTP exchange, never null
   * @throws IOException if writing an error response fails
   */
  private void handleStream(final HttpExchange exchange) throws IOException {
    if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
      exchange.getResponseHeaders().set("Allow", "GET");
      sendError(exchange, HTTP_METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED",
          "Only GET is supported");
      return;
    }

    final ExchangeStreamTransport transport =
        new ExchangeStreamTransport(exchange);
    try {
      endpoint.stream(credential(exchange), transport);
    } catch (final AuthenticationFailureException e) {
      if (!e.isForbidden()) {
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
      }
      sendError(exchange, e.isForbidden() ? HTTP_FORBIDDEN : HTTP_UNAUTHORIZED,
          e.reason().name(), e.getMessage());
    } catch (final IOException e) {
      LOG.fine("Stream ended before it started: " + e.getMessage());
    } catch (final RuntimeException e) {
      LOG.log(Level.SEVERE, "Failed to handle stream request", e);
      if (transport.isCommitted()) {
        transport.close();
      } else {
        sendError(exchange, HTTP_INTERNAL_ERROR, "INTERNAL_ERROR",
            "Internal Server Error");
      }
    }
  }

  /**
   * Extracts the bearer credential of a request.
   *
   * @param exchange the exchange, never null
   * @return the credential, or null if the request carries none
   */
  static String credential(final HttpExchange exchange) {
    final String header = exchange.getRequestHeaders()
        .getFirst("Authorization");
    if (header != null && header.length() > BEARER_PREFIX.length()
        && header.regionMatches(true, 0, BEARER_PREFIX, 0,
            BEARER_PREFIX.length())) {
      return header.substring(BEARER_PREFIX.length()).trim();
    }
    return queryParameter(exchange.getRequestURI().getRawQuery(),
        TOKEN_PARAMETER);
  }

  /**
   * Finds a parameter in a raw query string.
   *
   * @param rawQuery the raw query, may be null
   * @param name     the parameter name, never null
   * @return the decoded value, or null if absent
   */
  static String queryParameter(final String rawQuery, final String name) {
    if (rawQuery == null || rawQuery.isEmpty()) {
      return null;
    }
    for (final String pair : rawQuery.split("&")) {
      final int eq = pair.indexOf('=');
      final String key = eq < 0 ? pair : pair.substring(0, eq);
      if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
        return eq < 0 ? ""
            : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
      }
    }
    return null;
  }

  /**
   * Sends a JSON error response and closes the exchange.
   *
   * @param exchange   the HTTP exchange
   * @param statusCode the HTTP status code
   * @param error      the error code
   * @param message    the error message
   * @throws IOException if writing the response fails
   */
  private void sendError(final HttpExchange exchange, final int statusCode,
      final String error, final String message) throws IOException {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("error", error);
    node.put("message", message);
    final byte[] bytes = node.toString().getBytes(StandardCharsets.UTF_8);

    exchange.getResponseHeaders().set("Content-Type",
        "application/json; charset=utf-8");
    exchange.sendResponseHeaders(statusCode, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
