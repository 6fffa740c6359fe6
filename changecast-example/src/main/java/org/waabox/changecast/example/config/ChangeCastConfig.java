package org.waabox.changecast.example.config;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.changecast.auth.StreamAuthenticator;
import org.waabox.changecast.example.security.CampusTokenProperties;
import org.waabox.changecast.example.security.PropertiesTokenAuthenticator;
import org.waabox.changecast.source.jdbc.JdbcChangeLogConfig;
import org.waabox.changecast.source.jdbc.JdbcChangeLogSource;

/** Spring configuration that defines the ChangeCast infrastructure beans
 * for the example application.
 *
 * <p>This configuration provides the following beans that are picked up
 * by the changecast-spring-boot-starter auto-configuration via
 * {@link org.springframework.beans.factory.ObjectProvider}:
 * <ul>
 *   <li>{@link JdbcChangeLogSource} reading the change log of the
 *       application datasource</li>
 *   <li>{@link PropertiesTokenAuthenticator} resolving the tokens of
 *       {@code campus.tokens}</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
@EnableConfigurationProperties(CampusTokenProperties.class)
public class ChangeCastConfig {

  /** Creates the change source over the change-log table.
   *
   * @param dataSource   the application datasource, never null
   * @param tableName    the change-log table name, never null
   * @param pollInterval the change-log polling interval, never null
   *
   * @return the change source, never null
   */
  @Bean
  public JdbcChangeLogSource jdbcChangeLogSource(final DataSource dataSource,
      @Value("${campus.change-log.table:changecast_change_log}")
          final String tableName,
      @Value("${campus.change-log.poll-interval:500ms}")
          final Duration pollInterval) {
    return new JdbcChangeLogSource(
        JdbcChangeLogConfig.create(dataSource, tableName, pollInterval));
  }

  /** Creates the bearer-token authenticator.
   *
   * @param properties the configured tokens, never null
   *
   * @return the authenticator, never null
   */
  @Bean
  public StreamAuthenticator streamAuthenticator(
      final CampusTokenProperties properties) {
    return new PropertiesTokenAuthenticator(properties);
  }

  /** Creates the executor that runs one writer loop per open stream.
   *
   * <p>Threads are created on demand since each stream holds its thread
   * for the lifetime of the connection.
   *
   * @return the executor, never null
   */
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService changeStreamExecutor() {
    final AtomicInteger threads = new AtomicInteger();
    return Executors.newCachedThreadPool(r -> {
      final Thread thread = new Thread(r,
          "changecast-stream-" + threads.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }
}
