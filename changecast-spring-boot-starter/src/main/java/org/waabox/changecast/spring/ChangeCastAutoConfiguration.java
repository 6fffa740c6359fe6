package org.waabox.changecast.spring;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.changecast.BackoffPolicy;
import org.waabox.changecast.ChangeCast;
import org.waabox.changecast.auth.StreamAuthenticator;
import org.waabox.changecast.endpoint.StreamEndpoint;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.metrics.ChangeCastMetrics;
import org.waabox.changecast.source.ChangeSource;

/**
 * Spring Boot auto-configuration for ChangeCast.
 *
 * <p>Creates a singleton {@link ChangeCast} from
 * {@link ChangeCastProperties} and the {@link ChangeSource},
 * {@link StreamAuthenticator} and optional {@link ChangeCastMetrics} beans
 * of the application context, and exposes its {@link StreamEndpoint} so
 * that web controllers can stream through it.
 *
 * <p>The ChangeCast lifecycle (start/stop) is managed through Spring's
 * {@link SmartLifecycle}, so the change feeds open once every other bean
 * is ready and all client streams are closed first on shutdown.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(ChangeCastProperties.class)
public class ChangeCastAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ChangeCastAutoConfiguration.class);

  /**
   * Creates the singleton {@link ChangeCast} bean.
   *
   * @param properties            the configuration properties, never null
   * @param changeSourceProvider  provider for the ChangeSource bean
   * @param authenticatorProvider provider for the StreamAuthenticator bean
   * @param metricsProvider       provider for an optional ChangeCastMetrics
   *                              bean
   *
   * @return the configured, not yet started ChangeCast, never null
   *
   * @throws IllegalStateException if the ChangeSource or the
   *     StreamAuthenticator bean is missing or ambiguous
   */
  @Bean
  public ChangeCast changeCast(
      final ChangeCastProperties properties,
      final ObjectProvider<ChangeSource> changeSourceProvider,
      final ObjectProvider<StreamAuthenticator> authenticatorProvider,
      final ObjectProvider<ChangeCastMetrics> metricsProvider) {

    requireAtMostOne(changeSourceProvider, ChangeSource.class);
    requireAtMostOne(authenticatorProvider, StreamAuthenticator.class);

    final ChangeSource changeSource = changeSourceProvider.getIfAvailable();
    if (changeSource == null) {
      throw new IllegalStateException(
          "ChangeCast requires a ChangeSource bean");
    }
    final StreamAuthenticator authenticator =
        authenticatorProvider.getIfAvailable();
    if (authenticator == null) {
      throw new IllegalStateException(
          "ChangeCast requires a StreamAuthenticator bean");
    }

    final ChangeCast.Builder builder = ChangeCast.builder()
        .changeSource(changeSource)
        .authenticator(authenticator)
        .heartbeatInterval(properties.getHeartbeatInterval())
        .inboxCapacity(properties.getInboxCapacity())
        .backoffPolicy(BackoffPolicy.of(properties.getBackoff().getInitial(),
            properties.getBackoff().getMax()));

    final Set<WatchedTable> tables = resolveTables(properties.getTables());
    if (!tables.isEmpty()) {
      builder.tables(tables);
    }

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("ChangeCast using custom ChangeCastMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    final ChangeCast changeCast = builder.build();

    log.info("ChangeCast created with {} using {} watched table(s)",
        changeSource.getClass().getSimpleName(), changeCast.tables().size());

    return changeCast;
  }

  /**
   * Exposes the stream endpoint of the ChangeCast bean.
   *
   * @param changeCast the ChangeCast instance, never null
   *
   * @return the stream endpoint, never null
   */
  @Bean
  public StreamEndpoint streamEndpoint(final ChangeCast changeCast) {
    return changeCast.endpoint();
  }

  /**
   * Creates a {@link SmartLifecycle} bean that manages the ChangeCast
   * start/stop lifecycle.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * to ensure all other beans are initialized first, and stops early
   * for the same reason.
   *
   * @param changeCast the ChangeCast instance to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle changeCastLifecycle(final ChangeCast changeCast) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting ChangeCast lifecycle...");
        changeCast.start();
        running = true;
        log.info("ChangeCast lifecycle started successfully.");
      }

      @Override
      public void stop() {
        log.info("Stopping ChangeCast lifecycle...");
        changeCast.stop();
        running = false;
        log.info("ChangeCast lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Parses the configured table names.
   *
   * @param names the table names, may be null or empty
   *
   * @return the tables, empty when none are configured
   *
   * @throws IllegalArgumentException if a name is not a watched table
   */
  static Set<WatchedTable> resolveTables(final List<String> names) {
    final Set<WatchedTable> tables = EnumSet.noneOf(WatchedTable.class);
    if (names != null) {
      for (final String name : names) {
        if (name != null && !name.isBlank()) {
          tables.add(WatchedTable.fromTableName(name.trim()));
        }
      }
    }
    return tables;
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "ChangeCast requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
