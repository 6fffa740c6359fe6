package org.waabox.changecast.source.kafka;

import java.util.Objects;

import org.waabox.changecast.event.WatchedTable;

/** Configuration for the Kafka change source.
 *
 * <p>Holds the Kafka bootstrap servers, the prefix of the per-table CDC
 * topics and the prefix used to build unique consumer group ids.
 *
 * <p>Default values:
 * <ul>
 *   <li>Topic prefix: {@code campus.public}</li>
 *   <li>Consumer group prefix: {@code changecast-}</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaChangeSourceConfig {

  /** The default topic prefix, the Debezium server and schema names. */
  private static final String DEFAULT_TOPIC_PREFIX = "campus.public";

  /** The default consumer group prefix. */
  private static final String DEFAULT_CONSUMER_GROUP_PREFIX = "changecast-";

  /** The Kafka bootstrap servers, never null. */
  private final String bootstrapServers;

  /** The topic prefix, never null. */
  private final String topicPrefix;

  /** The consumer group prefix, never null. */
  private final String consumerGroupPrefix;

  private KafkaChangeSourceConfig(final String theBootstrapServers,
      final String theTopicPrefix, final String theConsumerGroupPrefix) {
    bootstrapServers = Objects.requireNonNull(theBootstrapServers,
        "bootstrapServers must not be null");
    topicPrefix = Objects.requireNonNull(theTopicPrefix,
        "topicPrefix must not be null");
    consumerGroupPrefix = Objects.requireNonNull(theConsumerGroupPrefix,
        "consumerGroupPrefix must not be null");
  }

  /** Creates a configuration with the default prefixes.
   *
   * @param bootstrapServers the Kafka bootstrap servers, never null
   *
   * @return a new configuration, never null
   */
  public static KafkaChangeSourceConfig create(final String bootstrapServers) {
    return new KafkaChangeSourceConfig(bootstrapServers, DEFAULT_TOPIC_PREFIX,
        DEFAULT_CONSUMER_GROUP_PREFIX);
  }

  /** Creates a configuration with custom values.
   *
   * @param bootstrapServers    the Kafka bootstrap servers, never null
   * @param topicPrefix         the topic prefix, never null
   * @param consumerGroupPrefix the consumer group prefix, never null
   *
   * @return a new configuration, never null
   */
  public static KafkaChangeSourceConfig create(final String bootstrapServers,
      final String topicPrefix, final String consumerGroupPrefix) {
    return new KafkaChangeSourceConfig(bootstrapServers, topicPrefix,
        consumerGroupPrefix);
  }

  /** Returns the topic that carries the changes of a table.
   *
   * @param table the table, never null
   *
   * @return {@code <topicPrefix>.<table name>}, never null
   */
  public String topicFor(final WatchedTable table) {
    return topicPrefix + "." + table.tableName();
  }

  /** Returns the Kafka bootstrap servers.
   *
   * @return the bootstrap servers, never null
   */
  public String bootstrapServers() {
    return bootstrapServers;
  }

  /** Returns the topic prefix.
   *
   * @return the topic prefix, never null
   */
  public String topicPrefix() {
    return topicPrefix;
  }

  /** Returns the consumer group prefix.
   *
   * @return the consumer group prefix, never null
   */
  public String consumerGroupPrefix() {
    return consumerGroupPrefix;
  }
}
