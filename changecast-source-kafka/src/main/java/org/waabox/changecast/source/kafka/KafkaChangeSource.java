package org.waabox.changecast.source.kafka;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.function.Function;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.changecast.event.WatchedTable;
import org.waabox.changecast.source.ChangeFeed;
import org.waabox.changecast.source.ChangeSource;
import org.waabox.changecast.source.NativeChange;
import org.waabox.changecast.source.SubscriptionLostException;

/** A {@link ChangeSource} that reads Debezium change envelopes from Kafka.
 *
 * <p>Every watched table has its own topic,
 * {@code <topicPrefix>.<table>}. Each feed owns one consumer with a unique
 * consumer group and {@code auto.offset.reset=latest}, so a feed only sees
 * changes committed after it joined and every instance of the process
 * receives every change. Tombstones are skipped.
 *
 * <p>Typical usage:
 * <pre>
 *   KafkaChangeSourceConfig config =
 *       KafkaChangeSourceConfig.create("localhost:9092");
 *   ChangeSource source = new KafkaChangeSource(config);
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaChangeSource implements ChangeSource {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      KafkaChangeSource.class);

  /** The Kafka configuration, never null. */
  private final KafkaChangeSourceConfig config;

  /** Creates the consumer of a feed, never null. */
  private final Function<WatchedTable, Consumer<String, String>>
      consumerFactory;

  /** Creates a new KafkaChangeSource with the given configuration.
   *
   * @param theConfig the Kafka configuration, never null
   */
  public KafkaChangeSource(final KafkaChangeSourceConfig theConfig) {
    this(theConfig, null);
  }

  /** Creates a new KafkaChangeSource with a custom consumer factory.
   *
   * <p>Package-private for testability.
   *
   * @param theConfig          the Kafka configuration, never null
   * @param theConsumerFactory the consumer factory, null to create
   *     {@link KafkaConsumer} instances
   */
  KafkaChangeSource(final KafkaChangeSourceConfig theConfig,
      final Function<WatchedTable, Consumer<String, String>>
          theConsumerFactory) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    consumerFactory = theConsumerFactory != null
        ? theConsumerFactory : this::createConsumer;
  }

  /** {@inheritDoc} */
  @Override
  public void start() {
    log.info("KafkaChangeSource started on topics '{}.*' with bootstrap "
        + "servers '{}'", config.topicPrefix(), config.bootstrapServers());
  }

  /** {@inheritDoc} */
  @Override
  public ChangeFeed open(final WatchedTable table) {
    Objects.requireNonNull(table, "table must not be null");

    final String topic = config.topicFor(table);
    final Consumer<String, String> consumer;
    try {
      consumer = consumerFactory.apply(table);
    } catch (final KafkaException e) {
      throw new SubscriptionLostException(table, e);
    }
    try {
      consumer.subscribe(Collections.singletonList(topic));
    } catch (final KafkaException e) {
      closeQuietly(consumer, topic);
      throw new SubscriptionLostException(table, e);
    }
    log.debug("Subscribed to topic '{}'", topic);
    return new TopicFeed(table, topic, consumer);
  }

  /** {@inheritDoc} */
  @Override
  public void stop() {
    log.info("KafkaChangeSource stopped");
  }

  /** Creates a consumer configured with string deserializers and a unique
   * consumer group for broadcast semantics.
   *
   * @param table the table the consumer is created for, never null
   *
   * @return the Kafka consumer, never null
   */
  private Consumer<String, String> createConsumer(final WatchedTable table) {
    final String groupId = config.consumerGroupPrefix() + table.tableName()
        + "-" + UUID.randomUUID();

    final Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    return new KafkaConsumer<>(props);
  }

  /** Closes a consumer quietly, logging any errors.
   *
   * @param consumer the consumer, never null
   * @param topic    the topic for logging purposes, never null
   */
  private static void closeQuietly(final Consumer<String, String> consumer,
      final String topic) {
    try {
      consumer.close();
    } catch (final Exception e) {
      log.warn("Error closing consumer of '{}': {}", topic, e.getMessage(), e);
    }
  }

  /** A feed over the CDC topic of one table. Owned by a single thread. */
  private static final class TopicFeed implements ChangeFeed {

    /** The observed table. */
    private final WatchedTable table;

    /** The topic name. */
    private final String topic;

    /** The consumer, used by the polling thread only. */
    private final Consumer<String, String> consumer;

    /** Decoded changes not handed out yet. */
    private final Deque<NativeChange> buffer = new ArrayDeque<>();

    /** Whether the feed was closed. */
    private boolean closed;

    TopicFeed(final WatchedTable theTable, final String theTopic,
        final Consumer<String, String> theConsumer) {
      table = theTable;
      topic = theTopic;
      consumer = theConsumer;
    }

    @Override
    public NativeChange poll(final Duration timeout)
        throws InterruptedException {
      if (buffer.isEmpty() && !closed) {
        final ConsumerRecords<String, String> records;
        try {
          records = consumer.poll(timeout);
        } catch (final InterruptException e) {
          throw new InterruptedException("Interrupted while polling '"
              + topic + "'");
        } catch (final KafkaException e) {
          throw new SubscriptionLostException(table, e);
        }
        for (final ConsumerRecord<String, String> record : records) {
          decode(record);
        }
      }
      return buffer.poll();
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      buffer.clear();
      closeQuietly(consumer, topic);
    }

    private void decode(final ConsumerRecord<String, String> record) {
      try {
        final NativeChange change = DebeziumEnvelopeCodec.decode(
            record.value(), table.tableName());
        if (change != null) {
          buffer.add(change);
        }
      } catch (final IllegalArgumentException e) {
        log.error("Failed to decode change from '{}' partition {} offset {}:"
            + " {}", topic, record.partition(), record.offset(),
            e.getMessage(), e);
      }
    }
  }
}
