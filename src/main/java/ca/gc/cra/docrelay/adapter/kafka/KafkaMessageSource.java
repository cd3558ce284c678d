package ca.gc.cra.docrelay.adapter.kafka;

import ca.gc.cra.docrelay.application.port.MessageSource;
import ca.gc.cra.docrelay.config.KafkaClientConfig;
import ca.gc.cra.docrelay.domain.msg.BrokerError;
import ca.gc.cra.docrelay.domain.msg.BrokerMessage;
import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RetriableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka-backed {@link MessageSource} that hands out one record per poll.
 * <p><strong>Why:</strong> The polling loop classifies results one at a time, while the Kafka client returns
 * batches; this adapter buffers the batch and drains it before polling again.</p>
 * <p><strong>Role:</strong> Infrastructure adapter on the consume side.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Subscribe the consumer to topics.</li>
 *   <li>Translate {@link RetriableException}s raised by {@code poll} into error results; other Kafka
 *       exceptions propagate unchanged.</li>
 *   <li>On close, seek every partition with undelivered buffered records back to the first of them, so the
 *       offsets committed by {@code close} never pass a record the loop did not dispatch.</li>
 *   <li>Close the consumer once, waiting up to five seconds.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one polling thread per source.</p>
 * <p><strong>Observability:</strong> {@link #toString()} renders the redacted client configuration.</p>
 *
 * @since 0.1.0
 */
public final class KafkaMessageSource implements MessageSource {
  private static final Logger log = LoggerFactory.getLogger(KafkaMessageSource.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Consumer<byte[], byte[]> consumer;
  private final KafkaClientConfig config;
  private Iterator<ConsumerRecord<byte[], byte[]>> buffered = Collections.emptyIterator();
  private List<String> subscribed = List.of();
  private boolean closed;

  /**
   * Creates a source backed by a new {@link KafkaConsumer}.
   *
   * @param config consumer configuration
   * @throws IllegalArgumentException if {@code config} was not built for a consumer
   */
  public KafkaMessageSource(KafkaClientConfig config) {
    this(new KafkaConsumer<>(requireConsumer(config).toProperties()), config);
  }

  KafkaMessageSource(Consumer<byte[], byte[]> consumer, KafkaClientConfig config) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.config = requireConsumer(config);
  }

  @Override
  public void subscribe(List<String> topics) {
    Objects.requireNonNull(topics, "topics");
    subscribed = List.copyOf(topics);
    consumer.subscribe(subscribed);
  }

  @Override
  public Optional<BrokerMessage> poll(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (!buffered.hasNext()) {
      ConsumerRecords<byte[], byte[]> records;
      try {
        records = consumer.poll(timeout);
      } catch (RetriableException ex) {
        log.debug("Retriable error polling {}", subscribed, ex);
        return Optional.of(BrokerMessage.failed(String.join(",", subscribed), BrokerError.from(ex, true)));
      }
      buffered = records.iterator();
    }
    if (!buffered.hasNext()) {
      return Optional.empty();
    }
    ConsumerRecord<byte[], byte[]> record = buffered.next();
    return Optional.of(
        BrokerMessage.record(record.topic(), record.partition(), record.offset(), record.key(), record.value()));
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      rewindUndelivered();
    } finally {
      buffered = Collections.emptyIterator();
      consumer.close(CLOSE_TIMEOUT);
    }
  }

  @Override
  public String toString() {
    return "KafkaMessageSource(" + config + ")";
  }

  private void rewindUndelivered() {
    Map<TopicPartition, Long> firstUndelivered = new LinkedHashMap<>();
    while (buffered.hasNext()) {
      ConsumerRecord<byte[], byte[]> record = buffered.next();
      firstUndelivered.putIfAbsent(new TopicPartition(record.topic(), record.partition()), record.offset());
    }
    if (firstUndelivered.isEmpty()) {
      return;
    }
    // Revoked partitions are redelivered to their new owner from its committed offset.
    firstUndelivered.keySet().retainAll(consumer.assignment());
    firstUndelivered.forEach(consumer::seek);
    log.debug("Rewound {} to undelivered offsets {}", subscribed, firstUndelivered);
  }

  private static KafkaClientConfig requireConsumer(KafkaClientConfig config) {
    Objects.requireNonNull(config, "config");
    if (config.role() != KafkaClientConfig.Role.CONSUMER) {
      throw new IllegalArgumentException("KafkaMessageSource requires a consumer configuration");
    }
    return config;
  }
}
