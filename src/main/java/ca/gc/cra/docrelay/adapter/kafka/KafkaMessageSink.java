package ca.gc.cra.docrelay.adapter.kafka;

import ca.gc.cra.docrelay.application.port.DeliveryReporter;
import ca.gc.cra.docrelay.application.port.MessageSink;
import ca.gc.cra.docrelay.config.KafkaClientConfig;
import ca.gc.cra.docrelay.domain.msg.DeliveryReport;
import ca.gc.cra.docrelay.domain.msg.TopicMetadata;
import ca.gc.cra.docrelay.domain.msg.TopicMetadata.PartitionMetadata;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.PartitionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka-backed {@link MessageSink}.
 * <p><strong>Role:</strong> Infrastructure adapter on the publish side.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Send keyed records and translate producer callbacks into {@link DeliveryReport}s.</li>
 *   <li>Describe topic partitions via {@link Producer#partitionsFor(String)}.</li>
 *   <li>Flush and close the producer during shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; {@link KafkaProducer} is thread-safe.
 * Delivery reporters run on the producer I/O thread.</p>
 *
 * @since 0.1.0
 */
public final class KafkaMessageSink implements MessageSink {
  private static final Logger log = LoggerFactory.getLogger(KafkaMessageSink.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Producer<String, byte[]> producer;
  private final KafkaClientConfig config;
  private volatile boolean closed;

  /**
   * Creates a sink backed by a new {@link KafkaProducer}.
   *
   * @param config producer configuration
   * @throws IllegalArgumentException if {@code config} was not built for a producer
   */
  public KafkaMessageSink(KafkaClientConfig config) {
    this(new KafkaProducer<>(requireProducer(config).toProperties()), config);
  }

  KafkaMessageSink(Producer<String, byte[]> producer, KafkaClientConfig config) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.config = requireProducer(config);
  }

  @Override
  public void produce(String topic, String key, byte[] value, DeliveryReporter reporter) {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(reporter, "reporter");
    producer.send(new ProducerRecord<>(topic, key, value),
        (metadata, exception) -> reporter.onDelivery(toReport(topic, metadata, exception)));
  }

  @Override
  public void flush() {
    producer.flush();
  }

  @Override
  public TopicMetadata topicMetadata(String topic) {
    Objects.requireNonNull(topic, "topic");
    List<PartitionInfo> infos = producer.partitionsFor(topic);
    List<PartitionMetadata> partitions = new ArrayList<>();
    if (infos != null) {
      for (PartitionInfo info : infos) {
        partitions.add(new PartitionMetadata(info.partition(), nodeId(info.leader()), replicaIds(info.replicas())));
      }
    }
    partitions.sort(Comparator.comparingInt(PartitionMetadata::id));
    return new TopicMetadata(topic, partitions);
  }

  /**
   * Flushes pending records and closes the producer, waiting up to five seconds. Repeated calls are no-ops.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    log.debug("Closing {}", this);
    producer.flush();
    producer.close(CLOSE_TIMEOUT);
  }

  @Override
  public String toString() {
    return "KafkaMessageSink(" + config + ")";
  }

  private static DeliveryReport toReport(String topic, RecordMetadata metadata, Exception exception) {
    if (exception != null) {
      int partition = metadata == null ? -1 : metadata.partition();
      return DeliveryReport.failed(topic, partition, exception);
    }
    return DeliveryReport.delivered(metadata.topic(), metadata.partition(), metadata.offset());
  }

  private static int nodeId(Node node) {
    return node == null || node.isEmpty() ? -1 : node.id();
  }

  private static List<Integer> replicaIds(Node[] replicas) {
    if (replicas == null) {
      return List.of();
    }
    List<Integer> ids = new ArrayList<>(replicas.length);
    for (Node replica : replicas) {
      ids.add(replica.id());
    }
    return ids;
  }

  private static KafkaClientConfig requireProducer(KafkaClientConfig config) {
    Objects.requireNonNull(config, "config");
    if (config.role() != KafkaClientConfig.Role.PRODUCER) {
      throw new IllegalArgumentException("KafkaMessageSink requires a producer configuration");
    }
    return config;
  }
}
