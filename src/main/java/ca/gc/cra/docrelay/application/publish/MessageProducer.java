package ca.gc.cra.docrelay.application.publish;

import ca.gc.cra.docrelay.application.port.Codec;
import ca.gc.cra.docrelay.application.port.DeliveryReporter;
import ca.gc.cra.docrelay.application.port.MessageSink;
import ca.gc.cra.docrelay.application.port.MetricsPort;
import ca.gc.cra.docrelay.domain.msg.TopicMetadata;
import ca.gc.cra.docrelay.validation.Strings;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Publishes arbitrary values to one topic through a {@link MessageSink}.
 * <p><strong>Why:</strong> Keeps encoding, keying and delivery reporting in one place so
 * {@link DocumentPublisher} only adds document semantics.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Encode each value with the configured {@link Codec} and enqueue it without blocking.</li>
 *   <li>Apply the default key unless a per-call key is given.</li>
 *   <li>Route every delivery outcome to the reporter and count it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> As thread-safe as the sink; the Kafka sink is.</p>
 * <p><strong>Observability:</strong> Emits {@code producer.messages.produced}, {@code producer.delivery.succeeded}
 * and {@code producer.delivery.failed}.</p>
 *
 * @param <T> value type
 * @since 0.1.0
 */
public class MessageProducer<T> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MessageProducer.class);

  private final MessageSink sink;
  private final String topic;
  private final String key;
  private final Codec<T> codec;
  private final DeliveryReporter reporter;
  private final MetricsPort metrics;

  /**
   * Creates a producer that logs delivery outcomes and emits no metrics.
   *
   * @param sink broker sink; ownership passes to this producer
   * @param topic destination topic
   * @param key default record key; {@code null} for none
   * @param codec value encoder
   */
  public MessageProducer(MessageSink sink, String topic, String key, Codec<T> codec) {
    this(sink, topic, key, codec, DeliveryReporters.logging(), MetricsPort.NO_OP);
  }

  /**
   * Creates a producer.
   *
   * @param sink broker sink; ownership passes to this producer
   * @param topic destination topic
   * @param key default record key; {@code null} for none
   * @param codec value encoder
   * @param reporter delivery callback; {@code null} selects {@link DeliveryReporters#logging()}
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public MessageProducer(
      MessageSink sink,
      String topic,
      String key,
      Codec<T> codec,
      DeliveryReporter reporter,
      MetricsPort metrics) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.topic = Strings.sanitizeTopic(topic);
    this.key = key;
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.reporter = Objects.requireNonNullElse(reporter, DeliveryReporters.logging())
        .andThen(DeliveryReporters.counting(this.metrics));
  }

  /**
   * Enqueues a value under the default key.
   *
   * @param message value to publish
   */
  public void produce(T message) {
    produce(message, key);
  }

  /**
   * Enqueues a value under {@code recordKey} for this record only.
   *
   * @param message value to publish
   * @param recordKey record key; {@code null} means no key
   * @throws IllegalArgumentException if the codec cannot represent {@code message}
   */
  public void produce(T message, String recordKey) {
    byte[] payload = codec.encode(message);
    if (log.isDebugEnabled()) {
      log.debug("Producing {} bytes to topic {} with key {}", payload.length, topic, recordKey);
    }
    sink.produce(topic, recordKey, payload, reporter);
    metrics.increment("producer.messages.produced");
  }

  /**
   * Blocks until every enqueued record has been acknowledged or has failed.
   */
  public void flush() {
    sink.flush();
  }

  /**
   * Describes the partitions of this producer's topic.
   *
   * @return topic metadata
   */
  public TopicMetadata topicMetadata() {
    return sink.topicMetadata(topic);
  }

  public String topic() {
    return topic;
  }

  /**
   * Flushes and closes the sink.
   */
  @Override
  public void close() {
    log.debug("Closing {}", this);
    sink.close();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "(topic=" + topic
        + ", key=" + key
        + ", codec=" + codec
        + ", sink=" + sink + ")";
  }
}
