package ca.gc.cra.docrelay.application.port;

import ca.gc.cra.docrelay.domain.msg.TopicMetadata;

/**
 * <strong>What:</strong> Producer-side broker port that enqueues payloads for asynchronous delivery.
 * <p><strong>Why:</strong> Lets publishers apply codecs and keys without binding to Kafka producer types.</p>
 * <p><strong>Role:</strong> Port implemented by {@code KafkaMessageSink}; owned by one producer.</p>
 * <p><strong>Thread-safety:</strong> Mirrors the underlying client; the Kafka producer is thread-safe.</p>
 * <p><strong>Observability:</strong> Outcomes surface through the {@link DeliveryReporter} given to
 * {@link #produce(String, String, byte[], DeliveryReporter)}.</p>
 *
 * @since 0.1.0
 */
public interface MessageSink extends AutoCloseable {

  /**
   * Enqueues a payload without waiting for acknowledgement.
   *
   * @param topic destination topic
   * @param key routing key; {@code null} removes per-key ordering
   * @param value encoded payload
   * @param reporter callback invoked once with the delivery outcome
   */
  void produce(String topic, String key, byte[] value, DeliveryReporter reporter);

  /**
   * Blocks until every previously enqueued payload has been acknowledged or has failed.
   */
  void flush();

  /**
   * Looks up partition metadata for a topic.
   *
   * @param topic topic to describe
   * @return partition layout as reported by the cluster
   */
  TopicMetadata topicMetadata(String topic);

  /**
   * Flushes outstanding payloads and releases the broker connection.
   */
  @Override
  void close();
}
