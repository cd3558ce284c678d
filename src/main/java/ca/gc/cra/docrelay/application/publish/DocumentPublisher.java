package ca.gc.cra.docrelay.application.publish;

import ca.gc.cra.docrelay.application.port.Codec;
import ca.gc.cra.docrelay.application.port.DeliveryReporter;
import ca.gc.cra.docrelay.application.port.MessageSink;
import ca.gc.cra.docrelay.application.port.MetricsPort;
import ca.gc.cra.docrelay.domain.doc.Document;
import ca.gc.cra.docrelay.domain.doc.DocumentName;
import java.util.Map;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes {@code (name, document)} pairs to a topic.
 *
 * <p>Implements {@link BiConsumer} so it can be subscribed directly to a document stream. With
 * {@code flushOnStop} set, publishing a {@code stop} document blocks until every enqueued record of the run
 * has been acknowledged or has failed.</p>
 *
 * <pre>{@code
 * try (DocumentPublisher publisher = new DocumentPublisher(
 *     new KafkaMessageSink(KafkaClientConfig.producer("kafka:9092", Map.of())),
 *     "runs", "beamline-7", DocumentCodec.msgpack(), DeliveryReporters.logging(), true, MetricsPort.NO_OP)) {
 *   publisher.publish("start", Map.of("uid", "abc"));
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class DocumentPublisher extends MessageProducer<Document>
    implements BiConsumer<String, Map<String, Object>> {
  private static final Logger log = LoggerFactory.getLogger(DocumentPublisher.class);

  private final boolean flushOnStop;

  public DocumentPublisher(MessageSink sink, String topic, String key, Codec<Document> codec) {
    this(sink, topic, key, codec, DeliveryReporters.logging(), false, MetricsPort.NO_OP);
  }

  /**
   * Creates a document publisher.
   *
   * @param sink broker sink; ownership passes to this publisher
   * @param topic destination topic
   * @param key default record key; {@code null} for none
   * @param codec document encoder
   * @param reporter delivery callback; {@code null} selects {@link DeliveryReporters#logging()}
   * @param flushOnStop flush after every {@code stop} document
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public DocumentPublisher(
      MessageSink sink,
      String topic,
      String key,
      Codec<Document> codec,
      DeliveryReporter reporter,
      boolean flushOnStop,
      MetricsPort metrics) {
    super(sink, topic, key, codec, reporter, metrics);
    this.flushOnStop = flushOnStop;
  }

  /**
   * Publishes a document under the default key.
   *
   * @param name document name such as {@code start} or {@code event}
   * @param document document body
   */
  public void publish(String name, Map<String, Object> document) {
    publish(new Document(name, document), null, false);
  }

  /**
   * Publishes a document under {@code key} for this record only.
   *
   * @param name document name
   * @param document document body
   * @param key record key; {@code null} means no key
   */
  public void publish(String name, Map<String, Object> document, String key) {
    publish(new Document(name, document), key, true);
  }

  public void publish(Document document) {
    publish(document, null, false);
  }

  @Override
  public void accept(String name, Map<String, Object> document) {
    publish(name, document);
  }

  public boolean flushOnStop() {
    return flushOnStop;
  }

  private void publish(Document document, String key, boolean keyed) {
    if (keyed) {
      produce(document, key);
    } else {
      produce(document);
    }
    if (flushOnStop && document.is(DocumentName.STOP)) {
      log.debug("Flushing topic {} after stop document", topic());
      flush();
    }
  }
}
