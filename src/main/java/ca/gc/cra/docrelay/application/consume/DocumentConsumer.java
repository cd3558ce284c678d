package ca.gc.cra.docrelay.application.consume;

import ca.gc.cra.docrelay.application.port.Codec;
import ca.gc.cra.docrelay.application.port.MessageSource;
import ca.gc.cra.docrelay.application.port.MetricsPort;
import ca.gc.cra.docrelay.domain.doc.Document;
import ca.gc.cra.docrelay.logging.Logs;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polling consumer that redelivers {@code (name, document)} pairs to a {@link DocumentHandler}.
 *
 * <p>Carries no state beyond {@link PollingConsumer}; the codec produces {@link Document}s and each one is
 * handed on as {@code handler.handle(consumer, topic, name, payload)}.</p>
 *
 * <pre>{@code
 * DocumentConsumer consumer = new DocumentConsumer(source, List.of("runs"), DocumentCodec.msgpack(),
 *     (c, topic, name, doc) -> log.info("{} {}", name, doc));
 * consumer.start(Continuations.untilFirstStop(received));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class DocumentConsumer extends PollingConsumer<Document> {
  private static final Logger log = LoggerFactory.getLogger(DocumentConsumer.class);
  private static final int LOGGED_DOCUMENT_BYTES = 1_024;

  public DocumentConsumer(
      MessageSource source, List<String> topics, Codec<Document> codec, DocumentHandler handler) {
    this(source, topics, codec, handler, DEFAULT_POLL_TIMEOUT, MetricsPort.NO_OP);
  }

  public DocumentConsumer(
      MessageSource source,
      List<String> topics,
      Codec<Document> codec,
      DocumentHandler handler,
      Duration pollTimeout,
      MetricsPort metrics) {
    super(source, topics, codec, redeliver(handler), pollTimeout, metrics);
  }

  private static MessageHandler<Document> redeliver(DocumentHandler handler) {
    Objects.requireNonNull(handler, "handler");
    return (consumer, topic, document) -> {
      if (log.isDebugEnabled()) {
        log.debug("Redelivering document from topic {} name: {} doc: {}",
            topic, document.name(), Logs.truncate(String.valueOf(document.payload()), LOGGED_DOCUMENT_BYTES));
      }
      handler.handle(consumer, topic, document.name(), document.payload());
    };
  }
}
