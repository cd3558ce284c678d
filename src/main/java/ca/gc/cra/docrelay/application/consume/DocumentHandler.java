package ca.gc.cra.docrelay.application.consume;

import ca.gc.cra.docrelay.domain.doc.Document;
import java.util.Map;

/**
 * Receives redelivered documents as {@code (name, document)} pairs.
 *
 * <p>Same threading and failure rules as {@link MessageHandler}.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DocumentHandler {

  /**
   * Processes one document.
   *
   * @param consumer consumer that polled the document
   * @param topic topic the document was read from
   * @param name document name such as {@code start}, {@code event} or {@code stop}
   * @param document document body; unmodifiable
   */
  void handle(PollingConsumer<Document> consumer, String topic, String name, Map<String, Object> document);
}
