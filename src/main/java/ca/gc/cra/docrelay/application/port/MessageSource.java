package ca.gc.cra.docrelay.application.port;

import ca.gc.cra.docrelay.domain.msg.BrokerMessage;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Consumer-side broker port yielding one poll result at a time.
 * <p><strong>Why:</strong> Isolates the polling loop from Kafka client batching, rebalancing and offset handling.</p>
 * <p><strong>Role:</strong> Port implemented by {@code KafkaMessageSource}; owned exclusively by one polling consumer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Subscribe to topics.</li>
 *   <li>Return the next record, a broker error result, or nothing when the poll timed out.</li>
 *   <li>Release the broker connection on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call from the polling thread only.</p>
 *
 * @since 0.1.0
 */
public interface MessageSource extends AutoCloseable {

  /**
   * Subscribes to the given topics, replacing any previous subscription.
   *
   * @param topics topic names; must not be empty
   */
  void subscribe(List<String> topics);

  /**
   * Blocks for at most {@code timeout} waiting for the next poll result.
   *
   * @param timeout maximum wait; must not be {@code null} or negative
   * @return next record or error result; empty when nothing arrived in time
   */
  Optional<BrokerMessage> poll(Duration timeout);

  /**
   * Closes the underlying broker connection. Implementations tolerate repeated calls.
   */
  @Override
  void close();
}
