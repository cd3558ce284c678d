package ca.gc.cra.docrelay.domain.msg;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One poll result delivered by a broker source: either a record or a broker-reported error.
 * <p><strong>Why:</strong> Lets the polling loop classify results without depending on Kafka client types.</p>
 * <p><strong>Role:</strong> Domain value produced by {@link ca.gc.cra.docrelay.application.port.MessageSource}
 * adapters and consumed by the polling consumer.</p>
 * <p><strong>Thread-safety:</strong> Immutable reference holder; byte arrays are shared and must not be mutated.</p>
 * <p><strong>Performance:</strong> No copies are taken of {@code key} or {@code value}.</p>
 * <p><strong>Observability:</strong> {@link #topic()} and {@link #partition()} are safe to log; payload bytes are not.</p>
 *
 * @param topic topic the record was read from; never {@code null}
 * @param partition partition index, or {@code -1} when unknown (error results)
 * @param offset record offset, or {@code -1} when unknown
 * @param key record key bytes; {@code null} when the producer sent no key
 * @param value record value bytes; empty for error results
 * @param error broker-reported error; present only for error results
 * @since 0.1.0
 */
public record BrokerMessage(
    String topic,
    int partition,
    long offset,
    byte[] key,
    byte[] value,
    Optional<BrokerError> error) {

  private static final byte[] EMPTY = new byte[0];

  /**
   * Normalizes {@code null} values.
   */
  public BrokerMessage {
    Objects.requireNonNull(topic, "topic");
    value = value == null ? EMPTY : value;
    error = Objects.requireNonNullElse(error, Optional.empty());
  }

  /**
   * Creates a successful record result.
   *
   * @param topic source topic
   * @param partition source partition
   * @param offset record offset
   * @param key key bytes; may be {@code null}
   * @param value value bytes
   * @return record result
   */
  public static BrokerMessage record(String topic, int partition, long offset, byte[] key, byte[] value) {
    return new BrokerMessage(topic, partition, offset, key, value, Optional.empty());
  }

  /**
   * Creates an error result that carries no payload.
   *
   * @param topic topic the error relates to, or an empty string when the client did not say
   * @param error broker error details
   * @return error result
   */
  public static BrokerMessage failed(String topic, BrokerError error) {
    return new BrokerMessage(topic, -1, -1L, null, EMPTY, Optional.of(Objects.requireNonNull(error, "error")));
  }

  /**
   * Indicates whether the broker reported an error for this poll.
   *
   * @return {@code true} for error results
   */
  public boolean hasError() {
    return error.isPresent();
  }
}
