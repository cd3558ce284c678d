package ca.gc.cra.docrelay.application.port;

/**
 * <strong>What:</strong> Port converting in-memory values to and from broker payload bytes.
 * <p><strong>Why:</strong> Keeps the wire format (JSON, MessagePack, ...) a construction-time choice of
 * publishers and consumers.</p>
 * <p><strong>Role:</strong> Strategy injected into producers and polling consumers.</p>
 * <p><strong>Contract:</strong> {@code decode(encode(v)).equals(v)} for every value the format can represent.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be stateless or thread-safe; a single codec may be
 * shared by a publisher and a consumer.</p>
 *
 * @param <T> value type carried in payloads
 * @since 0.1.0
 */
public interface Codec<T> {

  /**
   * Serializes a value.
   *
   * @param value value to encode; must not be {@code null}
   * @return encoded payload
   * @throws IllegalArgumentException if the value contains types the format cannot represent
   */
  byte[] encode(T value);

  /**
   * Deserializes a payload.
   *
   * @param payload raw payload bytes; must not be {@code null}
   * @return decoded value
   * @throws DecodeException if the payload is malformed
   */
  T decode(byte[] payload);
}
