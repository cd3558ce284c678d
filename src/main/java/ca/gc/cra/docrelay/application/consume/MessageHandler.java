package ca.gc.cra.docrelay.application.consume;

/**
 * Receives each decoded message on the polling thread.
 *
 * <p>Handlers run synchronously inside the poll loop; a handler that blocks stalls polling. A handler
 * may call {@link PollingConsumer#stop()} to end the loop after it returns. Exceptions thrown here stop
 * the consumer and propagate to the caller of {@code start}.</p>
 *
 * @param <T> decoded message type
 * @since 0.1.0
 */
@FunctionalInterface
public interface MessageHandler<T> {

  /**
   * Processes one decoded message.
   *
   * @param consumer consumer that polled the message
   * @param topic topic the message was read from
   * @param message decoded payload
   */
  void handle(PollingConsumer<T> consumer, String topic, T message);
}
