package ca.gc.cra.docrelay.application.consume;

/**
 * Thrown when {@link PollingConsumer#start(java.util.function.BooleanSupplier)} is called on a consumer
 * that has already been stopped. Consumers are single-use; construct a fresh instance instead.
 *
 * @since 0.1.0
 */
public final class AlreadyStoppedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public AlreadyStoppedException(String message) {
    super(message);
  }
}
