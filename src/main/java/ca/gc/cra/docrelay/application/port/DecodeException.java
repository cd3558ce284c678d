package ca.gc.cra.docrelay.application.port;

/**
 * Signals a payload that a {@link Codec} could not decode.
 *
 * <p>Polling consumers treat this as unrecovered: the loop stops, the broker connection is released
 * and the exception reaches the caller of {@code start}.</p>
 *
 * @since 0.1.0
 */
public final class DecodeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
