package ca.gc.cra.docrelay.application.consume;

import ca.gc.cra.docrelay.domain.doc.Document;
import ca.gc.cra.docrelay.domain.doc.DocumentName;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Ready-made continuation predicates for {@link PollingConsumer#start(BooleanSupplier)}.
 *
 * <p>The predicates read collections that the caller's handler fills, so they observe exactly what was
 * dispatched. Callers must not mutate those collections from other threads while the loop runs.</p>
 *
 * @since 0.1.0
 */
public final class Continuations {

  private Continuations() {
    // Utility
  }

  /**
   * Never ends the loop; only {@link PollingConsumer#stop()}, a stop request or a fault will.
   *
   * @return predicate that always returns {@code true}
   */
  public static BooleanSupplier forever() {
    return () -> true;
  }

  /**
   * Continues until {@code received} holds at least {@code expected} elements.
   *
   * @param received collection the handler appends to
   * @param expected number of messages to wait for; must be positive
   * @return continuation predicate
   * @throws IllegalArgumentException if {@code expected} is not positive
   */
  public static BooleanSupplier untilCount(Collection<?> received, int expected) {
    Objects.requireNonNull(received, "received");
    if (expected <= 0) {
      throw new IllegalArgumentException("expected was " + expected + ", but must be greater than 0");
    }
    return () -> received.size() < expected;
  }

  /**
   * Continues until a {@code stop} document appears in {@code received}.
   *
   * <p>Each call inspects only the documents appended since the previous call, and the result stays
   * {@code false} once a stop has been seen.</p>
   *
   * @param received documents the handler appends to
   * @return continuation predicate
   */
  public static BooleanSupplier untilFirstStop(List<Document> received) {
    Objects.requireNonNull(received, "received");
    int[] scanned = {0};
    boolean[] stopped = {false};
    return () -> {
      while (!stopped[0] && scanned[0] < received.size()) {
        stopped[0] = received.get(scanned[0]++).is(DocumentName.STOP);
      }
      return !stopped[0];
    };
  }
}
