package ca.gc.cra.docrelay.application.publish;

import ca.gc.cra.docrelay.application.port.DeliveryReporter;
import ca.gc.cra.docrelay.domain.msg.DeliveryReport;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Accumulates delivery outcomes so callers can inspect them after {@code flush()}.
 *
 * <p>Counts are updated from the producer I/O thread; once {@code flush()} has returned every record
 * produced before it has been counted.</p>
 *
 * @since 0.1.0
 */
public final class DeliveryTally implements DeliveryReporter {
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicReference<Exception> lastFailure = new AtomicReference<>();

  @Override
  public void onDelivery(DeliveryReport report) {
    if (report.succeeded()) {
      delivered.incrementAndGet();
      return;
    }
    failed.incrementAndGet();
    report.error().ifPresent(lastFailure::set);
  }

  public long delivered() {
    return delivered.get();
  }

  public long failed() {
    return failed.get();
  }

  /**
   * Returns the most recent delivery failure.
   *
   * @return last failure, or empty when every delivery succeeded
   */
  public Optional<Exception> lastFailure() {
    return Optional.ofNullable(lastFailure.get());
  }

  @Override
  public String toString() {
    return "DeliveryTally(delivered=" + delivered.get() + ", failed=" + failed.get() + ")";
  }
}
