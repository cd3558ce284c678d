package ca.gc.cra.docrelay.application.publish;

import ca.gc.cra.docrelay.application.port.DeliveryReporter;
import ca.gc.cra.docrelay.application.port.MetricsPort;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stock {@link DeliveryReporter}s.
 *
 * @since 0.1.0
 */
public final class DeliveryReporters {
  private static final Logger log = LoggerFactory.getLogger(DeliveryReporters.class);

  private static final DeliveryReporter LOGGING = report -> {
    if (report.succeeded()) {
      log.debug("Message delivered to topic {} [partition {}] at offset {}",
          report.topic(), report.partition(), report.offset());
    } else {
      log.error("Message delivery to topic {} failed: {}",
          report.topic(), report.error().map(Exception::toString).orElse("unknown"));
    }
  };

  private DeliveryReporters() {
    // Utility
  }

  /**
   * Default reporter: failures at ERROR with the cause, successes at DEBUG with topic and partition.
   *
   * @return logging reporter
   */
  public static DeliveryReporter logging() {
    return LOGGING;
  }

  /**
   * Reporter that counts {@code producer.delivery.succeeded} and {@code producer.delivery.failed}.
   *
   * @param metrics metrics sink
   * @return counting reporter
   */
  public static DeliveryReporter counting(MetricsPort metrics) {
    Objects.requireNonNull(metrics, "metrics");
    return report -> metrics.increment(
        report.succeeded() ? "producer.delivery.succeeded" : "producer.delivery.failed");
  }
}
