package ca.gc.cra.docrelay.application.publish;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docrelay.domain.msg.DeliveryReport;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DeliveryReportersTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level previousLevel;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(DeliveryReporters.class);
    previousLevel = logger.getLevel();
    logger.setLevel(Level.DEBUG);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    logger.setLevel(previousLevel);
    appender.stop();
  }

  @Test
  void loggingReporterLogsFailuresAtError() {
    DeliveryReporters.logging().onDelivery(
        DeliveryReport.failed("runs", 0, new IllegalStateException("no leader")));

    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.ERROR, event.getLevel());
    assertTrue(event.getFormattedMessage().contains("runs"));
    assertTrue(event.getFormattedMessage().contains("no leader"));
  }

  @Test
  void loggingReporterLogsSuccessAtDebugWithPartition() {
    DeliveryReporters.logging().onDelivery(DeliveryReport.delivered("runs", 3, 42L));

    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.DEBUG, event.getLevel());
    assertEquals("Message delivered to topic runs [partition 3] at offset 42", event.getFormattedMessage());
  }

  @Test
  void countingReporterSplitsOutcomes() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    DeliveryReporters.counting(metrics).onDelivery(DeliveryReport.delivered("runs", 0, 1L));
    DeliveryReporters.counting(metrics).onDelivery(
        DeliveryReport.failed("runs", 0, new RuntimeException("x")));

    assertEquals(1, metrics.count("producer.delivery.succeeded"));
    assertEquals(1, metrics.count("producer.delivery.failed"));
  }
}
