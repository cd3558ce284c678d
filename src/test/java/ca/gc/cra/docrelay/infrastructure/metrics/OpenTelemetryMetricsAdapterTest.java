package ca.gc.cra.docrelay.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttributeAndServiceResource() {
    adapter.increment("consumer.messages.dispatched");
    adapter.increment("consumer.messages.dispatched");
    adapter.increment("consumer.messages.dispatched");
    adapter.forceFlush();

    MetricData counter = metric(reader.collectAllMetrics(), "consumer.messages.dispatched");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("consumer.messages.dispatched",
        point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));

    assertEquals("docrelay", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
    assertEquals(OpenTelemetryBootstrap.INSTRUMENTATION_SCOPE, counter.getInstrumentationScopeInfo().getName());
  }

  @Test
  void observeRecordsNanosecondHistogram() {
    adapter.observe("consumer.dispatch.latencyNanos", 1_000L);
    adapter.observe("consumer.dispatch.latencyNanos", 3_000L);
    adapter.forceFlush();

    MetricData histogram = metric(reader.collectAllMetrics(), "consumer.dispatch.latencynanos");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ns", histogram.getUnit());

    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
    assertEquals("consumer.dispatch.latencyNanos",
        point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("producer.delivery.failed", OpenTelemetryMetricsAdapter.sanitizeName("producer.delivery.failed"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitizeName("a b"));
    assertEquals("docrelay.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  private static MetricData metric(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("Expected metric " + name + " to be exported"));
  }
}
