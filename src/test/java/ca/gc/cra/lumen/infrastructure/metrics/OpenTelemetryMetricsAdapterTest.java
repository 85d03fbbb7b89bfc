package ca.gc.cra.lumen.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
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
    adapter = OpenTelemetryMetricsAdapter.withReader(reader);
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("attach.connect.attempts");
    adapter.increment("attach.connect.attempts");
    adapter.increment("attach.connect.attempts");

    MetricData counter = metric(reader.collectAllMetrics(), "attach.connect.attempts");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("attach.connect.attempts", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY));
    assertEquals("lumen", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("attach.latencyMillis", 120);
    adapter.observe("attach.latencyMillis", 80);

    MetricData histogram = metric(reader.collectAllMetrics(), "attach.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(200.0, point.getSum());
  }

  @Test
  void sanitizeProducesValidInstrumentNames() {
    assertEquals("transport.parse.error", OpenTelemetryMetricsAdapter.sanitize("transport.parse.error"));
    assertEquals("m1st_key", OpenTelemetryMetricsAdapter.sanitize("1st key"));
    assertEquals("lumen.metric", OpenTelemetryMetricsAdapter.sanitize(" "));
  }

  @Test
  void disabledSettingsYieldNoopAdapter() {
    OpenTelemetryMetricsAdapter noop = OpenTelemetryMetricsAdapter.create(TelemetrySettings.disabled());

    noop.increment("transport.messages.received");
    noop.flush();
    noop.close();

    assertTrue(noop.isNoop());
    assertFalse(adapter.isNoop());
  }

  private static MetricData metric(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }
}
