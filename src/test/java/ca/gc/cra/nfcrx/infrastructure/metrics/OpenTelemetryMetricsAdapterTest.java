package ca.gc.cra.nfcrx.infrastructure.metrics;

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
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttributeAndResource() {
    adapter.increment("loop.command.configure");
    adapter.increment("loop.command.configure");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "loop.command.configure");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("loop.command.configure", point.getAttributes().get(AttributeKey.stringKey("rx.metric.key")));
    assertEquals("nfc-rx", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("loop.frames.batch", 6);
    adapter.observe("loop.frames.batch", 4);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "loop.frames.batch");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(10.0, point.getSum());
  }

  @Test
  void sanitizeKeepsInstrumentNamesValid() {
    assertEquals("loop.tick", OpenTelemetryMetricsAdapter.sanitize("Loop.Tick"));
    assertEquals("m9_frames", OpenTelemetryMetricsAdapter.sanitize("9 frames"));
    assertEquals("rx.metric", OpenTelemetryMetricsAdapter.sanitize("  "));
  }

  @Test
  void noneExporterRunsInNoopMode() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter("none", null)) {
      noop.increment("loop.tick");
      assertTrue(noop.isNoop());
    }
    assertFalse(adapter.isNoop());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }
}
