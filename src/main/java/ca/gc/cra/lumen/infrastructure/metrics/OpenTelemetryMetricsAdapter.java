package ca.gc.cra.lumen.infrastructure.metrics;

import ca.gc.cra.lumen.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by an OpenTelemetry SDK meter provider.
 * <p><strong>Why:</strong> Transport and attach counters can be exported over OTLP without the application layer
 * knowing about OpenTelemetry.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.lumen";
  static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("lumen.metric.key");
  private static final String FALLBACK_NAME = "lumen.metric";

  private final Meter meter;
  private final SdkMeterProvider provider;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  private OpenTelemetryMetricsAdapter(Meter meter, SdkMeterProvider provider) {
    this.meter = Objects.requireNonNull(meter, "meter");
    this.provider = provider;
  }

  /**
   * Builds an adapter for the given settings; falls back to a noop meter when disabled or when the SDK
   * cannot be initialized.
   *
   * @param settings exporter settings
   * @return adapter
   */
  public static OpenTelemetryMetricsAdapter create(TelemetrySettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (!settings.enabled()) {
      log.debug("OpenTelemetry metrics disabled");
      return noop();
    }
    try {
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder()
          .setEndpoint(settings.endpoint())
          .build();
      MetricReader reader = PeriodicMetricReader.builder(exporter)
          .setInterval(settings.exportInterval())
          .build();
      OpenTelemetryMetricsAdapter adapter = withReader(reader);
      log.info("OpenTelemetry metrics exporting to {}", settings.endpoint());
      return adapter;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return noop();
    }
  }

  /**
   * Adapter reading into the supplied reader, e.g. an in-memory reader in tests.
   *
   * @param reader metric reader
   * @return adapter
   */
  public static OpenTelemetryMetricsAdapter withReader(MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
        AttributeKey.stringKey("service.name"), "lumen",
        AttributeKey.stringKey("service.namespace"), "ca.gc.cra",
        AttributeKey.stringKey("service.version"), serviceVersion())));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(serviceVersion())
        .build();
    return new OpenTelemetryMetricsAdapter(meter, provider);
  }

  static OpenTelemetryMetricsAdapter noop() {
    return new OpenTelemetryMetricsAdapter(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1, Attributes.of(METRIC_KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::createHistogram).record(value, Attributes.of(METRIC_KEY, key));
  }

  public boolean isNoop() {
    return provider == null;
  }

  /** Flushes pending exports, waiting up to five seconds. */
  public void flush() {
    if (provider == null) {
      return;
    }
    CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
    if (!result.isSuccess()) {
      log.warn("OpenTelemetry metrics flush did not complete within timeout");
    }
  }

  @Override
  public void close() {
    if (provider == null) {
      return;
    }
    CompletableResultCode result = provider.shutdown().join(5, TimeUnit.SECONDS);
    if (!result.isSuccess()) {
      log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
    }
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(sanitize(key))
        .setUnit("1")
        .setDescription("LUMEN counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(sanitize(key))
        .ofLongs()
        .setDescription("LUMEN observation for " + key)
        .build();
  }

  static String sanitize(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder out = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      out.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      out.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return out.toString();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryMetricsAdapter.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }
}
