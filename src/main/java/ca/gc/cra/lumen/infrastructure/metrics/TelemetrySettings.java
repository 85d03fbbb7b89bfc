package ca.gc.cra.lumen.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Exporter selection for LUMEN metrics.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param exportInterval periodic export interval
 * @since 0.1.0
 */
public record TelemetrySettings(String exporter, String endpoint, Duration exportInterval) {
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank() ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("none") && !exporter.equals("otlp")) {
      throw new IllegalArgumentException("metrics exporter must be otlp or none (was " + exporter + ")");
    }
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    exportInterval = Objects.requireNonNullElse(exportInterval, Duration.ofSeconds(30));
  }

  /** Metrics disabled. */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", null, null);
  }

  /**
   * Reads {@code otel.metrics.exporter}/{@code OTEL_METRICS_EXPORTER} and
   * {@code otel.exporter.otlp.endpoint}/{@code OTEL_EXPORTER_OTLP_ENDPOINT}; system properties win.
   *
   * @param fallbackExporter exporter used when neither is set
   * @return settings
   */
  public static TelemetrySettings fromEnvironment(String fallbackExporter) {
    String exporter = firstNonBlank(
        System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), fallbackExporter);
    String endpoint = firstNonBlank(
        System.getProperty("otel.exporter.otlp.endpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
        DEFAULT_ENDPOINT);
    return new TelemetrySettings(exporter, endpoint, null);
  }

  public boolean enabled() {
    return exporter.equals("otlp");
  }

  private static String firstNonBlank(String first, String second, String fallback) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return fallback;
  }
}
