package ca.gc.cra.lumen.infrastructure.transport;

import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.application.port.Transporter;
import ca.gc.cra.lumen.application.port.TransporterFactory;
import ca.gc.cra.lumen.infrastructure.json.JsonSupport;
import java.time.Duration;
import java.util.Objects;

/**
 * Creates {@link EmmySocketTransporter} instances for the attach workflow's connect loop.
 *
 * @since 0.1.0
 */
public final class EmmyTransporterFactory implements TransporterFactory {
  private final Duration connectTimeout;
  private final JsonSupport json;
  private final MetricsPort metrics;

  public EmmyTransporterFactory(Duration connectTimeout, JsonSupport json, MetricsPort metrics) {
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  @Override
  public Transporter create(String host, int port) {
    return new EmmySocketTransporter(host, port, connectTimeout, json, metrics);
  }
}
