package ca.gc.cra.lumen.application.port;

/**
 * <strong>What:</strong> Port abstracting LUMEN metrics emission.
 * <p><strong>Why:</strong> Transporters, the attach workflow and sessions record counters and latencies without
 * binding to a vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from receive loops,
 * session drivers and attach workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g. {@code transport.parse.error},
 * {@code attach.connect.attempts}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g. milliseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
