package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Port abstracting BEACON metrics emission.
 * <p><strong>Why:</strong> Lets configuration resolution record counters and latencies without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and
 * embedded use.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent resolutions.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code config.resolve.latencyNanos}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code config.resolve.failures}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
