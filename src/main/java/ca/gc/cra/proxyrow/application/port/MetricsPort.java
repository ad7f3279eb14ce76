package ca.gc.cra.proxyrow.application.port;

/**
 * <strong>What:</strong> Port abstracting decode metrics emission.
 * <p><strong>Why:</strong> Lets the batch pipeline count decoded, skipped, and invalid rows without binding to a
 * vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from decoding workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract ({@code decode.rows.decoded},
 * {@code decode.rows.skipped}, {@code decode.rows.invalidIp}, {@code decode.batch.latencyNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code decode.rows.skipped}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram or gauge style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, row counts)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
