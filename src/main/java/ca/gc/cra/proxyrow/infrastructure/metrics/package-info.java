/**
 * Metrics adapters that bridge {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; decode workers update them concurrently.
 * <p><strong>Metrics:</strong> Publishes the {@code decode.*} namespace. Row markup is never exported.
 */
package ca.gc.cra.proxyrow.infrastructure.metrics;
