/**
 * <strong>Purpose:</strong> Batch decoding of listing rows into proxy records.
 * <p><strong>Pipeline role:</strong> Sits between the caller that located the rows and the {@code RowDecoder}
 * adapter.
 * <p><strong>Concurrency:</strong> Optional worker pool per batch; results keep input order.
 * <p><strong>Observability:</strong> Emits {@code decode.*} metrics through {@code MetricsPort} and SLF4J logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxyrow.application.pipeline;
