/**
 * <strong>Purpose:</strong> Ports between the decode pipeline and its adapters: row decoding and metrics.
 * <p><strong>Concurrency:</strong> Implementations are shared by parallel workers and must be thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxyrow.application.port;
