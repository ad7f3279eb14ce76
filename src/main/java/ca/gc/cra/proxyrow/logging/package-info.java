/**
 * <strong>Purpose:</strong> Logging utilities that keep page markup readable and bounded in log lines.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from concurrent workers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxyrow.logging;
