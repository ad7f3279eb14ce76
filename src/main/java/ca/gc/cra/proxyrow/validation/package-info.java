/**
 * <strong>Purpose:</strong> Validation helpers for configuration values.
 * <p><strong>Concurrency:</strong> Stateless; thread-safe.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxyrow.validation;
