/**
 * Executor helpers for parallel row decoding.
 * <p><strong>Concurrency:</strong> Pools are owned and shut down by their caller.
 */
package ca.gc.cra.proxyrow.infrastructure.exec;
