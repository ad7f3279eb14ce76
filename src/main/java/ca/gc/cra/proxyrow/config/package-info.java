/**
 * <strong>Purpose:</strong> Decode pipeline configuration and its YAML loader.
 * <p><strong>Concurrency:</strong> Configuration values are immutable; loaders are stateless.
 * <p><strong>Observability:</strong> Invalid values raise {@link java.lang.IllegalArgumentException} naming the key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxyrow.config;
