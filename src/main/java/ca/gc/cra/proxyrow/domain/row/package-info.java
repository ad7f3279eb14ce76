/**
 * <strong>Purpose:</strong> Row schema of a proxy-listing table: the fixed column layout and the failure raised when
 * a row does not honour it.
 * <p><strong>Concurrency:</strong> Immutable types.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxyrow.domain.row;
