/**
 * <strong>Purpose:</strong> Proxy-server value objects decoded from listing rows.
 * <p><strong>Concurrency:</strong> Immutable; safe to share across decoding workers.
 * <p><strong>Security:</strong> Address validity is a shape check only; callers must verify
 * {@link ca.gc.cra.proxyrow.domain.proxy.ProxyRecord#valid()} before trusting an address.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxyrow.domain.proxy;
