/**
 * <strong>Purpose:</strong> jsoup adapters that decode proxy-listing rows: cell location, address deobfuscation,
 * and per-column normalization.
 * <p><strong>Pipeline role:</strong> Implements the {@code RowDecoder} port used by the batch decode use case.
 * <p><strong>Concurrency:</strong> Adapters are stateless between calls; rows must not be mutated while decoded.
 * <p><strong>Security:</strong> Markup is adversarial; nothing here throws on malformed content except for missing
 * cells.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxyrow.infrastructure.html;
