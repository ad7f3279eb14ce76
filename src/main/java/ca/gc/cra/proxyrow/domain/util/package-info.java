/**
 * Domain utility classes for normalizing listing text.
 * <p><strong>Role:</strong> Field normalizers reused by row decoders.</p>
 * <p><strong>Concurrency:</strong> Utilities are stateless; safe to call concurrently.</p>
 * <p><strong>Security:</strong> Inputs are untrusted page text; helpers never throw on malformed content.</p>
 */
package ca.gc.cra.proxyrow.domain.util;
