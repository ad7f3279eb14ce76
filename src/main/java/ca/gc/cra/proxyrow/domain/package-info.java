/**
 * Core domain model for proxy-listing row decoding.
 * <p><strong>Role:</strong> Row schema, proxy records, and text normalizers without markup or framework
 * dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 */
package ca.gc.cra.proxyrow.domain;
