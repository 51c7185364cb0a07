/**
 * Core domain model: configuration trees, bus events and decoded frames.
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 */
package ca.gc.cra.nfcrx.domain;
