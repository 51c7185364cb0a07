/**
 * Named publish/subscribe channels with synchronous, fault-isolated delivery.
 * <p><strong>Concurrency:</strong> Publishing and subscribing are safe from any thread; callbacks run on the publisher's thread.</p>
 */
package ca.gc.cra.nfcrx.infrastructure.bus;
