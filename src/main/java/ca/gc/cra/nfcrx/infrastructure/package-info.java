/**
 * Infrastructure adapters: event bus, task executor, loopback tasks, console sink and metrics.
 * <p><strong>Concurrency:</strong> Each adapter documents its guarantees.</p>
 * <p><strong>Metrics:</strong> Emits {@code bus.*} counters through {@link ca.gc.cra.nfcrx.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.nfcrx.infrastructure;
