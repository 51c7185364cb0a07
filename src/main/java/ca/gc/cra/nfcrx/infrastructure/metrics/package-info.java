/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.nfcrx.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are created lazily in concurrent maps; updates are thread-safe.</p>
 * <p><strong>Metrics:</strong> Every key is exported under its sanitized name with an {@code rx.metric.key} attribute.</p>
 */
package ca.gc.cra.nfcrx.infrastructure.metrics;
