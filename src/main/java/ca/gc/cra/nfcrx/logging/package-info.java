/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound values before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; verbosity is applied once during CLI startup.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nfcrx.logging;
