/**
 * Worker pool and cooperative termination signal for long-running tasks.
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Security:</strong> Threads inherit minimal privileges; names avoid leaking device identities.</p>
 */
package ca.gc.cra.nfcrx.infrastructure.exec;
