/**
 * CLI entry point of the NFC receiver.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses options, configures logging, and runs the control loop.</p>
 * <p><strong>Concurrency:</strong> Setup is single-threaded; the control loop runs on the main thread and tasks on executor workers.</p>
 * <p><strong>Metrics:</strong> Creates the OpenTelemetry adapter shared by every component.</p>
 */
package ca.gc.cra.nfcrx.api;
