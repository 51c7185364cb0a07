/**
 * Loopback radio and decoder tasks speaking the bus command/status protocol.
 */
package ca.gc.cra.nfcrx.infrastructure.task;
