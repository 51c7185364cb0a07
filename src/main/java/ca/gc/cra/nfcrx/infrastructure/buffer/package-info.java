/**
 * Hand-off queues between bus callbacks and the control loop.
 */
package ca.gc.cra.nfcrx.infrastructure.buffer;
