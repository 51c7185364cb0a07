/**
 * Ports between the control loop and its collaborators (tasks, sinks, clock, metrics).
 */
package ca.gc.cra.nfcrx.application.port;
