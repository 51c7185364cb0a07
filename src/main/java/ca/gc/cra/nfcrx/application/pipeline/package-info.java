/**
 * Reconciliation control loop converging the radio and decoder tasks towards their desired configuration.
 */
package ca.gc.cra.nfcrx.application.pipeline;
