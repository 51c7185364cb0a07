/**
 * Console output of decoded frames.
 */
package ca.gc.cra.nfcrx.infrastructure.sink;
