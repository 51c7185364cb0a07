/**
 * Decoded NFC frames.
 */
package ca.gc.cra.nfcrx.domain.frame;
