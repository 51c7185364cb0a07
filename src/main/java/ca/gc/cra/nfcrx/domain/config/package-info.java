/**
 * Immutable configuration trees and the structural diff used for reconciliation.
 */
package ca.gc.cra.nfcrx.domain.config;
