/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p>All helpers throw {@link java.lang.IllegalArgumentException} with the offending option name.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.nfcrx.validation;
