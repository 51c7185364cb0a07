/**
 * Configuration records, device catalog and composition root wiring.
 * <p><strong>Role:</strong> Bootstrap layer translating YAML and CLI input into a runnable receiver graph.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Relies on {@code ca.gc.cra.nfcrx.validation} to reject malformed values before wiring.</p>
 */
package ca.gc.cra.nfcrx.config;
