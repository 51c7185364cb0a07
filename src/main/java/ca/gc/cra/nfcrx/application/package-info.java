/**
 * Application layer of the NFC receiver.
 * <p><strong>Role:</strong> Hosts the reconciliation control loop and the ports it drives.</p>
 * <p><strong>Concurrency:</strong> The loop owns one thread; state shared with task workers is lock-protected.</p>
 * <p><strong>Metrics:</strong> Emits {@code loop.*} counters and histograms.</p>
 */
package ca.gc.cra.nfcrx.application;
