/**
 * Bounded in-memory frame buffering.
 * <p><strong>Role:</strong> Infrastructure adapter behind {@link ca.gc.cra.screenlog.application.port.FramePoolPort}.</p>
 * <p><strong>Concurrency:</strong> Single lock around all mutation.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code buffer.*}.</p>
 */
package ca.gc.cra.screenlog.infrastructure.buffer;
