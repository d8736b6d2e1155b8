/**
 * Capture source adapters.
 * <p><strong>Concurrency:</strong> Frames are pulled from a single recorder thread; display and system events may be
 * raised from any thread.</p>
 */
package ca.gc.cra.screenlog.infrastructure.capture;
