/**
 * Domain primitives for captured screen frames and their pooled ownership.
 * <p><strong>Role:</strong> Domain layer types shared by capture sources, the frame buffer pool and encoders.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.screenlog.domain.capture.FrameHandle} is mutated only under the
 * owning pool's lock; the remaining types are immutable.</p>
 * <p><strong>Security:</strong> Frames contain screen contents; never log payload bytes.</p>
 */
package ca.gc.cra.screenlog.domain.capture;
