/**
 * <strong>Purpose:</strong> Ports defining the capture, encode, store and observe contracts of SCREENLOG.
 * <p><strong>Pipeline role:</strong> Application layer; adapters in {@code infrastructure} implement these
 * interfaces to integrate external systems.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.screenlog.application.port;
