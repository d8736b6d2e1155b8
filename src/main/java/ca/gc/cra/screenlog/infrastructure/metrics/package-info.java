/**
 * Metrics adapters that bridge {@link ca.gc.cra.screenlog.application.port.MetricsPort} to OpenTelemetry or discard
 * observations.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code buffer.*}, {@code memory.*}, {@code db.*},
 * {@code compression.*}, {@code recorder.*} and {@code retention.*}.</p>
 * <p><strong>Security:</strong> Never exports frame contents; only counters and timings.</p>
 */
package ca.gc.cra.screenlog.infrastructure.metrics;
