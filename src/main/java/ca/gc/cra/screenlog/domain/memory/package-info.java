/**
 * Memory snapshots, pressure levels and alerts produced by the memory monitor.
 * <p><strong>Concurrency:</strong> All types are immutable values.</p>
 * <p><strong>Metrics:</strong> Snapshot fields back the {@code memory.*} metrics.</p>
 */
package ca.gc.cra.screenlog.domain.memory;
