/**
 * SQLite-backed chunk, batch and settings store.
 * <p><strong>Concurrency:</strong> One writer connection owned by a single-thread executor serializes every
 * mutation; reads borrow pooled connections and run concurrently under WAL journaling.</p>
 * <p><strong>Metrics:</strong> Emits {@code db.write.latencyNanos}, {@code db.write.failed} and
 * {@code db.read.failed}.</p>
 */
package ca.gc.cra.screenlog.infrastructure.persistence;
