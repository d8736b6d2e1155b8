/**
 * Chunk, batch and retention domain types persisted by the persistence coordinator.
 * <p><strong>Role:</strong> Domain layer values exchanged between the recorder, the store and the analysis
 * consumer.</p>
 * <p><strong>Concurrency:</strong> Immutable records and enums.</p>
 * <p><strong>Metrics:</strong> Cleanup results back the {@code retention.*} metrics.</p>
 */
package ca.gc.cra.screenlog.domain.chunk;
