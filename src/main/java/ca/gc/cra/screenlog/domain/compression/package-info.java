/**
 * Compression settings, encoder output and adaptive adjustment diagnostics.
 * <p><strong>Concurrency:</strong> Immutable records and enums.</p>
 * <p><strong>Metrics:</strong> Chunk sizes and multipliers back the {@code compression.*} metrics.</p>
 */
package ca.gc.cra.screenlog.domain.compression;
