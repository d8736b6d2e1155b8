/**
 * Recorder state machine values, error taxonomy and environment events.
 * <p><strong>Role:</strong> Domain layer values published on the recorder status channel.</p>
 * <p><strong>Concurrency:</strong> Immutable records and enums.</p>
 */
package ca.gc.cra.screenlog.domain.recording;
