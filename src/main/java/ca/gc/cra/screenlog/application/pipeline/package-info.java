/**
 * Recording lifecycle: the {@link ca.gc.cra.screenlog.application.pipeline.RecordingCoordinator} state machine,
 * its settings and retry policy.
 * <p>All recorder work runs on the single {@code screenlog-recorder} thread; public methods enqueue work and return
 * futures. Display-change bursts are collapsed by a quiet-period debouncer before capture restarts.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.screenlog.application.pipeline;
