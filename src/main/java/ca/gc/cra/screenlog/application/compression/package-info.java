/**
 * Adaptive bitrate control that keeps chunk sizes near the daily storage budget.
 *
 * @since 0.1.0
 */
package ca.gc.cra.screenlog.application.compression;
