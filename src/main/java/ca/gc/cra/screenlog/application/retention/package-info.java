/**
 * Scheduled retention cleanup and storage quota checks.
 *
 * @since 0.1.0
 */
package ca.gc.cra.screenlog.application.retention;
