/**
 * Memory sampling, threshold alerts and leak detection.
 *
 * @since 0.1.0
 */
package ca.gc.cra.screenlog.application.monitor;
