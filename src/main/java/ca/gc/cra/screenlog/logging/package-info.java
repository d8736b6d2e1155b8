/**
 * Logging controls layered over SLF4J and Logback.
 *
 * @since 0.1.0
 */
package ca.gc.cra.screenlog.logging;
