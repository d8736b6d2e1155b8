/**
 * Memory probes backed by JVM runtime and management beans.
 */
package ca.gc.cra.screenlog.infrastructure.memory;
