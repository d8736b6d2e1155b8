/**
 * Named executor factories for the serialized store writer, recorder and monitor schedulers.
 */
package ca.gc.cra.screenlog.infrastructure.exec;
