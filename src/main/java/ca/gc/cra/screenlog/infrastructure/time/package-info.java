/**
 * Clock adapters implementing {@link ca.gc.cra.screenlog.application.port.ClockPort}.
 */
package ca.gc.cra.screenlog.infrastructure.time;
