/**
 * In-memory event channels carrying recorder status and memory alerts to observers.
 * <p><strong>Concurrency:</strong> Copy-on-write subscriber lists; publishing never blocks.</p>
 */
package ca.gc.cra.screenlog.infrastructure.events;
