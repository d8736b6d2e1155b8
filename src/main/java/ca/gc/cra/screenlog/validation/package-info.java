/**
 * Input validation helpers shared by configuration loaders, CLI commands and components.
 * <p><strong>Role:</strong> Domain support; throws {@link java.lang.IllegalArgumentException} on violations.</p>
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 */
package ca.gc.cra.screenlog.validation;
