/**
 * Local file-system adapters for free-space checks.
 */
package ca.gc.cra.screenlog.infrastructure.storage;
