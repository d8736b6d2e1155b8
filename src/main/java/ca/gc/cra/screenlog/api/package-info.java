/**
 * Command-line entry points: {@code record}, {@code cleanup}, {@code chunks} and {@code memory}.
 * <p>Commands take {@code key=value} arguments plus flags, optionally layered over a YAML file, and map failures to
 * {@link ca.gc.cra.screenlog.api.ExitCode} values.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.screenlog.api;
