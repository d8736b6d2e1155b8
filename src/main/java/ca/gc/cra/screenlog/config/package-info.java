/**
 * Configuration loading and component wiring.
 * <p>YAML files are flattened by {@link ca.gc.cra.screenlog.config.YamlConfigLoader}; CLI {@code key=value}
 * pairs override file values. {@link ca.gc.cra.screenlog.config.CompositionRoot} turns the validated records into
 * running components.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.screenlog.config;
