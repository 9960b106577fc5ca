/**
 * Loading and caching of the {@code sqlconf.toml} project configuration.
 * <p><strong>Entry point:</strong> {@link ca.gc.cra.sqlconf.config.ConfigLoader#global()}.
 * <p><strong>Errors:</strong> {@link ca.gc.cra.sqlconf.config.ConfigException} and its five kinds; only
 * {@code NotFound} is ever replaced by defaults, and only by {@code loadOrDefault}.
 * <p><strong>Concurrency:</strong> The published {@link ca.gc.cra.sqlconf.config.SqlConfig} is immutable and
 * shared without synchronization.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sqlconf.config;
