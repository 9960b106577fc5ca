/**
 * {@code sqlconf} command-line tool for checking, locating, and printing the project configuration.
 * <p><strong>Exit codes:</strong> see {@link ca.gc.cra.sqlconf.api.ExitCode}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sqlconf.api;
