/**
 * Logging helpers: runtime level changes for the CLI and size limits for logged documents.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sqlconf.logging;
