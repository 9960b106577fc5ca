package ca.gc.cra.sqlconf.config;

import ca.gc.cra.sqlconf.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads {@code sqlconf.toml} at most once per process and caches the result.
 * <p><strong>Why:</strong> Query checking and migration tooling run many times per build; all of them must see
 * the same configuration and none should re-read the file.</p>
 * <p><strong>Role:</strong> Process-wide entry point, obtained through {@link #global()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the candidate path through a caller-supplied {@link ConfigPathStrategy}.</li>
 *   <li>Read and parse the file, classifying failures into {@link ConfigException} kinds.</li>
 *   <li>Publish the first successful result; failed attempts leave the cache empty so a later call may retry.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Cache hits are lock-free. Misses are serialized by an initialization lock, so
 * at most one resolve/read/parse sequence runs at a time and threads that waited return the published value
 * without touching the filesystem. Path strategies run under that lock and must not call back into the loader;
 * re-entrant calls are not supported.</p>
 * <p><strong>Observability:</strong> Logs the path and (truncated) contents of every file read at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
  private static final int MAX_LOGGED_BYTES = 4096;
  private static final ConfigLoader GLOBAL = new ConfigLoader(ConfigFormats.detect());

  private final AtomicReference<Published> cell = new AtomicReference<>();
  private final ReentrantLock initLock = new ReentrantLock();
  private final ConfigFormat format;
  private final DocumentReader reader;

  /**
   * Creates a loader with its own cache. Production code uses {@link #global()}; separate instances exist for
   * tests and tools that must not share the process-wide cache.
   *
   * @param format format used to parse files that exist
   */
  public ConfigLoader(ConfigFormat format) {
    this(format, ConfigLoader::readUtf8);
  }

  ConfigLoader(ConfigFormat format, DocumentReader reader) {
    this.format = Objects.requireNonNull(format, "format");
    this.reader = Objects.requireNonNull(reader, "reader");
  }

  /**
   * Returns the process-wide loader, using TOML when it is on the classpath.
   *
   * @return shared loader
   */
  public static ConfigLoader global() {
    return GLOBAL;
  }

  /**
   * Returns the cached configuration, or reads {@code $SQLCONF_PROJECT_DIR/sqlconf.toml}, substituting defaults
   * when the file does not exist.
   *
   * @return cached configuration
   * @throws ConfigLoadFailure if the variable is unset or the file exists but cannot be used
   */
  public SqlConfig fromProjectDir() {
    return loadOrDefault(ConfigPathStrategy.projectDir());
  }

  /**
   * Returns the cached configuration, or reads {@code $SQLCONF_PROJECT_DIR/sqlconf.toml}.
   *
   * @return cached configuration
   * @throws ConfigException if the variable is unset or the file is missing or unusable
   */
  public SqlConfig tryFromProjectDir() throws ConfigException {
    return load(ConfigPathStrategy.projectDir());
  }

  /**
   * Returns the cached configuration, or reads {@code sqlconf.toml} from the working directory.
   *
   * @return cached configuration
   * @throws ConfigException if the file is missing or unusable
   */
  public SqlConfig tryFromCurrentDir() throws ConfigException {
    return load(ConfigPathStrategy.currentDir());
  }

  /**
   * Returns the cached configuration, or loads it and treats a missing file as "use defaults".
   *
   * <p>Every other failure is fatal: continuing with defaults could point migrations at the wrong table or
   * directory, so the failure is logged and rethrown unchecked instead of being replaced by a fabricated value.</p>
   *
   * @param strategy candidate path supplier, used only on a cache miss
   * @return cached configuration, or the defaults when the file does not exist
   * @throws ConfigLoadFailure for any failure other than {@link ConfigException.NotFound}
   */
  public SqlConfig loadOrDefault(ConfigPathStrategy strategy) {
    try {
      return load(strategy);
    } catch (ConfigException ex) {
      Optional<Path> missing = ex.notFoundPath();
      if (missing.isPresent()) {
        log.debug("Not reading config, file {} not found", missing.get());
        return publish(SqlConfig.defaults(), null);
      }
      log.error("Unusable sqlconf configuration: {}", ex.getMessage());
      throw new ConfigLoadFailure(ex);
    }
  }

  /**
   * Returns the cached configuration, or resolves, reads, and parses it.
   *
   * <p>Once a configuration is cached, later calls return it without invoking {@code strategy}, whatever path
   * that strategy would produce.</p>
   *
   * @param strategy candidate path supplier, invoked at most once and only on a cache miss
   * @return cached configuration
   * @throws ConfigException when the path cannot be resolved or the file is missing or unusable; the cache is
   *     left empty
   */
  public SqlConfig load(ConfigPathStrategy strategy) throws ConfigException {
    Objects.requireNonNull(strategy, "strategy");
    Published current = cell.get();
    if (current != null) {
      return current.config();
    }
    initLock.lock();
    try {
      current = cell.get();
      if (current != null) {
        return current.config();
      }
      Path path = strategy.resolve();
      return publish(readFrom(path), path);
    } finally {
      initLock.unlock();
    }
  }

  /**
   * Shorthand for {@code load(ConfigPathStrategy.literal(path))}.
   *
   * @param path file to read on a cache miss
   * @return cached configuration
   * @throws ConfigException when the file is missing or unusable
   */
  public SqlConfig loadFromPath(Path path) throws ConfigException {
    return load(ConfigPathStrategy.literal(path));
  }

  /**
   * Returns the cached configuration without any I/O.
   *
   * @return configuration, or empty when nothing has been published yet
   */
  public Optional<SqlConfig> cached() {
    Published current = cell.get();
    return current == null ? Optional.empty() : Optional.of(current.config());
  }

  /**
   * Returns the file the cached configuration was read from.
   *
   * @return source path; empty when nothing is cached or the defaults were published because the file was missing
   */
  public Optional<Path> source() {
    Published current = cell.get();
    return current == null ? Optional.empty() : Optional.ofNullable(current.source());
  }

  /**
   * Returns the format this loader parses with.
   *
   * @return configuration format
   */
  public ConfigFormat format() {
    return format;
  }

  private SqlConfig readFrom(Path path) throws ConfigException {
    String text;
    try {
      text = reader.read(path);
    } catch (IOException ex) {
      throw ConfigException.fromIo(path, ex);
    }
    if (log.isDebugEnabled()) {
      log.debug("Read config TOML from {}:\n{}", path, Logs.truncate(text, MAX_LOGGED_BYTES));
    }
    if (!format.enabled()) {
      throw new ConfigException.ParseDisabled(path);
    }
    try {
      return format.parse(text);
    } catch (ConfigSyntaxException ex) {
      throw new ConfigException.Parse(path, ex);
    }
  }

  private SqlConfig publish(SqlConfig config, Path source) {
    if (cell.compareAndSet(null, new Published(config, source))) {
      log.debug("Published sqlconf configuration from {}", source == null ? "defaults" : source);
    }
    return cell.get().config();
  }

  private static String readUtf8(Path path) throws IOException {
    return Files.readString(path, StandardCharsets.UTF_8);
  }

  /** Filesystem read primitive; replaced in tests to simulate failures. */
  @FunctionalInterface
  interface DocumentReader {
    String read(Path path) throws IOException;
  }

  private record Published(SqlConfig config, Path source) {}
}
