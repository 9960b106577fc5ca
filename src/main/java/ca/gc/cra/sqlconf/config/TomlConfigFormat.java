package ca.gc.cra.sqlconf.config;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import java.util.Objects;

/**
 * Parses and renders {@code sqlconf.toml} documents with Jackson's TOML data format.
 *
 * <p>Unknown keys inside {@code [common]}, {@code [macros]} and {@code [migrate]} are rejected, so a misspelled
 * setting fails instead of falling back to its default. Unknown top-level tables are ignored.</p>
 *
 * @since 0.1.0
 */
public final class TomlConfigFormat implements ConfigFormat {
  private final TomlMapper mapper;

  public TomlConfigFormat() {
    this.mapper = TomlMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  @Override
  public boolean enabled() {
    return true;
  }

  /**
   * Parses the document, treating an empty document as all defaults.
   *
   * @param text TOML document
   * @return parsed configuration
   * @throws ConfigSyntaxException with the parser's line and column when available
   */
  @Override
  public SqlConfig parse(String text) throws ConfigSyntaxException {
    Objects.requireNonNull(text, "text");
    try {
      JsonNode root = mapper.readTree(text);
      if (root == null || root.isMissingNode() || root.isEmpty()) {
        return SqlConfig.defaults();
      }
      // Bind from the text rather than the tree so schema errors keep their location.
      SqlConfig config = mapper.readValue(text, SqlConfig.class);
      return config == null ? SqlConfig.defaults() : config;
    } catch (JsonProcessingException ex) {
      throw toSyntaxException(ex);
    }
  }

  /**
   * Renders a configuration as a TOML document.
   *
   * @param config configuration to render
   * @return TOML text
   * @throws IllegalStateException if Jackson cannot serialize the configuration
   */
  public String render(SqlConfig config) {
    Objects.requireNonNull(config, "config");
    try {
      return mapper.writeValueAsString(config);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to render configuration as TOML", ex);
    }
  }

  static ConfigSyntaxException toSyntaxException(JsonProcessingException ex) {
    JsonLocation location = ex.getLocation();
    int line = location == null ? ConfigSyntaxException.UNKNOWN : location.getLineNr();
    int column = location == null ? ConfigSyntaxException.UNKNOWN : location.getColumnNr();
    String message = ex.getOriginalMessage();
    if (message == null || message.isBlank()) {
      message = ex.getClass().getSimpleName();
    }
    return new ConfigSyntaxException(message, line, column, ex);
  }

  @Override
  public String toString() {
    return "toml";
  }
}
