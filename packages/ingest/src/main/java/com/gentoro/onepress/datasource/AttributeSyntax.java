package com.gentoro.onepress.datasource;

import com.gentoro.onepress.exception.ConfigException;
import java.util.Locale;
import java.util.Map;

/** Syntax of sidecar files and frontmatter blocks. */
public enum AttributeSyntax {
  YAML,
  JSON;

  /** Parses the {@code attribute_syntax} option; accepts {@code yaml} or {@code json}. */
  public static AttributeSyntax fromOption(String value) {
    if (value == null || value.isBlank()) {
      return YAML;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "yaml" -> YAML;
      case "json" -> JSON;
      default -> throw new ConfigException(
          "Invalid attribute_syntax '%s': expected 'yaml' or 'json'".formatted(value),
          Map.of("option", DataSourceConfig.ATTRIBUTE_SYNTAX, "value", value));
    };
  }
}
