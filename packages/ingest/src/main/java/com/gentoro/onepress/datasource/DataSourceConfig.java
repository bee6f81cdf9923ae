package com.gentoro.onepress.datasource;

import com.gentoro.onepress.exception.ConfigException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Validated ingestion parameters. Instances are immutable and only obtainable through {@link
 * #builder()} or {@link #fromConfiguration(Configuration)}, both of which validate eagerly and
 * never touch the filesystem.
 */
public final class DataSourceConfig {
  public static final String PREFIX = "datasource";
  public static final String SOURCE_ROOT = "source_root";
  public static final String INCLUDE = "include";
  public static final String EXCLUDE = "exclude";
  public static final String TEXT_EXTENSIONS = "text_extensions";
  public static final String ATTRIBUTE_SYNTAX = "attribute_syntax";
  public static final String TIMEZONE = "timezone";

  private final Path sourceRoot;
  private final List<String> include;
  private final List<String> exclude;
  private final Set<String> textExtensions;
  private final AttributeSyntax attributeSyntax;
  private final ZoneId timezone;

  private DataSourceConfig(
      Path sourceRoot,
      List<String> include,
      List<String> exclude,
      Set<String> textExtensions,
      AttributeSyntax attributeSyntax,
      ZoneId timezone) {
    this.sourceRoot = sourceRoot;
    this.include = include;
    this.exclude = exclude;
    this.textExtensions = textExtensions;
    this.attributeSyntax = attributeSyntax;
    this.timezone = timezone;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads the {@code datasource.*} keys of an application configuration.
   *
   * <pre>
   * datasource:
   *   source_root: ./site
   *   text_extensions: [md, html, twig]
   *   attribute_syntax: yaml
   * </pre>
   */
  public static DataSourceConfig fromConfiguration(Configuration cfg) {
    Configuration ds = cfg.subset(PREFIX);
    return builder()
        .sourceRoot(ds.getString(SOURCE_ROOT, null))
        .include(ds.getList(String.class, INCLUDE, List.of()))
        .exclude(ds.getList(String.class, EXCLUDE, List.of()))
        .textExtensions(ds.getList(String.class, TEXT_EXTENSIONS, List.of()))
        .attributeSyntax(ds.getString(ATTRIBUTE_SYNTAX, null))
        .timezone(ds.getString(TIMEZONE, null))
        .build();
  }

  public Path sourceRoot() {
    return sourceRoot;
  }

  public List<String> include() {
    return include;
  }

  public List<String> exclude() {
    return exclude;
  }

  /** Lower-cased extensions without leading dot. */
  public Set<String> textExtensions() {
    return textExtensions;
  }

  public AttributeSyntax attributeSyntax() {
    return attributeSyntax;
  }

  public ZoneId timezone() {
    return timezone;
  }

  @Override
  public String toString() {
    return "DataSourceConfig{"
        + "sourceRoot="
        + sourceRoot
        + ", include="
        + include
        + ", exclude="
        + exclude
        + ", textExtensions="
        + textExtensions
        + ", attributeSyntax="
        + attributeSyntax
        + ", timezone="
        + timezone
        + '}';
  }

  public static final class Builder {
    private String sourceRoot;
    private List<String> include = List.of();
    private List<String> exclude = List.of();
    private Collection<String> textExtensions = List.of();
    private String attributeSyntax;
    private String timezone;

    private Builder() {}

    public Builder sourceRoot(String sourceRoot) {
      this.sourceRoot = sourceRoot;
      return this;
    }

    public Builder sourceRoot(Path sourceRoot) {
      this.sourceRoot = sourceRoot == null ? null : sourceRoot.toString();
      return this;
    }

    public Builder include(List<String> include) {
      this.include = include == null ? List.of() : include;
      return this;
    }

    public Builder exclude(List<String> exclude) {
      this.exclude = exclude == null ? List.of() : exclude;
      return this;
    }

    public Builder textExtensions(Collection<String> textExtensions) {
      this.textExtensions = textExtensions == null ? List.of() : textExtensions;
      return this;
    }

    public Builder attributeSyntax(String attributeSyntax) {
      this.attributeSyntax = attributeSyntax;
      return this;
    }

    public Builder timezone(String timezone) {
      this.timezone = timezone;
      return this;
    }

    public DataSourceConfig build() {
      if (sourceRoot == null || sourceRoot.isBlank()) {
        throw new ConfigException(
            "Missing required option: " + SOURCE_ROOT, Map.of("option", SOURCE_ROOT));
      }
      // Commons Configuration keeps ${env:NAME} verbatim when NAME is not set
      if (sourceRoot.contains("${")) {
        throw new ConfigException(
            "Missing required option: %s (unresolved value %s)".formatted(SOURCE_ROOT, sourceRoot),
            Map.of("option", SOURCE_ROOT, "value", sourceRoot));
      }
      Path root;
      try {
        root = Path.of(sourceRoot.trim());
      } catch (InvalidPathException e) {
        throw new ConfigException("Invalid " + SOURCE_ROOT + ": " + sourceRoot, e);
      }

      Set<String> extensions = new LinkedHashSet<>();
      for (String ext : textExtensions) {
        String normalized = normalizeExtension(ext);
        if (!normalized.isEmpty()) {
          extensions.add(normalized);
        }
      }
      if (extensions.isEmpty()) {
        throw new ConfigException(
            "Option " + TEXT_EXTENSIONS + " must list at least one extension",
            Map.of("option", TEXT_EXTENSIONS));
      }

      AttributeSyntax syntax = AttributeSyntax.fromOption(attributeSyntax);

      ZoneId zone;
      try {
        zone =
            timezone == null || timezone.isBlank()
                ? ZoneId.systemDefault()
                : ZoneId.of(timezone.trim());
      } catch (DateTimeException e) {
        throw new ConfigException("Invalid " + TIMEZONE + ": " + timezone, e);
      }

      return new DataSourceConfig(
          root,
          cleanPaths(include),
          cleanPaths(exclude),
          Set.copyOf(extensions),
          syntax,
          zone);
    }

    private static List<String> cleanPaths(List<String> paths) {
      List<String> out = new ArrayList<>();
      for (String p : paths) {
        if (p != null && !p.isBlank()) {
          out.add(p.trim());
        }
      }
      return List.copyOf(out);
    }

    static String normalizeExtension(String ext) {
      if (ext == null) return "";
      String e = ext.trim().toLowerCase(Locale.ROOT);
      while (e.startsWith(".")) {
        e = e.substring(1);
      }
      return e;
    }
  }
}
