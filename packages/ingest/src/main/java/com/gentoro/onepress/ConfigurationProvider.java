package com.gentoro.onepress;

import com.gentoro.onepress.exception.ConfigException;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the YAML settings file and exposes it as an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: - "classpath:some/path.yaml" (loaded from the application
 * classpath) - Absolute or relative filesystem path (e.g., "/etc/onepress.yaml" or
 * "site/onepress.yaml") - {@code file:} URIs. Values may reference environment variables with
 * {@code ${env:NAME}}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.onepress.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:onepress.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    URL resourceUrl = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resourceUrl == null) {
      // Empty configuration; required keys are reported by DataSourceConfig.
      log.debug("Classpath resource {} not found, starting with empty settings", resourceName);
      return new YAMLConfiguration();
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input =
        Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return config;
    } catch (Exception e) {
      throw new ConfigException("Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file does not exist: " + file);
    }
    log.info("Loading configuration from file: {}", file);
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromLocation(DEFAULT_LOCATION);
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }
}
