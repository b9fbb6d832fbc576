package com.gentoro.queuemgr.config;

import com.gentoro.queuemgr.exception.ConfigurationException;
import com.gentoro.queuemgr.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.slf4j.Logger;

/**
 * Loads the application configuration.
 *
 * <p>Values come from, in order of precedence: JVM system properties, then the YAML file given at
 * startup or, when none is given, {@value #DEFAULT_RESOURCE} from the class path.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "queuemgr.yaml";

  private final CompositeConfiguration config;

  public ConfigurationProvider() {
    this(null);
  }

  /**
   * @param configFile YAML file to load; {@code null} loads the class path default
   */
  public ConfigurationProvider(Path configFile) {
    this.config = new CompositeConfiguration();
    this.config.addConfiguration(new SystemConfiguration());
    this.config.addConfiguration(configFile == null ? loadDefault() : load(configFile));
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration load(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigurationException("Configuration file not found: " + file);
    }
    log.info("Loading configuration from {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader, file.toString());
    } catch (IOException e) {
      throw new ConfigurationException("Cannot read configuration file " + file, e);
    }
  }

  private static YAMLConfiguration loadDefault() {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = ConfigurationProvider.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        log.debug("No {} on the class path, using built-in defaults", DEFAULT_RESOURCE);
        return new YAMLConfiguration();
      }
      return read(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULT_RESOURCE);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot read " + DEFAULT_RESOURCE, e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Invalid YAML in " + source, e);
    }
    return yaml;
  }
}
