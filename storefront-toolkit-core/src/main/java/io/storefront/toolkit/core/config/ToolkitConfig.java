package io.storefront.toolkit.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Layered toolkit configuration backed by classpath property files.
 *
 * <p>Lookup order for every key:
 * <ol>
 *   <li>System property (e.g. {@code -Dbreaker.threshold=3})</li>
 *   <li>{@code toolkit-{component}.properties} (component override)</li>
 *   <li>{@code toolkit.properties} (global defaults)</li>
 * </ol>
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # toolkit.properties (global defaults)
 * breaker.threshold=5
 * cache.ttl-ms=300000
 *
 * # toolkit-catalog.properties (component override)
 * breaker.threshold=3
 * cache.ttl-ms=600000
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * ToolkitConfig global = ToolkitConfig.global();
 * int threshold = global.getInt("breaker.threshold");        // 5
 *
 * ToolkitConfig catalog = ToolkitConfig.forComponent("catalog");
 * Duration ttl = catalog.getDuration("cache.ttl-ms");         // 10 minutes
 * </pre>
 */
public class ToolkitConfig {

  static final String BASE_NAME = "toolkit";

  private final Properties properties;
  private final String context;

  private ToolkitConfig(Properties properties, String context) {
    this.properties = properties;
    this.context = context;
  }

  /**
   * Global configuration ({@code toolkit.properties}).
   *
   * @return global configuration
   */
  public static ToolkitConfig global() {
    return new ToolkitConfig(load(BASE_NAME + ".properties", new Properties()), "global");
  }

  /**
   * Component configuration with fallback to the global file.
   *
   * @param component component name (e.g. "catalog", "cart")
   * @return component configuration
   */
  public static ToolkitConfig forComponent(String component) {
    requireComponent(component);

    Properties defaults = load(BASE_NAME + ".properties", new Properties());
    Properties layered = load(BASE_NAME + "-" + component + ".properties", new Properties(defaults));
    return new ToolkitConfig(layered, "component:" + component);
  }

  /**
   * Configuration over explicit properties, mostly for embedding applications and tests.
   *
   * @param properties values to expose
   * @return configuration backed by a copy of the given properties
   */
  public static ToolkitConfig of(Properties properties) {
    Objects.requireNonNull(properties, "properties cannot be null");
    Properties copy = new Properties();
    copy.putAll(properties);
    return new ToolkitConfig(copy, "explicit");
  }

  /**
   * Component configuration layered over this one: {@code toolkit-{component}.properties} wins,
   * every other key falls back to this configuration.
   *
   * @param component component name (e.g. "catalog", "cart")
   * @return component configuration
   */
  public ToolkitConfig withComponent(String component) {
    requireComponent(component);

    Properties layered = load(BASE_NAME + "-" + component + ".properties", new Properties(properties));
    return new ToolkitConfig(layered, context + "/component:" + component);
  }

  private static void requireComponent(String component) {
    Objects.requireNonNull(component, "component cannot be null");
    if (component.isBlank()) {
      throw new IllegalArgumentException("component cannot be blank");
    }
  }

  private static Properties load(String resource, Properties target) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = ToolkitConfig.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in != null) {
        target.load(in);
      }
      return target;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }

  // =========================================================================
  // Type-safe getters with system property override support
  // =========================================================================

  /**
   * Get string value.
   *
   * @param key property key
   * @return property value
   * @throws ConfigurationException if key not found
   */
  public String getString(String key) {
    String value = lookup(key);
    if (value == null) {
      throw new ConfigurationException("Missing config key '" + key + "' in context: " + context);
    }
    return value;
  }

  /**
   * Get string value with default.
   *
   * @param key property key
   * @param defaultValue default if not found
   * @return property value or default
   */
  public String getString(String key, String defaultValue) {
    String value = lookup(key);
    return value != null ? value : defaultValue;
  }

  /**
   * Get int value.
   *
   * @param key property key
   * @return property value as int
   * @throws ConfigurationException if key not found or invalid format
   */
  public int getInt(String key) {
    String value = getString(key);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid int value for key '" + key + "': " + value, e);
    }
  }

  /**
   * Get int value with default.
   *
   * @param key property key
   * @param defaultValue default if not found or not a number
   * @return property value as int or default
   */
  public int getInt(String key, int defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Get long value.
   *
   * @param key property key
   * @return property value as long
   * @throws ConfigurationException if key not found or invalid format
   */
  public long getLong(String key) {
    String value = getString(key);
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid long value for key '" + key + "': " + value, e);
    }
  }

  public long getLong(String key, long defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Get double value.
   *
   * @param key property key
   * @return property value as double
   * @throws ConfigurationException if key not found or invalid format
   */
  public double getDouble(String key) {
    String value = getString(key);
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid double value for key '" + key + "': " + value, e);
    }
  }

  public double getDouble(String key, double defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  public boolean getBoolean(String key) {
    return Boolean.parseBoolean(getString(key).trim());
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = lookup(key);
    return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
  }

  /**
   * Millisecond-valued key (keys ending in {@code -ms}) as a {@link Duration}.
   *
   * @param key property key
   * @return duration value
   * @throws ConfigurationException if key not found, invalid, or negative
   */
  public Duration getDuration(String key) {
    long millis = getLong(key);
    if (millis < 0) {
      throw new ConfigurationException("Negative duration for key '" + key + "': " + millis);
    }
    return Duration.ofMillis(millis);
  }

  public Duration getDuration(String key, Duration defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      long millis = Long.parseLong(value.trim());
      return millis < 0 ? defaultValue : Duration.ofMillis(millis);
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Check if key exists in configuration.
   *
   * @param key property key
   * @return true if key exists
   */
  public boolean contains(String key) {
    return lookup(key) != null;
  }

  /**
   * All keys visible at this level, including inherited global keys.
   *
   * @return set of keys
   */
  public Set<String> keys() {
    return Collections.unmodifiableSet(new HashSet<>(properties.stringPropertyNames()));
  }

  /**
   * Configuration context (for debugging).
   *
   * @return context description (e.g. "global", "component:catalog")
   */
  public String context() {
    return context;
  }

  private String lookup(String key) {
    Objects.requireNonNull(key, "key cannot be null");
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp;
    }
    return properties.getProperty(key);
  }

  @Override
  public String toString() {
    return "ToolkitConfig[context=" + context + "]";
  }
}
