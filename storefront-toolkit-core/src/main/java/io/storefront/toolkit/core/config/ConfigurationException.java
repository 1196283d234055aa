package io.storefront.toolkit.core.config;

import io.storefront.toolkit.core.error.ToolkitException;

/**
 * Thrown when a configuration key is missing or holds an invalid value.
 */
public class ConfigurationException extends ToolkitException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
