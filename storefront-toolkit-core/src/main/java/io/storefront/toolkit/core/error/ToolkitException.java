package io.storefront.toolkit.core.error;

/**
 * Base type for failures raised by the toolkit itself.
 * <p>
 * Failures of wrapped operations are never converted into this type; they propagate unchanged.
 */
public class ToolkitException extends RuntimeException {

  public ToolkitException(String message) {
    super(message);
  }

  public ToolkitException(String message, Throwable cause) {
    super(message, cause);
  }
}
