package io.storefront.toolkit.core.error;

import java.time.Duration;

/**
 * A wrapped operation did not settle within its allotted time.
 */
public class OperationTimeoutException extends ToolkitException {

  private final Duration timeout;

  public OperationTimeoutException(String message, Duration timeout) {
    super(message);
    this.timeout = timeout;
  }

  /**
   * @return the deadline that was exceeded
   */
  public Duration timeout() {
    return timeout;
  }
}
