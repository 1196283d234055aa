package io.storefront.toolkit.core.error;

/**
 * A call was rejected without invoking the wrapped operation because its breaker is open.
 */
public class CircuitOpenException extends ToolkitException {

  private final String breakerName;

  public CircuitOpenException(String breakerName) {
    super("Circuit breaker '" + breakerName + "' is OPEN");
    this.breakerName = breakerName;
  }

  public CircuitOpenException(String breakerName, String message) {
    super(message);
    this.breakerName = breakerName;
  }

  public String breakerName() {
    return breakerName;
  }
}
