package io.storefront.toolkit.core.error;

/**
 * Raised by callers that prefer an exception over the boolean admission result.
 */
public class RateLimitedException extends ToolkitException {

  private final int maxRequests;
  private final long windowMs;

  public RateLimitedException(int maxRequests, long windowMs) {
    super("Rate limit exceeded: " + maxRequests + " requests per " + windowMs + "ms");
    this.maxRequests = maxRequests;
    this.windowMs = windowMs;
  }

  public int maxRequests() {
    return maxRequests;
  }

  public long windowMs() {
    return windowMs;
  }
}
