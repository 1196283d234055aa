package io.storefront.toolkit.core.error;

import io.storefront.toolkit.core.async.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts and logs failures by {@code exceptionType:context}.
 * <p>
 * One instance is owned by the toolkit context and handed to whoever records errors;
 * there is no process-wide instance.
 */
public class ErrorTracker {
  private static final Logger logger = LoggerFactory.getLogger(ErrorTracker.class);

  private final Map<String, LongAdder> errorCounts = new ConcurrentHashMap<>();

  /**
   * Records and logs a failure.
   *
   * @param error   the failure (completion wrappers are unwrapped)
   * @param context where it happened (e.g. operation name); null maps to "unknown"
   * @return the updated count for this error key
   */
  public long handleError(Throwable error, String context) {
    Objects.requireNonNull(error, "error cannot be null");
    Throwable cause = Futures.unwrap(error);
    String key = cause.getClass().getSimpleName() + ":" + (context != null ? context : "unknown");

    LongAdder counter = errorCounts.computeIfAbsent(key, k -> new LongAdder());
    counter.increment();
    long count = counter.sum();

    logger.error("Error {} (count: {}): {}", key, count, cause.getMessage());
    return count;
  }

  /**
   * @return snapshot of error counts, sorted by key
   */
  public Map<String, Long> getErrorStats() {
    Map<String, Long> snapshot = new TreeMap<>();
    errorCounts.forEach((key, counter) -> snapshot.put(key, counter.sum()));
    return snapshot;
  }

  public long count(String key) {
    LongAdder counter = errorCounts.get(key);
    return counter != null ? counter.sum() : 0L;
  }

  public void resetErrorStats() {
    errorCounts.clear();
  }
}
