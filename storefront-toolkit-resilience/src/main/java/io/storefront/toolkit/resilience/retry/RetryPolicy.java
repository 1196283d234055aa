package io.storefront.toolkit.resilience.retry;

import io.storefront.toolkit.core.config.ToolkitConfig;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retry tuning for {@link RetryExecutor}.
 * <p>
 * Built via Lombok's builder; unset fields keep their defaults:
 * <ul>
 *   <li>{@code maxAttempts}: 3 (total attempts, including the first)</li>
 *   <li>{@code baseDelay}: 1 second</li>
 *   <li>{@code maxDelay}: 10 seconds</li>
 *   <li>{@code backoffFactor}: 2.0</li>
 *   <li>{@code retryCondition}: every failure is retryable</li>
 * </ul>
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(5)
 *     .baseDelay(Duration.ofMillis(200))
 *     .retryCondition(error -> !(error instanceof IllegalArgumentException))
 *     .build();
 * }</pre>
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    private final int maxAttempts = 3;

    @NonNull
    @Builder.Default
    private final Duration baseDelay = Duration.ofSeconds(1);

    @NonNull
    @Builder.Default
    private final Duration maxDelay = Duration.ofSeconds(10);

    @Builder.Default
    private final double backoffFactor = 2.0;

    @NonNull
    @ToString.Exclude
    @Builder.Default
    private final Predicate<Throwable> retryCondition = error -> true;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    /**
     * Reads the {@code retry.*} keys, falling back to the defaults for any that are missing.
     */
    public static RetryPolicy from(ToolkitConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        RetryPolicy defaults = defaults();
        return RetryPolicy.builder()
            .maxAttempts(config.getInt("retry.max-attempts", defaults.getMaxAttempts()))
            .baseDelay(config.getDuration("retry.base-delay-ms", defaults.getBaseDelay()))
            .maxDelay(config.getDuration("retry.max-delay-ms", defaults.getMaxDelay()))
            .backoffFactor(config.getDouble("retry.backoff-factor", defaults.getBackoffFactor()))
            .build();
    }

    /**
     * Delay after failed attempt {@code attempt} (1-based):
     * {@code min(baseDelay * backoffFactor^(attempt-1), maxDelay)}.
     *
     * @param attempt the attempt that just failed
     * @return how long to wait before the next attempt
     */
    public Duration delayAfter(int attempt) {
        double millis = baseDelay.toMillis() * Math.pow(backoffFactor, attempt - 1);
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(Math.max(0L, capped));
    }
}
