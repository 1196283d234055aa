package io.storefront.toolkit.runtime;

import io.storefront.toolkit.core.async.Futures;
import io.storefront.toolkit.core.error.ErrorTracker;
import io.storefront.toolkit.resilience.batch.Batches;
import io.storefront.toolkit.resilience.breaker.CircuitBreaker;
import io.storefront.toolkit.resilience.cache.TtlCache;
import io.storefront.toolkit.resilience.pool.ConcurrencyPool;
import io.storefront.toolkit.resilience.ratelimit.RateLimiter;
import io.storefront.toolkit.resilience.retry.RetryExecutor;
import io.storefront.toolkit.resilience.retry.RetryPolicy;
import io.storefront.toolkit.streams.telemetry.LogStream;
import io.storefront.toolkit.streams.telemetry.MetricsStream;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Composes the resilience components around a back-end service's operations.
 * <p>
 * Typical use wraps each data access in {@link #executeCached} (cache, then breaker) and
 * {@link #executeWithMetrics} (timing, metrics and error tracking):
 * <pre>{@code
 * ResilientService catalog = context.service("catalog");
 *
 * CompletableFuture<Product> product = catalog.executeCached(CacheKeys.of("product", id),
 *     () -> catalog.executeWithMetrics(() -> repository.load(id), "getProduct"));
 * }</pre>
 * Instances are normally obtained from {@link ToolkitContext#service(String)}, which reads the
 * service's component configuration ({@code toolkit-{name}.properties}).
 */
@Getter
@Builder
public class ResilientService {
    private static final Logger logger = LoggerFactory.getLogger(ResilientService.class);

    static final String OPERATION_DURATION = "operation_duration";

    @NonNull
    private final String name;
    @NonNull
    private final TtlCache<Object> cache;
    @NonNull
    private final CircuitBreaker circuitBreaker;
    @NonNull
    private final RateLimiter rateLimiter;
    @NonNull
    private final RetryExecutor retryExecutor;
    @NonNull
    private final ConcurrencyPool pool;
    @NonNull
    private final MetricsStream metricsStream;
    @NonNull
    private final LogStream logStream;
    @NonNull
    private final ErrorTracker errorTracker;
    @NonNull
    private final Clock clock;

    /**
     * Cached operation: a miss runs the operation through the circuit breaker and caches the result.
     */
    public <T> CompletableFuture<T> executeCached(String key, Supplier<CompletableFuture<T>> operation) {
        return executeCached(key, operation, true);
    }

    /**
     * @param useCache false bypasses the cache but still goes through the breaker
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> executeCached(String key, Supplier<CompletableFuture<T>> operation, boolean useCache) {
        if (!useCache) {
            return circuitBreaker.execute(operation);
        }
        // Keys are unique per operation, so every value under a key has that operation's type.
        Supplier<CompletableFuture<Object>> guarded = () -> (CompletableFuture<Object>) circuitBreaker.execute(operation);
        return (CompletableFuture<T>) cache.get(key, guarded);
    }

    /**
     * Waits for a rate-limiter slot, then runs the operation.
     */
    public <T> CompletableFuture<T> executeRateLimited(Supplier<CompletableFuture<T>> operation) {
        return rateLimiter.waitForSlot().thenCompose(ignored -> Futures.invoke(operation));
    }

    public <T> CompletableFuture<T> executeWithRetry(Supplier<CompletableFuture<T>> operation) {
        return retryExecutor.retry(operation);
    }

    public <T> CompletableFuture<T> executeWithRetry(Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        return retryExecutor.retry(operation, policy);
    }

    /**
     * Times the operation, records an {@code operation_duration} metric tagged with the operation
     * name and outcome, and tracks failures. The outcome itself is passed through unchanged.
     */
    public <T> CompletableFuture<T> executeWithMetrics(Supplier<CompletableFuture<T>> operation, String operationName) {
        long start = clock.millis();
        CompletableFuture<T> result = new CompletableFuture<>();
        Futures.invoke(operation).whenComplete((value, error) -> {
            long duration = clock.millis() - start;
            if (error == null) {
                metricsStream.recordMetric(OPERATION_DURATION, duration,
                    Map.of("operation", operationName, "status", "success"));
                logStream.info("Operation " + operationName + " completed", Map.of("duration", duration));
                result.complete(value);
            } else {
                Throwable cause = Futures.unwrap(error);
                metricsStream.recordMetric(OPERATION_DURATION, duration,
                    Map.of("operation", operationName, "status", "error"));
                errorTracker.handleError(cause, operationName);
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    /**
     * Processes items batch by batch.
     */
    public <I, R> CompletableFuture<List<R>> executeBatch(
        List<I> items,
        Function<? super I, ? extends CompletableFuture<R>> processor,
        int batchSize
    ) {
        return Batches.batchProcess(items, processor, batchSize);
    }

    /**
     * Processes items concurrently, bounded by the service's pool.
     */
    public <I, R> CompletableFuture<List<R>> executeParallel(
        List<I> items,
        Function<? super I, ? extends CompletableFuture<R>> processor
    ) {
        return pool.map(items, processor);
    }

    public ServiceHealth healthCheck() {
        Runtime runtime = Runtime.getRuntime();
        long total = runtime.totalMemory();
        long used = total - runtime.freeMemory();

        ServiceHealth health = ServiceHealth.builder()
            .service(name)
            .status(ServiceHealth.statusOf(circuitBreaker.getState()))
            .circuitState(circuitBreaker.getState())
            .failureCount(circuitBreaker.getFailureCount())
            .cacheSize(cache.size())
            .rateLimiter(rateLimiter.getStats())
            .pool(pool.getStats())
            .heapUsedMb(toMegabytes(used))
            .heapTotalMb(toMegabytes(total))
            .build();
        logger.debug("Health of {}: {}", name, health.status());
        return health;
    }

    private static double toMegabytes(long bytes) {
        return Math.round(bytes / 1024.0 / 1024.0 * 100) / 100.0;
    }
}
