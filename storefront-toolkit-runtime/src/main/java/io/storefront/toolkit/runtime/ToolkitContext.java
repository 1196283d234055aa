package io.storefront.toolkit.runtime;

import io.storefront.toolkit.core.config.ToolkitConfig;
import io.storefront.toolkit.core.error.ErrorTracker;
import io.storefront.toolkit.core.time.Schedulers;
import io.storefront.toolkit.resilience.breaker.CircuitBreaker;
import io.storefront.toolkit.resilience.breaker.CircuitBreakerConfig;
import io.storefront.toolkit.resilience.cache.TtlCache;
import io.storefront.toolkit.resilience.pool.ConcurrencyPool;
import io.storefront.toolkit.resilience.ratelimit.RateLimiter;
import io.storefront.toolkit.resilience.retry.RetryExecutor;
import io.storefront.toolkit.resilience.retry.RetryPolicy;
import io.storefront.toolkit.streams.change.ChangeStream;
import io.storefront.toolkit.streams.connection.EventConnections;
import io.storefront.toolkit.streams.data.DataStreamer;
import io.storefront.toolkit.streams.health.HealthCheckStream;
import io.storefront.toolkit.streams.hub.StreamHub;
import io.storefront.toolkit.streams.search.SearchStream;
import io.storefront.toolkit.streams.telemetry.LogStream;
import io.storefront.toolkit.streams.telemetry.MetricsStream;
import io.storefront.toolkit.streams.telemetry.NotificationStream;
import lombok.AccessLevel;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.WeakHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runtime that owns the shared infrastructure every toolkit component needs.
 * <p>
 * One context holds the scheduler used for timeouts, delays and polling, the stream hub and the
 * telemetry streams, and the error tracker. Components created through its factories pick up
 * their defaults from configuration and are closed along with the context.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * try (ToolkitContext toolkit = ToolkitContext.create()) {
 *     ResilientService catalog = toolkit.service("catalog");
 *     catalog.executeCached("products", repository::loadAll).join();
 * }
 * }</pre>
 */
@Getter
public class ToolkitContext implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ToolkitContext.class);

    private final ToolkitConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final StreamHub streamHub;
    private final LogStream logStream;
    private final MetricsStream metricsStream;
    private final NotificationStream notificationStream;
    private final HealthCheckStream healthCheckStream;
    private final ErrorTracker errorTracker;

    @Getter(AccessLevel.NONE)
    private final Map<String, ResilientService> services = new ConcurrentHashMap<>();
    @Getter(AccessLevel.NONE)
    private final Set<AutoCloseable> closeables = Collections.synchronizedSet(Collections.newSetFromMap(new WeakHashMap<>()));
    @Getter(AccessLevel.NONE)
    private volatile boolean closed;

    private ToolkitContext(ToolkitConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");

        this.scheduler = Schedulers.newScheduler("toolkit", config.getInt("scheduler.threads", 2));
        this.streamHub = new StreamHub(clock);
        this.logStream = new LogStream(clock);
        this.metricsStream = new MetricsStream(config.getInt("metrics.max-per-type", 100), clock);
        this.notificationStream = new NotificationStream();
        this.healthCheckStream = new HealthCheckStream(
            config.getDuration("health.check-interval-ms", Duration.ofSeconds(30)), scheduler, clock);
        this.errorTracker = new ErrorTracker();

        logger.info("Toolkit context created ({})", config.context());
    }

    /**
     * Context over the global configuration and the system clock.
     */
    public static ToolkitContext create() {
        return new ToolkitContext(ToolkitConfig.global(), Clock.systemUTC());
    }

    public static ToolkitContext from(ToolkitConfig config) {
        return from(config, Clock.systemUTC());
    }

    /**
     * Context over explicit configuration. Services layer their component files over it through
     * {@link ToolkitConfig#withComponent(String)}.
     */
    public static ToolkitContext from(ToolkitConfig config, Clock clock) {
        return new ToolkitContext(config, clock);
    }

    // ========================================================================
    // Resilience components
    // ========================================================================

    public ConcurrencyPool newPool() {
        return newPool(config.getInt("pool.concurrency", 5));
    }

    public ConcurrencyPool newPool(int concurrency) {
        return new ConcurrencyPool(concurrency);
    }

    public CircuitBreaker newCircuitBreaker(String name) {
        return newCircuitBreaker(name, CircuitBreakerConfig.from(config));
    }

    public CircuitBreaker newCircuitBreaker(String name, CircuitBreakerConfig breakerConfig) {
        CircuitBreaker breaker = new CircuitBreaker(name, breakerConfig, scheduler, clock);
        breaker.onTransition(transition -> streamHub.emitEvent("circuit-transition", transition));
        return breaker;
    }

    public RetryExecutor newRetryExecutor() {
        return newRetryExecutor(RetryPolicy.from(config));
    }

    public RetryExecutor newRetryExecutor(RetryPolicy policy) {
        return new RetryExecutor(scheduler, policy);
    }

    public <V> TtlCache<V> newCache() {
        return newCache(config.getDuration("cache.ttl-ms", Duration.ofMinutes(5)));
    }

    public <V> TtlCache<V> newCache(Duration ttl) {
        return new TtlCache<>(ttl, clock);
    }

    public RateLimiter newRateLimiter() {
        return RateLimiter.from(config, scheduler, clock);
    }

    // ========================================================================
    // Streams (closed with the context)
    // ========================================================================

    public <T> DataStreamer<T> newDataStreamer(
        Supplier<CompletableFuture<List<T>>> fetch,
        Function<? super T, String> keyExtractor
    ) {
        Duration interval = config.getDuration("stream.poll-interval-ms", Duration.ofSeconds(5));
        return track(new DataStreamer<>(fetch, interval, keyExtractor, scheduler));
    }

    public <T> SearchStream<T> newSearchStream(Function<String, CompletableFuture<List<T>>> searchFunction) {
        return track(new SearchStream<>(
            searchFunction,
            config.getDuration("search.debounce-ms", SearchStream.DEFAULT_DEBOUNCE),
            config.getInt("search.min-query-length", SearchStream.DEFAULT_MIN_QUERY_LENGTH),
            scheduler));
    }

    public <T> ChangeStream<T> newChangeStream(Supplier<CompletableFuture<List<T>>> fetchChanges) {
        Duration interval = config.getDuration("changes.poll-interval-ms", Duration.ofSeconds(1));
        return track(new ChangeStream<>(fetchChanges, interval, scheduler));
    }

    public EventConnections newEventConnections() {
        return track(new EventConnections());
    }

    private <C extends AutoCloseable> C track(C closeable) {
        if (closed) {
            throw new IllegalStateException("Toolkit context is closed");
        }
        closeables.add(closeable);
        return closeable;
    }

    // Streams closed or dropped by their owners leave the weak set on their own
    int trackedCount() {
        return closeables.size();
    }

    // ========================================================================
    // Services
    // ========================================================================

    /**
     * Resilient service for a component, created on first use from
     * {@code toolkit-{name}.properties} layered over this context's configuration.
     */
    public ResilientService service(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (closed) {
            throw new IllegalStateException("Toolkit context is closed");
        }
        return services.computeIfAbsent(name, this::newService);
    }

    private ResilientService newService(String name) {
        ToolkitConfig serviceConfig = config.withComponent(name);
        ResilientService service = ResilientService.builder()
            .name(name)
            .cache(newCache(serviceConfig.getDuration("cache.ttl-ms", Duration.ofMinutes(5))))
            .circuitBreaker(newCircuitBreaker(name, CircuitBreakerConfig.from(serviceConfig)))
            .rateLimiter(RateLimiter.from(serviceConfig, scheduler, clock))
            .retryExecutor(newRetryExecutor(RetryPolicy.from(serviceConfig)))
            .pool(newPool(serviceConfig.getInt("pool.concurrency", 5)))
            .metricsStream(metricsStream)
            .logStream(logStream)
            .errorTracker(errorTracker)
            .clock(clock)
            .build();
        logger.info("Created resilient service: {} ({})", name, serviceConfig.context());
        return service;
    }

    public Set<String> getServiceNames() {
        return Collections.unmodifiableSet(new TreeSet<>(services.keySet()));
    }

    /**
     * Health of every service created so far, by name.
     */
    public Map<String, ServiceHealth> healthCheckAll() {
        Map<String, ServiceHealth> health = new TreeMap<>();
        services.forEach((name, service) -> health.put(name, service.healthCheck()));
        return health;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes every tracked stream, the health and hub streams, then the scheduler. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Shutting down toolkit context...");

        List<AutoCloseable> toClose;
        synchronized (closeables) {
            toClose = new ArrayList<>(closeables);
            closeables.clear();
        }
        for (AutoCloseable closeable : toClose) {
            closeQuietly(closeable);
        }
        closeQuietly(healthCheckStream);
        closeQuietly(streamHub);
        services.clear();

        Schedulers.shutdown(scheduler, config.getLong("scheduler.shutdown-timeout-ms", 1000L));
        logger.info("Toolkit context shut down");
    }

    private void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            logger.error("Failed to close {}", closeable.getClass().getSimpleName(), e);
        }
    }
}
