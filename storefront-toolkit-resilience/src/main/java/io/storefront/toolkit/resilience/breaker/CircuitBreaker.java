package io.storefront.toolkit.resilience.breaker;

import io.storefront.toolkit.core.async.Futures;
import io.storefront.toolkit.core.error.CircuitOpenException;
import io.storefront.toolkit.core.time.Timeouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Isolates a failing dependency behind a three-state circuit.
 *
 * <h3>State Transitions:</h3>
 * <pre>
 * CLOSED ──[threshold failures]──> OPEN
 *   ▲                                │
 *   │                      [resetTimeout elapsed,
 *   │                        next call admitted]
 *   │                                │
 *   └──[trial succeeds]── HALF_OPEN ◄┘
 *                            │
 *                            └──[trial fails]──> OPEN
 * </pre>
 * <p>
 * HALF_OPEN admits a single trial call. Calls arriving while the trial is in flight fail with
 * {@link CircuitOpenException} exactly as they would while OPEN. Every admitted call is raced
 * against {@code callTimeout}; a timeout is a failure like any other.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * CircuitBreaker breaker = new CircuitBreaker("catalog", CircuitBreakerConfig.defaults(), scheduler, clock);
 *
 * breaker.execute(() -> catalog.load(id))
 *     .exceptionally(error -> fallbackProduct(id));
 * }</pre>
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final List<Consumer<CircuitTransition>> listeners = new CopyOnWriteArrayList<>();

    // Guarded by this
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private boolean trialInFlight;

    public CircuitBreaker(String name, CircuitBreakerConfig config, ScheduledExecutorService scheduler, Clock clock) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");

        logger.info("[BREAKERS] {} created - threshold: {}, callTimeout: {}ms, resetTimeout: {}ms",
            name, config.threshold(), config.callTimeout().toMillis(), config.resetTimeout().toMillis());
    }

    /**
     * Runs the operation if the circuit admits it.
     *
     * @param factory the protected operation
     * @param <T>     result type
     * @return the operation's outcome, or a future failed with {@link CircuitOpenException}
     * (operation not invoked) or {@code OperationTimeoutException}
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletableFuture<T>> factory) {
        Objects.requireNonNull(factory, "factory cannot be null");

        CircuitTransition transition = null;
        boolean admittedAsTrial;
        synchronized (this) {
            switch (state) {
                case OPEN -> {
                    long sinceFailure = clock.millis() - lastFailureTime.toEpochMilli();
                    if (sinceFailure <= config.resetTimeout().toMillis()) {
                        logger.trace("[BREAKERS] {} OPEN, rejecting call", name);
                        return CompletableFuture.failedFuture(new CircuitOpenException(name));
                    }
                    transition = moveTo(CircuitState.HALF_OPEN);
                    trialInFlight = true;
                    admittedAsTrial = true;
                }
                case HALF_OPEN -> {
                    if (trialInFlight) {
                        logger.trace("[BREAKERS] {} HALF_OPEN trial in flight, rejecting call", name);
                        return CompletableFuture.failedFuture(
                            new CircuitOpenException(name, "Circuit breaker '" + name + "' is HALF_OPEN, trial in progress"));
                    }
                    trialInFlight = true;
                    admittedAsTrial = true;
                }
                default -> admittedAsTrial = false;
            }
        }
        if (transition != null) {
            logger.warn("[BREAKERS] {} entered HALF_OPEN - admitting one trial call", name);
            notifyListeners(transition);
        }

        boolean trial = admittedAsTrial;
        CompletableFuture<T> result = new CompletableFuture<>();
        Timeouts.withTimeout(
            Futures.invoke(factory),
            config.callTimeout(),
            scheduler,
            "Circuit breaker '" + name + "' call timed out after " + config.callTimeout().toMillis() + "ms"
        ).whenComplete((value, error) -> {
            if (error != null) {
                onFailure(trial);
                result.completeExceptionally(Futures.unwrap(error));
            } else {
                onSuccess(trial);
                result.complete(value);
            }
        });
        return result;
    }

    private void onSuccess(boolean trial) {
        CircuitTransition transition = null;
        int cleared;
        synchronized (this) {
            if (trial) {
                trialInFlight = false;
            }
            cleared = failureCount;
            failureCount = 0;
            if (state != CircuitState.CLOSED) {
                transition = moveTo(CircuitState.CLOSED);
            }
        }
        if (transition != null) {
            logger.info("[BREAKERS] {} CIRCUIT CLOSED - recovery successful", name);
            notifyListeners(transition);
        } else if (cleared > 0) {
            logger.debug("[BREAKERS] {} recovered - {} failures cleared", name, cleared);
        }
    }

    private void onFailure(boolean trial) {
        CircuitTransition transition = null;
        int failures;
        CircuitState current;
        synchronized (this) {
            if (trial) {
                trialInFlight = false;
            }
            failures = ++failureCount;
            lastFailureTime = clock.instant();
            current = state;
            if (state == CircuitState.HALF_OPEN
                || (state == CircuitState.CLOSED && failureCount >= config.threshold())) {
                transition = moveTo(CircuitState.OPEN);
            }
        }

        if (transition == null) {
            logger.warn("[BREAKERS] {} failure #{} (threshold: {})", name, failures, config.threshold());
            return;
        }
        if (current == CircuitState.HALF_OPEN) {
            logger.error("[BREAKERS] {} CIRCUIT RE-OPENED - trial call failed", name);
        } else {
            logger.error("[BREAKERS] {} CIRCUIT TRIPPED - {} consecutive failures, now OPEN", name, failures);
        }
        notifyListeners(transition);
    }

    // Caller holds the monitor
    private CircuitTransition moveTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        return new CircuitTransition(name, previous, next, clock.instant());
    }

    private void notifyListeners(CircuitTransition transition) {
        for (Consumer<CircuitTransition> listener : listeners) {
            try {
                listener.accept(transition);
            } catch (RuntimeException e) {
                logger.warn("[BREAKERS] {} transition listener failed: {}", name, e.getMessage(), e);
            }
        }
    }

    /**
     * Manually resets the breaker (operator intervention).
     * <p>
     * Forces the circuit back to CLOSED regardless of the current state and clears the failure count.
     */
    public void reset() {
        CircuitTransition transition;
        synchronized (this) {
            transition = state != CircuitState.CLOSED ? moveTo(CircuitState.CLOSED) : null;
            failureCount = 0;
            lastFailureTime = null;
            trialInFlight = false;
        }
        logger.warn("[BREAKERS] {} MANUAL RESET - now CLOSED", name);
        if (transition != null) {
            notifyListeners(transition);
        }
    }

    /**
     * Registers a listener for state changes. Listeners run on the thread that caused the change,
     * outside the breaker's lock.
     */
    public void onTransition(Consumer<CircuitTransition> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    /**
     * @return time of the most recent failure, or null if none since creation or reset
     */
    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }
}
