package io.storefront.toolkit.resilience.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Right to run one operation inside a {@link ConcurrencyPool}.
 * <p>
 * Releasing is idempotent: only the first {@link #release()} (or {@link #close()}) returns the
 * slot to the pool.
 */
public final class PoolSlot implements AutoCloseable {
    private final ConcurrencyPool pool;
    private final AtomicBoolean released = new AtomicBoolean(false);

    PoolSlot(ConcurrencyPool pool) {
        this.pool = pool;
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            pool.releaseSlot();
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        release();
    }
}
