package io.storefront.toolkit.resilience.pool;

/**
 * Point-in-time view of a {@link ConcurrencyPool}.
 *
 * @param running     slots currently held
 * @param waiting     acquirers queued for a slot
 * @param concurrency configured bound
 */
public record PoolStats(int running, int waiting, int concurrency) {

    public int available() {
        return concurrency - running;
    }
}
