package io.dagtest.core.strategy;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/// Runs every sub-invocation on its own task, at most `limit` at a time.
///
/// Tasks are launched immediately and block on a semaphore before running
/// their call, so the cap applies to running calls, not to launched tasks.
public final class LimitedParallelStrategy extends UnlimitedParallelStrategy {

    private final int limit;

    /// Creates a strategy with the given concurrency cap.
    ///
    /// @param limit maximum number of concurrently running calls, must be positive
    /// @throws IllegalArgumentException if `limit` is not positive
    public LimitedParallelStrategy(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        this.limit = limit;
    }

    /// Returns the concurrency cap.
    ///
    /// @return maximum number of concurrently running calls
    public int getLimit() {
        return limit;
    }

    @Override
    public Batch prepare(Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        return new ParallelBatch(executor, new Semaphore(limit));
    }

    @Override
    public String toString() {
        return "LimitedParallelStrategy(" + limit + ")";
    }
}
