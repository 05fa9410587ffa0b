package io.dagtest.core.strategy;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/// Runs every sub-invocation on its own task, with no concurrency cap.
///
/// @see LimitedParallelStrategy for a capped variant
public class UnlimitedParallelStrategy implements ExecutionStrategy {

    @Override
    public Batch prepare(Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        return new ParallelBatch(executor, null);
    }

    @Override
    public String toString() {
        return "UnlimitedParallelStrategy";
    }

    /// Batch counting live calls and signalling waiters when the count drops to zero.
    static final class ParallelBatch implements Batch {

        private final Executor executor;
        private final Semaphore limit;
        private final Object lock = new Object();
        private int live;

        ParallelBatch(Executor executor, Semaphore limit) {
            this.executor = executor;
            this.limit = limit;
        }

        @Override
        public void spawn(Runnable call) {
            Objects.requireNonNull(call, "call must not be null");
            synchronized (lock) {
                live++;
            }
            try {
                executor.execute(() -> runCall(call));
            } catch (RuntimeException e) {
                finished();
                throw e;
            }
        }

        private void runCall(Runnable call) {
            try {
                if (limit != null) {
                    limit.acquireUninterruptibly();
                }
                try {
                    call.run();
                } finally {
                    if (limit != null) {
                        limit.release();
                    }
                }
            } finally {
                finished();
            }
        }

        private void finished() {
            synchronized (lock) {
                live--;
                if (live == 0) {
                    lock.notifyAll();
                }
            }
        }

        @Override
        public void await() throws InterruptedException {
            synchronized (lock) {
                while (live > 0) {
                    lock.wait();
                }
            }
        }
    }
}
