package io.dagtest.core.strategy;

import java.util.concurrent.Executor;

/// Decides how the sub-invocations of one multi-result node are run.
///
/// A node whose body is repeated or generates sub-tests hands every
/// sub-invocation to a {@link Batch} obtained from {@link #prepare(Executor)},
/// then waits for the batch before running its post-test phase.
///
/// ### Usage
/// {@snippet :
/// ExecutionStrategy.Batch batch = strategy.prepare(executor);
/// for (Runnable call : calls) {
///     batch.spawn(call);
/// }
/// batch.await();
/// }
///
/// @implNote Strategies hold no per-batch state, so one instance may serve
/// any number of nodes running at the same time.
///
/// @see SerialStrategy
/// @see UnlimitedParallelStrategy
/// @see LimitedParallelStrategy
public interface ExecutionStrategy {

    /// Starts a new batch of sub-invocations.
    ///
    /// @param executor executor for calls that run concurrently, not null
    /// @return a fresh batch, never null
    Batch prepare(Executor executor);

    /// One preparation cycle of a strategy.
    interface Batch {

        /// Arranges for a call to run, synchronously or on another thread.
        ///
        /// The call must not throw; callers record outcomes themselves.
        ///
        /// @param call the sub-invocation, not null
        void spawn(Runnable call);

        /// Blocks until every call spawned on this batch has completed.
        ///
        /// @throws InterruptedException if interrupted while waiting
        void await() throws InterruptedException;
    }
}
