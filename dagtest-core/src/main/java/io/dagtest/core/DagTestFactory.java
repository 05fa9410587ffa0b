package io.dagtest.core;

import io.dagtest.core.capture.OutputCapture;
import io.dagtest.core.capture.ThreadLocalOutputCapture;
import io.dagtest.core.execution.LoggingRunListener;
import io.dagtest.core.execution.RunListener;
import io.dagtest.core.resource.ResourceManager;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Factory for creating and wiring {@link DagTestRunner} instances.
///
/// ### Usage Patterns
///
/// **Defaults**:
/// {@snippet :
/// DagTestRunner runner = DagTestFactory.createRunner();
/// }
///
/// **Builder with explicit collaborators**:
/// {@snippet :
/// DagTestRunner runner = DagTestFactory.builder()
///     .config(DagTestConfig.builder().maxThreads(4).build())
///     .listener(reporter)
///     .capture(new ThreadLocalOutputCapture())
///     .build();
/// }
///
/// @see DagTestRunner
/// @see DagTestConfig
public final class DagTestFactory {

    private DagTestFactory() {}

    /// Creates a runner with default configuration.
    ///
    /// @return a fully-configured runner, never null
    public static DagTestRunner createRunner() {
        return createRunner(new DagTestConfig());
    }

    /// Creates a runner with custom configuration.
    ///
    /// The runner logs through {@link LoggingRunListener} and captures output
    /// with a {@link ThreadLocalOutputCapture}.
    ///
    /// @apiNote **Side effects**: creates a new cached thread pool.
    ///
    /// @param config configuration, not null
    /// @return a fully-configured runner, never null
    public static DagTestRunner createRunner(DagTestConfig config) {
        return builder().config(config).build();
    }

    /// Creates the thread pool used by runners.
    ///
    /// The pool is unbounded; the thread budget is enforced by the scheduler.
    /// Threads are daemons so bodies abandoned after a timeout cannot keep
    /// the JVM alive.
    ///
    /// @param threadNamePrefix prefix of thread names, not null
    /// @return new cached thread pool, never null
    public static ExecutorService createExecutor(String threadNamePrefix) {
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix must not be null");
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory =
                task -> {
                    Thread thread = new Thread(task, threadNamePrefix + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                };
        return Executors.newCachedThreadPool(factory);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link DagTestRunner}.
    ///
    /// Every collaborator is optional; unset ones get the defaults used by
    /// {@link #createRunner(DagTestConfig)}.
    public static final class Builder {
        private DagTestConfig config;
        private ExecutorService executorService;
        private RunListener listener;
        private OutputCapture capture;
        private ResourceManager resourceManager;

        private Builder() {}

        public Builder config(DagTestConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Sets the thread pool; the runner shuts it down on close.
        ///
        /// @param executorService pool without a thread bound, not null
        /// @return this builder for chaining
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Builder listener(RunListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder capture(OutputCapture capture) {
            this.capture = capture;
            return this;
        }

        public Builder resourceManager(ResourceManager resourceManager) {
            this.resourceManager = resourceManager;
            return this;
        }

        public DagTestRunner build() {
            DagTestConfig effective = config != null ? config : new DagTestConfig();
            return new DagTestRunner(
                    effective,
                    executorService != null
                            ? executorService
                            : createExecutor(effective.getThreadNamePrefix()),
                    listener != null ? listener : new LoggingRunListener(),
                    capture != null ? capture : new ThreadLocalOutputCapture(),
                    resourceManager != null ? resourceManager : new ResourceManager());
        }
    }
}
