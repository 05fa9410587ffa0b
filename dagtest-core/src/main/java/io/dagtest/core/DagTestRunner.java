package io.dagtest.core;

import io.dagtest.core.capture.OutputCapture;
import io.dagtest.core.exception.DependencyCycleException;
import io.dagtest.core.execution.RunListener;
import io.dagtest.core.execution.SkipRule;
import io.dagtest.core.execution.TestScheduler;
import io.dagtest.core.graph.CycleDetector;
import io.dagtest.core.node.NodeRegistry;
import io.dagtest.core.node.TestNode;
import io.dagtest.core.resource.ResourceManager;
import io.dagtest.core.result.RunSummary;
import io.dagtest.core.result.TestResult;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Entry point for running a dependency graph of tests.
///
/// Owns the thread pool used by every run and closes it in {@link #close()}.
/// Each call to {@link #run(Collection)} validates the graph, schedules it
/// with a fresh {@link TestScheduler}, drains the resource pool and returns
/// a {@link RunSummary}. Runs on one runner must not overlap, since nodes
/// carry the result of their latest run.
///
/// ### Usage
/// {@snippet :
/// try (DagTestRunner runner = DagTestFactory.createRunner(config)) {
///     RunSummary summary = runner.run(registry);
///     System.exit(summary.isSuccessful() ? 0 : 1);
/// }
/// }
///
/// @apiNote Create instances via {@link DagTestFactory} rather than direct
/// construction.
///
/// @see DagTestFactory
/// @see DagTestConfig
public final class DagTestRunner implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(DagTestRunner.class.getName());

    private final DagTestConfig config;
    private final ExecutorService executorService;
    private final RunListener listener;
    private final OutputCapture capture;
    private final ResourceManager resourceManager;

    /// Creates a runner from its collaborators.
    ///
    /// @param config run configuration, not null
    /// @param executorService thread pool without a thread bound, not null
    /// @param listener lifecycle listener, not null
    /// @param capture output capture boundary, not null
    /// @param resourceManager resource pool, not null
    public DagTestRunner(
            DagTestConfig config,
            ExecutorService executorService,
            RunListener listener,
            OutputCapture capture,
            ResourceManager resourceManager) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.capture = Objects.requireNonNull(capture, "capture must not be null");
        this.resourceManager =
                Objects.requireNonNull(resourceManager, "resourceManager must not be null");
    }

    /// Runs every node of a registry.
    ///
    /// @param registry registry holding the graph, not null
    /// @return aggregate outcome, never null
    /// @throws DependencyCycleException if cycle detection is enabled and
    ///     the graph has a cycle; nothing runs in that case
    /// @throws InterruptedException if interrupted while waiting for the run
    public RunSummary run(NodeRegistry registry)
            throws DependencyCycleException, InterruptedException {
        Objects.requireNonNull(registry, "registry must not be null");
        return run(registry.getNodes());
    }

    /// Runs the given nodes.
    ///
    /// Dependencies outside the collection are never scheduled, so nodes
    /// depending on them can only end in an engine error. Pass the complete
    /// graph.
    ///
    /// @param nodes nodes to run, not null
    /// @return aggregate outcome, never null
    /// @throws DependencyCycleException if cycle detection is enabled and
    ///     the graph has a cycle; nothing runs in that case
    /// @throws InterruptedException if interrupted while waiting for the run
    public RunSummary run(Collection<? extends TestNode> nodes)
            throws DependencyCycleException, InterruptedException {
        Objects.requireNonNull(nodes, "nodes must not be null");
        if (config.isDetectCycles()) {
            CycleDetector.check(nodes);
        }

        TestScheduler scheduler =
                TestScheduler.builder()
                        .nodes(nodes)
                        .executor(executorService)
                        .maxThreads(config.getMaxThreads())
                        .defaultTimeout(config.getDefaultTimeout())
                        .skipRule(skipRule())
                        .listener(listener)
                        .capture(capture)
                        .resources(resourceManager)
                        .build();

        long started = System.nanoTime();
        List<TestResult> results;
        try {
            results = scheduler.run();
        } finally {
            resourceManager.releaseAll();
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - started);

        RunSummary.Builder summary =
                RunSummary.builder()
                        .frameworkErrors(scheduler.getFrameworkErrors())
                        .resourceErrors(resourceManager.drainErrors())
                        .maxConcurrent(scheduler.getMaxConcurrent())
                        .duration(duration);
        results.forEach(summary::result);
        RunSummary built = summary.build();

        if (!built.getFrameworkErrors().isEmpty()) {
            logger.warning(
                    "Run finished with " + built.getFrameworkErrors().size() + " framework errors");
        }
        listener.onRunComplete(built);
        return built;
    }

    public DagTestConfig getConfig() {
        return config;
    }

    public ResourceManager getResourceManager() {
        return resourceManager;
    }

    /// Builds the skip rule selected by the configuration.
    ///
    /// @return the rule, never null
    SkipRule skipRule() {
        if (config.isNoSkip()) {
            return SkipRule.none();
        }
        if (config.getSkipRule() != null) {
            return SkipRule.parse(config.getSkipRule());
        }
        return SkipRule.byFlag();
    }

    /// Shuts down the underlying executor service.
    ///
    /// @implNote Calls `ExecutorService.shutdown()`, which does not block.
    /// Bodies abandoned after a timeout keep their thread until they return.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
