package io.dagtest.core.execution;

import io.dagtest.core.capture.OutputCapture;
import io.dagtest.core.node.TestNode;
import io.dagtest.core.resource.ResourceManager;
import io.dagtest.core.result.FrameworkError;
import io.dagtest.core.result.TestResult;
import io.dagtest.core.result.TestState;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/// Event-driven walker of the dependency graph.
///
/// The scheduler keeps a waiting set of nodes that still need a decision.
/// A node is launched as soon as its readiness check passes; when it
/// finishes, its dependents are re-examined. Nodes whose check
/// short-circuits them to DEPFAIL or SKIPPED leave the waiting set without
/// running and have their dependents re-examined in turn. The run ends when
/// nothing is waiting and nothing is executing.
///
/// ### Thread Budget
/// With `maxThreads > 0`, launched node tasks acquire a slot from a
/// semaphore before executing, so at most `maxThreads` node bodies run at
/// once. The reported high-water mark counts launched tasks and may exceed
/// the budget.
///
/// ### Failure Handling
/// Anything escaping the engine's own handling of a node is recorded as a
/// {@link FrameworkError} and the node is forced to {@link TestState#ERROR}.
/// If nothing is executing while nodes are still waiting, which only a
/// dependency cycle can cause, the waiting nodes are forced to ERROR
/// instead of hanging the run.
///
/// ### Usage
/// {@snippet :
/// TestScheduler scheduler = TestScheduler.builder()
///         .nodes(registry.getNodes())
///         .executor(executor)
///         .maxThreads(4)
///         .build();
/// List<TestResult> results = scheduler.run();
/// }
///
/// @implNote **Thread-safe**. The waiting set and the task counters are
/// guarded by one lock. Readiness checks run under that lock so a node is
/// launched at most once. A scheduler runs once; create a new one for
/// every run.
public final class TestScheduler {

    private static final Logger logger = Logger.getLogger(TestScheduler.class.getName());

    private final List<TestNode> nodes;
    private final Executor executor;
    private final Semaphore capacity;
    private final SkipRule skipRule;
    private final RunListener listener;
    private final OutputCapture capture;
    private final ResourceManager resources;
    private final Duration defaultTimeout;

    private final Object lock = new Object();
    private final Set<TestNode> waiting = new HashSet<>();
    private final CountDownLatch done = new CountDownLatch(1);
    private final List<FrameworkError> frameworkErrors = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean();

    private int active;
    private int maxActive;
    private boolean seeding;

    private TestScheduler(Builder builder) {
        this.nodes = List.copyOf(builder.nodes);
        this.executor = Objects.requireNonNull(builder.executor, "executor must not be null");
        if (builder.maxThreads < 0) {
            throw new IllegalArgumentException(
                    "maxThreads must not be negative, got " + builder.maxThreads);
        }
        this.capacity = builder.maxThreads > 0 ? new Semaphore(builder.maxThreads) : null;
        this.skipRule = builder.skipRule;
        this.listener = builder.listener;
        this.capture = builder.capture;
        this.resources = builder.resources;
        this.defaultTimeout = builder.defaultTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Runs every node and waits for the run to finish.
    ///
    /// Allocates fresh results, notifies {@link RunListener#onRunStart},
    /// applies the skip rule, then schedules the rest.
    ///
    /// @return one result per node, in the order the nodes were given
    /// @throws InterruptedException if interrupted while waiting; nodes
    ///     already launched keep running
    /// @throws IllegalStateException if this scheduler already ran
    public List<TestResult> run() throws InterruptedException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("A scheduler can only run once");
        }
        for (TestNode node : nodes) {
            node.prepare(capture);
        }
        listener.onRunStart(nodes);
        for (TestNode node : nodes) {
            if (node.getState() == null && skipRule.shouldSkip(node)) {
                node.markSkipped(listener);
            }
        }

        List<TestNode> seeds = new ArrayList<>();
        synchronized (lock) {
            for (TestNode node : nodes) {
                if (node.getState() == null) {
                    waiting.add(node);
                    seeds.add(node);
                }
            }
            seeding = true;
        }
        logger.fine("Scheduling " + seeds.size() + " of " + nodes.size() + " nodes");
        try {
            spawn(seeds);
        } finally {
            synchronized (lock) {
                seeding = false;
                checkDone();
            }
        }

        done.await();

        List<TestResult> results = new ArrayList<>(nodes.size());
        for (TestNode node : nodes) {
            results.add(node.getResult());
        }
        return results;
    }

    /// Returns the highest number of node tasks launched at the same time.
    ///
    /// @return high-water mark, 0 before the run
    public int getMaxConcurrent() {
        synchronized (lock) {
            return maxActive;
        }
    }

    /// Returns the engine failures recorded so far.
    ///
    /// @return snapshot, never null
    public List<FrameworkError> getFrameworkErrors() {
        synchronized (lock) {
            return List.copyOf(frameworkErrors);
        }
    }

    private void spawn(Collection<TestNode> candidates) {
        Deque<TestNode> queue = new ArrayDeque<>(candidates);
        while (!queue.isEmpty()) {
            TestNode node = queue.pollFirst();
            synchronized (lock) {
                if (!waiting.contains(node)) {
                    continue;
                }
                if (node.getState() != null) {
                    // resolved out of band, e.g. a fixture skipped with its last dependent
                    waiting.remove(node);
                    queue.addAll(node.getDependents());
                    continue;
                }
                boolean ready;
                try {
                    ready = node.checkReady(listener);
                } catch (RuntimeException e) {
                    waiting.remove(node);
                    recordFrameworkError(node, "Readiness check failed", e);
                    queue.addAll(node.getDependents());
                    continue;
                }
                if (ready) {
                    waiting.remove(node);
                    launch(node, queue);
                } else if (node.getState() != null) {
                    waiting.remove(node);
                    queue.addAll(node.getDependents());
                }
            }
        }
    }

    private void launch(TestNode node, Deque<TestNode> queue) {
        active++;
        maxActive = Math.max(maxActive, active);
        try {
            executor.execute(() -> runNode(node));
        } catch (RejectedExecutionException e) {
            active--;
            recordFrameworkError(node, "Executor rejected node", e);
            queue.addAll(node.getDependents());
        }
    }

    private void runNode(TestNode node) {
        boolean acquired = false;
        try {
            if (capacity != null) {
                capacity.acquire();
                acquired = true;
            }
            new NodeExecution(node, executor, capture, resources, listener, defaultTimeout)
                    .run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFrameworkErrorLocked(node, "Interrupted while waiting for a thread slot", e);
        } catch (Throwable t) {
            recordFrameworkErrorLocked(node, "Node execution failed", t);
        }
        try {
            spawn(node.getDependents());
        } finally {
            if (acquired) {
                capacity.release();
            }
            synchronized (lock) {
                active--;
                checkDone();
            }
        }
    }

    private void checkDone() {
        if (active > 0 || seeding || done.getCount() == 0) {
            return;
        }
        if (!waiting.isEmpty()) {
            List<TestNode> stalled = new ArrayList<>(waiting);
            waiting.clear();
            logger.warning(stalled.size() + " nodes can never become ready: " + stalled);
            for (TestNode node : stalled) {
                recordFrameworkError(node, "Node can never become ready", null);
            }
        }
        done.countDown();
    }

    private void recordFrameworkErrorLocked(TestNode node, String message, Throwable cause) {
        synchronized (lock) {
            recordFrameworkError(node, message, cause);
        }
    }

    private void recordFrameworkError(TestNode node, String message, Throwable cause) {
        frameworkErrors.add(new FrameworkError(node.getKey(), message, cause));
        logger.warning(
                "Framework error on "
                        + node.getKey()
                        + ": "
                        + message
                        + (cause != null ? " (" + cause + ")" : ""));
        TestResult result = node.getResult();
        if (result != null && result.forceError()) {
            try {
                listener.onStateChange(node, TestState.ERROR);
            } catch (RuntimeException e) {
                logger.warning("Listener failed for " + node.getKey() + ": " + e.getMessage());
            }
        }
    }

    /// Builder for {@link TestScheduler}.
    ///
    /// Required: `executor`. Defaults: no nodes, unlimited threads,
    /// {@link SkipRule#byFlag()}, {@link RunListener#NOOP},
    /// {@link OutputCapture#NONE} and a fresh {@link ResourceManager}.
    public static final class Builder {
        private final List<TestNode> nodes = new ArrayList<>();
        private Executor executor;
        private int maxThreads;
        private SkipRule skipRule = SkipRule.byFlag();
        private RunListener listener = RunListener.NOOP;
        private OutputCapture capture = OutputCapture.NONE;
        private ResourceManager resources = new ResourceManager();
        private Duration defaultTimeout;

        private Builder() {}

        public Builder nodes(Collection<? extends TestNode> nodes) {
            this.nodes.addAll(Objects.requireNonNull(nodes, "nodes must not be null"));
            return this;
        }

        /// Sets the executor running node tasks, sub-invocations and timed calls.
        ///
        /// @param executor executor without a thread bound, not null
        /// @return this builder for chaining
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /// Sets the thread budget.
        ///
        /// @param maxThreads maximum number of node bodies running at once,
        ///     0 for unlimited
        /// @return this builder for chaining
        public Builder maxThreads(int maxThreads) {
            this.maxThreads = maxThreads;
            return this;
        }

        public Builder skipRule(SkipRule skipRule) {
            this.skipRule = Objects.requireNonNull(skipRule, "skipRule must not be null");
            return this;
        }

        public Builder listener(RunListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        public Builder capture(OutputCapture capture) {
            this.capture = Objects.requireNonNull(capture, "capture must not be null");
            return this;
        }

        public Builder resources(ResourceManager resources) {
            this.resources = Objects.requireNonNull(resources, "resources must not be null");
            return this;
        }

        /// Sets the per-phase time limit for nodes that declare none.
        ///
        /// @param defaultTimeout positive duration, or null for no limit
        /// @return this builder for chaining
        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public TestScheduler build() {
            return new TestScheduler(this);
        }
    }
}
