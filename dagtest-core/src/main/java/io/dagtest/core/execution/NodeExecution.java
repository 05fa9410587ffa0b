package io.dagtest.core.execution;

import io.dagtest.core.capture.OutputCapture;
import io.dagtest.core.node.SubTest;
import io.dagtest.core.node.TestBody;
import io.dagtest.core.node.TestContext;
import io.dagtest.core.node.TestGenerator;
import io.dagtest.core.node.TestNode;
import io.dagtest.core.resource.ResourceHandle;
import io.dagtest.core.resource.ResourceManager;
import io.dagtest.core.result.ExpectedExceptions;
import io.dagtest.core.result.Phase;
import io.dagtest.core.result.PhaseScope;
import io.dagtest.core.result.TestResult;
import io.dagtest.core.result.TestState;
import io.dagtest.core.result.TestTimeoutError;
import io.dagtest.core.strategy.ExecutionStrategy;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Runs one node through its phases.
///
/// ### Protocol
/// 1. transition to RUNNING and notify
/// 2. acquire the node's resources; a failure counts as a failed PRE phase
/// 3. PRE phase, if declared
/// 4. TEST phase, whatever PRE did; multi-result nodes fan out through the
///    node's {@link ExecutionStrategy}. A failed PRE still decides the outcome.
/// 5. POST phase, if declared, always
///
/// PRE and TEST are left out only when the resources could not be acquired.
/// 6. release resources with the outcome, transition to the terminal state
///    and notify
///
/// ### Timeouts
/// With a timeout set on the node, or a run-wide default, each phase call
/// runs on the executor while the node thread waits up to the limit. A call
/// that overruns is abandoned, not interrupted: it keeps its thread until it
/// returns on its own, the phase records a {@link TestTimeoutError}, and
/// whatever the call writes is dropped rather than reaching a later phase.
///
/// @implNote Not thread-safe; one instance per node execution. The executor
/// must not bound its thread count, or timed calls could wait forever for a
/// thread held by the node waiting on them.
final class NodeExecution {

    private static final Logger logger = Logger.getLogger(NodeExecution.class.getName());

    private final TestNode node;
    private final Executor executor;
    private final OutputCapture capture;
    private final ResourceManager resources;
    private final RunListener listener;
    private final Duration timeout;

    NodeExecution(
            TestNode node,
            Executor executor,
            OutputCapture capture,
            ResourceManager resources,
            RunListener listener,
            Duration defaultTimeout) {
        this.node = node;
        this.executor = executor;
        this.capture = capture;
        this.resources = resources;
        this.listener = listener;
        this.timeout = node.getTimeout() != null ? node.getTimeout() : defaultTimeout;
    }

    void run() {
        node.transition(TestState.RUNNING, listener);
        TestResult result = node.getResult();

        ResourceManager.Collected collected = null;
        Map<String, ResourceHandle<?>> handles = Map.of();
        boolean resourcesReady = true;
        if (!node.getResources().isEmpty()) {
            try {
                collected = resources.collect(node.getResources());
                handles = collected.getHandles();
            } catch (Exception e) {
                resourcesReady = false;
                logger.warning("Resources for " + node.getKey() + " failed: " + e.getMessage());
                try (PhaseScope scope = result.accumulate(Phase.PRE, ExpectedExceptions.none())) {
                    scope.fail(e);
                }
            }
        }
        TestContext context = new TestContext(node, handles);

        TestBody pre = node.getPre();
        if (pre != null && resourcesReady) {
            try (PhaseScope scope = result.accumulate(Phase.PRE, ExpectedExceptions.none())) {
                scope.execute(timed(() -> pre.run(context)));
            }
        }

        if (resourcesReady) {
            if (node.isMultiResult()) {
                runSubInvocations(result, context);
            } else {
                try (PhaseScope scope =
                        result.accumulate(Phase.TEST, node.getExpectedExceptions())) {
                    scope.execute(timed(() -> node.getBody().run(context)));
                }
            }
        }

        TestBody post = node.getPost();
        if (post != null) {
            try (PhaseScope scope = result.accumulate(Phase.POST, ExpectedExceptions.none())) {
                scope.execute(timed(() -> post.run(context)));
            }
        }

        TestState outcome = result.resolveState();
        if (collected != null) {
            collected.release(outcome);
        }
        node.transition(outcome, listener);
    }

    private void runSubInvocations(TestResult result, TestContext context) {
        ExecutionStrategy.Batch batch = node.getStrategy().prepare(executor);
        TestGenerator generator = node.getGenerator();
        if (generator == null) {
            for (int i = 0; i < node.getRepeat(); i++) {
                spawn(batch, result, node.getKey(), node.getBody(), context);
            }
        } else {
            try {
                generator.generate(subTest -> emit(batch, result, subTest, context), context);
            } catch (Throwable t) {
                logger.fine("Generator of " + node.getKey() + " raised " + t);
                try (PhaseScope scope =
                        result.accumulateSubInvocation(node.getKey(), ExpectedExceptions.none())) {
                    scope.fail(t);
                }
            }
        }
        try {
            batch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            try (PhaseScope scope =
                    result.accumulateSubInvocation(node.getKey(), ExpectedExceptions.none())) {
                scope.fail(e);
            }
        }
    }

    private void emit(
            ExecutionStrategy.Batch batch, TestResult result, SubTest subTest, TestContext context) {
        String name = subTest.name() != null ? subTest.name() : node.getKey();
        TestContext subContext = context.withArguments(subTest.args(), subTest.kwargs());
        for (int i = 0; i < node.getRepeat(); i++) {
            spawn(batch, result, name, subTest.body(), subContext);
        }
    }

    private void spawn(
            ExecutionStrategy.Batch batch,
            TestResult result,
            String name,
            TestBody body,
            TestContext context) {
        String id = result.reserveId(name);
        batch.spawn(
                () -> {
                    try (PhaseScope scope =
                            result.openSubInvocation(id, node.getExpectedExceptions())) {
                        scope.execute(timed(() -> body.run(context)));
                    }
                });
    }

    private PhaseScope.Call timed(PhaseScope.Call call) {
        if (timeout == null) {
            return call;
        }
        return () -> {
            FutureTask<Void> task =
                    new FutureTask<>(
                            () -> {
                                call.call();
                                return null;
                            });
            OutputCapture.Fork fork = capture.fork(task);
            executor.execute(fork);
            try {
                task.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
                fork.join();
            } catch (TimeoutException e) {
                fork.abandon();
                logger.warning(node.getKey() + " timed out after " + timeout.toMillis() + " ms");
                throw new TestTimeoutError(timeout);
            } catch (ExecutionException e) {
                fork.join();
                Throwable cause = e.getCause();
                if (cause instanceof Error error) {
                    throw error;
                }
                if (cause instanceof Exception exception) {
                    throw exception;
                }
                throw e;
            }
        };
    }
}
