package io.dagtest.core.node;

import io.dagtest.core.capture.OutputCapture;
import io.dagtest.core.execution.RunListener;
import io.dagtest.core.policy.BasicPolicy;
import io.dagtest.core.policy.ResultPolicy;
import io.dagtest.core.resource.Resource;
import io.dagtest.core.result.ExpectedExceptions;
import io.dagtest.core.result.TestResult;
import io.dagtest.core.result.TestState;
import io.dagtest.core.strategy.ExecutionStrategy;
import io.dagtest.core.strategy.SerialStrategy;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Vertex of the dependency graph: a test or a fixture.
///
/// Nodes are created once at discovery through {@link #test(String)} or
/// {@link #fixture(String, FixtureRole)}, usually via a {@link NodeRegistry}
/// that deduplicates them by key. Edges are added with
/// {@link #addDependency(TestNode)} at any time before a run starts; a
/// fresh {@link TestResult} is allocated at the start of every run.
///
/// ### Identity
/// Two nodes are equal when their keys are equal. The key is the node's
/// qualified name and the graph vertex id.
///
/// ### Readiness
/// Subclasses decide when a node may run and how skips propagate:
/// - {@link TestCaseNode} runs once every dependency passed
/// - {@link FixtureNode} runs once every dependency finished, whatever the
///   outcome, as long as its partner did not fail
///
/// @implNote Configuration is immutable after construction. The edge sets
/// are only modified during discovery and must not change while a run is
/// in progress; the result reference is volatile.
///
/// @see TestCaseNode
/// @see FixtureNode
/// @see io.dagtest.core.execution.TestScheduler
public abstract class TestNode {

    private final String key;
    private final boolean skip;
    private final boolean expectedFailure;
    private final ExpectedExceptions expectedExceptions;
    private final Duration timeout;
    private final int repeat;
    private final ExecutionStrategy strategy;
    private final ResultPolicy policy;
    private final NodeAttributes attributes;
    private final Map<String, Resource<?>> resources;
    private final TestBody pre;
    private final TestBody body;
    private final TestGenerator generator;
    private final TestBody post;

    private final Set<TestNode> dependencies = new LinkedHashSet<>();
    private final Set<TestNode> dependents = new LinkedHashSet<>();

    private volatile TestResult result;

    protected TestNode(Builder<?, ?> builder) {
        this.key = Objects.requireNonNull(builder.key, "key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if ((builder.body == null) == (builder.generator == null)) {
            throw new IllegalArgumentException(
                    "Node " + key + " needs exactly one of body or generator");
        }
        if (builder.repeat < 1) {
            throw new IllegalArgumentException(
                    "repeat must be positive for " + key + ", got " + builder.repeat);
        }
        if (builder.timeout != null
                && (builder.timeout.isNegative() || builder.timeout.isZero())) {
            throw new IllegalArgumentException(
                    "timeout must be positive for " + key + ", got " + builder.timeout);
        }
        this.skip = builder.skip;
        this.expectedFailure = builder.expectedFailure;
        this.expectedExceptions = builder.expectedExceptions;
        this.timeout = builder.timeout;
        this.repeat = builder.repeat;
        this.strategy = builder.strategy;
        this.policy = builder.policy;
        this.attributes = builder.attributes;
        this.resources = Collections.unmodifiableMap(new LinkedHashMap<>(builder.resources));
        this.pre = builder.pre;
        this.body = builder.body;
        this.generator = builder.generator;
        this.post = builder.post;
    }

    /// Starts building a test.
    ///
    /// @param key qualified test name, not null
    /// @return new builder, never null
    public static TestCaseNode.Builder test(String key) {
        return new TestCaseNode.Builder(key);
    }

    /// Starts building a fixture.
    ///
    /// @param key qualified fixture name, not null
    /// @param role whether the fixture sets up or tears down, not null
    /// @return new builder, never null
    public static FixtureNode.Builder fixture(String key, FixtureRole role) {
        return new FixtureNode.Builder(key, role);
    }

    public String getKey() {
        return key;
    }

    /// Returns whether this node counts as a test in summaries.
    ///
    /// @return TEST or FIXTURE, never null
    public abstract NodeKind getKind();

    public boolean isTest() {
        return getKind() == NodeKind.TEST;
    }

    /// Returns whether the node is marked to be skipped.
    ///
    /// Whether the mark is honored is up to the run's skip rule.
    ///
    /// @return true if marked
    public boolean isSkip() {
        return skip;
    }

    public boolean isExpectedFailure() {
        return expectedFailure;
    }

    public ExpectedExceptions getExpectedExceptions() {
        return expectedExceptions;
    }

    /// Returns the per-phase time limit.
    ///
    /// @return timeout, or null if phases may run indefinitely
    public Duration getTimeout() {
        return timeout;
    }

    public int getRepeat() {
        return repeat;
    }

    public ExecutionStrategy getStrategy() {
        return strategy;
    }

    public ResultPolicy getPolicy() {
        return policy;
    }

    public NodeAttributes getAttributes() {
        return attributes;
    }

    /// Returns the resources the node requires, by requirement name.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Resource<?>> getResources() {
        return resources;
    }

    /// @return pre phase, or null if none
    public TestBody getPre() {
        return pre;
    }

    /// @return plain body, or null if the node uses a generator
    public TestBody getBody() {
        return body;
    }

    /// @return generator, or null if the node uses a plain body
    public TestGenerator getGenerator() {
        return generator;
    }

    /// @return post phase, or null if none
    public TestBody getPost() {
        return post;
    }

    /// Returns whether the node produces several sub-results.
    ///
    /// @return true if the body is repeated or a generator is used
    public boolean isMultiResult() {
        return repeat > 1 || generator != null;
    }

    /// Declares that this node depends on another.
    ///
    /// Updates both edge sets. Adding an existing edge has no effect.
    ///
    /// @param dependency node that must resolve first, not null
    /// @throws IllegalArgumentException if `dependency` is this node
    public void addDependency(TestNode dependency) {
        Objects.requireNonNull(dependency, "dependency must not be null");
        if (dependency.equals(this)) {
            throw new IllegalArgumentException("Node " + key + " cannot depend on itself");
        }
        dependencies.add(dependency);
        dependency.dependents.add(this);
    }

    /// Returns the nodes this node depends on.
    ///
    /// @return unmodifiable view, never null
    public Set<TestNode> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    /// Returns the nodes depending on this node.
    ///
    /// @return unmodifiable view, never null
    public Set<TestNode> getDependents() {
        return Collections.unmodifiableSet(dependents);
    }

    /// Allocates a fresh result for a new run.
    ///
    /// @param capture capture used by the result's phases, not null
    public void prepare(OutputCapture capture) {
        this.result = new TestResult(this, capture);
    }

    /// Returns the result of the current or latest run.
    ///
    /// @return result, or null if the node was never prepared
    public TestResult getResult() {
        return result;
    }

    /// Returns the state in the current run.
    ///
    /// @return state, or null if untouched or never prepared
    public TestState getState() {
        TestResult current = result;
        return current != null ? current.getState() : null;
    }

    /// Moves the result to a new state and notifies the listener.
    ///
    /// @param state target state, not null
    /// @param listener listener to notify, not null
    public void transition(TestState state, RunListener listener) {
        result.transition(state);
        listener.onStateChange(this, state);
    }

    /// Checks whether the node may run now.
    ///
    /// May short-circuit the node to {@link TestState#DEPFAIL} or
    /// {@link TestState#SKIPPED} as a side effect; callers detect that by the
    /// state no longer being null.
    ///
    /// @param listener listener notified of short-circuit transitions, not null
    /// @return true if every readiness condition holds
    public abstract boolean checkReady(RunListener listener);

    /// Marks the node skipped and propagates the skip.
    ///
    /// Dependents are skipped recursively and dependencies are notified,
    /// which lets fixtures nobody needs any more skip themselves. Nodes that
    /// already have a state are left alone.
    ///
    /// @param listener listener notified of every transition, not null
    public void markSkipped(RunListener listener) {
        if (getState() != null) {
            return;
        }
        transition(TestState.SKIPPED, listener);
        for (TestNode dependent : dependents) {
            dependent.markSkipped(listener);
        }
        for (TestNode dependency : dependencies) {
            dependency.dependentSkipped(listener);
        }
    }

    /// Called when a dependent of this node was skipped.
    ///
    /// Tests do not care; fixtures may skip themselves.
    ///
    /// @param listener listener notified of any transition, not null
    protected void dependentSkipped(RunListener listener) {}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof TestNode other && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }

    /// Shared builder for tests and fixtures.
    ///
    /// Required: `key` and exactly one of `body` or `generator`.
    ///
    /// @param <N> node type built
    /// @param <B> concrete builder type, for chaining
    public abstract static class Builder<N extends TestNode, B extends Builder<N, B>> {
        private final String key;
        private boolean skip;
        private boolean expectedFailure;
        private ExpectedExceptions expectedExceptions = ExpectedExceptions.none();
        private Duration timeout;
        private int repeat = 1;
        private ExecutionStrategy strategy = SerialStrategy.INSTANCE;
        private ResultPolicy policy = BasicPolicy.INSTANCE;
        private NodeAttributes attributes = NodeAttributes.empty();
        private final Map<String, Resource<?>> resources = new LinkedHashMap<>();
        private TestBody pre;
        private TestBody body;
        private TestGenerator generator;
        private TestBody post;

        protected Builder(String key) {
            this.key = key;
        }

        protected abstract B self();

        /// Returns the class of the nodes this builder produces.
        ///
        /// @return node class, never null
        protected abstract Class<N> nodeType();

        /// Builds the node.
        ///
        /// @return new node, never null
        /// @throws IllegalArgumentException if the configuration is invalid
        public abstract N build();

        public String getKey() {
            return key;
        }

        public B skip(boolean skip) {
            this.skip = skip;
            return self();
        }

        /// Marks the node as expected to fail.
        ///
        /// @param expectedFailure true maps failures to XFAIL and passes to UOK
        /// @return this builder for chaining
        public B expectedFailure(boolean expectedFailure) {
            this.expectedFailure = expectedFailure;
            return self();
        }

        public B expectedExceptions(ExpectedExceptions expectedExceptions) {
            this.expectedExceptions =
                    Objects.requireNonNull(expectedExceptions, "expectedExceptions must not be null");
            return self();
        }

        /// Sets the time limit applied to each phase call.
        ///
        /// @param timeout positive duration, or null for no limit
        /// @return this builder for chaining
        public B timeout(Duration timeout) {
            this.timeout = timeout;
            return self();
        }

        public B repeat(int repeat) {
            this.repeat = repeat;
            return self();
        }

        public B strategy(ExecutionStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
            return self();
        }

        public B policy(ResultPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return self();
        }

        public B attributes(NodeAttributes attributes) {
            this.attributes = Objects.requireNonNull(attributes, "attributes must not be null");
            return self();
        }

        /// Adds or replaces one attribute.
        ///
        /// @param name attribute name, not null
        /// @param value a `String`, `Number` or `Boolean`, not null
        /// @return this builder for chaining
        public B attribute(String name, Object value) {
            this.attributes = attributes.with(name, value);
            return self();
        }

        /// Requires a resource, available to bodies under `name`.
        ///
        /// @param name requirement name, not null
        /// @param resource the resource, not null
        /// @return this builder for chaining
        public B resource(String name, Resource<?> resource) {
            resources.put(
                    Objects.requireNonNull(name, "name must not be null"),
                    Objects.requireNonNull(resource, "resource must not be null"));
            return self();
        }

        public B pre(TestBody pre) {
            this.pre = pre;
            return self();
        }

        public B body(TestBody body) {
            this.body = body;
            return self();
        }

        public B generator(TestGenerator generator) {
            this.generator = generator;
            return self();
        }

        public B post(TestBody post) {
            this.post = post;
            return self();
        }
    }
}
