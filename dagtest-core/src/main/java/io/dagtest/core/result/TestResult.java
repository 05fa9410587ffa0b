package io.dagtest.core.result;

import io.dagtest.core.capture.OutputCapture;
import io.dagtest.core.node.TestNode;
import io.dagtest.core.policy.PolicyDecision;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Outcome of one scheduling run of a test or fixture.
///
/// A fresh result is allocated for every node at the start of a run. It
/// tracks the node's {@link TestState}, one {@link TestMessage} per phase,
/// and, for multi-result nodes, one message per sub-invocation together with
/// success, failure and error counters fed to the node's
/// {@link io.dagtest.core.policy.ResultPolicy}.
///
/// ### State Machine
/// The state only moves forward: `null -> RUNNING -> terminal`, or
/// `null -> DEPFAIL | SKIPPED`. Any other transition is rejected with an
/// `IllegalStateException`.
///
/// ### Phase Accounting
/// {@snippet :
/// try (PhaseScope scope = result.accumulate(Phase.TEST, node.getExpectedExceptions())) {
///     scope.execute(() -> body.run(context));
/// }
/// }
///
/// @implNote **Thread-safe**. The state is volatile so readiness checks on
/// other threads see completed dependencies; everything else is guarded by
/// the result's own lock, since parallel strategies record sub-invocations
/// concurrently.
///
/// @see PhaseScope
/// @see TestState
public final class TestResult {

    private final TestNode node;
    private final OutputCapture capture;
    private final Object lock = new Object();

    private volatile TestState state;

    private final Map<Phase, TestMessage> messages = new EnumMap<>(Phase.class);
    private final List<String> subInvocationIds = new ArrayList<>();
    private final Set<String> reservedIds = new HashSet<>();
    private final Map<String, TestMessage> subInvocations = new HashMap<>();
    private final Map<String, Integer> idCollisions = new HashMap<>();

    private Outcome preOutcome;
    private Outcome testOutcome;
    private int total;
    private int successes;
    private int failures;
    private int errors;
    private PolicyDecision decision;

    private Instant startedAt;
    private Instant finishedAt;
    private long startSequence;
    private long finishSequence;

    /// Creates an empty result for a node.
    ///
    /// @param node owning node, not null
    /// @param capture capture cleared and collected around every phase, not null
    public TestResult(TestNode node, OutputCapture capture) {
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.capture = Objects.requireNonNull(capture, "capture must not be null");
    }

    public TestNode getNode() {
        return node;
    }

    /// Returns the current state.
    ///
    /// @return state, or null if the node has not been touched in this run
    public TestState getState() {
        return state;
    }

    /// Returns whether the node passed.
    ///
    /// Expected failures ({@link TestState#XFAIL}) do not count as passed here;
    /// they only count as passes in run summaries.
    ///
    /// @return true for {@link TestState#OK} and {@link TestState#UOK}
    public boolean isPassed() {
        TestState current = state;
        return current != null && current.isResolvedPositive();
    }

    /// Returns whether the node ended in {@link TestState#ERROR}.
    ///
    /// @return true if the node raised an unexpected exception
    public boolean isError() {
        return state == TestState.ERROR;
    }

    /// Returns whether this result aggregates several sub-invocations.
    ///
    /// @return true if the node repeats its body or generates sub-tests
    public boolean isMultiResult() {
        return node.isMultiResult();
    }

    /// Opens accounting for a single-result phase.
    ///
    /// Clears the calling task's captured output. PRE and TEST phases decide
    /// the node's outcome; the POST phase only records a message.
    ///
    /// @param phase phase about to run, not null
    /// @param expected exceptions the phase may raise, not null
    /// @return scope to close once the phase finishes, never null
    public PhaseScope accumulate(Phase phase, ExpectedExceptions expected) {
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
        return new PhaseScope(this, phase, node.getKey(), expected, false);
    }

    /// Opens accounting for one sub-invocation of a multi-result node.
    ///
    /// The id is reserved immediately, so message order follows the order
    /// in which sub-invocations were opened, not the order they finish.
    ///
    /// @param name requested sub-invocation name, not null
    /// @param expected exceptions the sub-invocation may raise, not null
    /// @return scope to close once the sub-invocation finishes, never null
    public PhaseScope accumulateSubInvocation(String name, ExpectedExceptions expected) {
        return openSubInvocation(reserveId(name), expected);
    }

    /// Opens accounting for a sub-invocation whose id was already reserved.
    ///
    /// @param id id returned by {@link #reserveId(String)}, not null
    /// @param expected exceptions the sub-invocation may raise, not null
    /// @return scope to close once the sub-invocation finishes, never null
    public PhaseScope openSubInvocation(String id, ExpectedExceptions expected) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
        return new PhaseScope(this, Phase.TEST, id, expected, true);
    }

    /// Reserves a unique sub-invocation id.
    ///
    /// The first request for a name gets the name itself; later ones get
    /// `name#1`, `name#2`, and so on, skipping ids already taken.
    ///
    /// @param name requested name, not null
    /// @return unique id, never null
    public String reserveId(String name) {
        Objects.requireNonNull(name, "name must not be null");
        synchronized (lock) {
            String id = name;
            int counter = idCollisions.getOrDefault(name, 0);
            while (reservedIds.contains(id)) {
                counter++;
                id = name + "#" + counter;
            }
            idCollisions.put(name, counter);
            reservedIds.add(id);
            subInvocationIds.add(id);
            return id;
        }
    }

    OutputCapture capture() {
        return capture;
    }

    void record(Phase phase, String id, Outcome outcome, TestMessage message, boolean subInvocation) {
        synchronized (lock) {
            if (subInvocation) {
                total++;
                switch (outcome) {
                    case PASS -> successes++;
                    case FAIL -> failures++;
                    case ERROR -> errors++;
                }
                decision = node.getPolicy().evaluate(total, successes, failures, errors);
                subInvocations.put(
                        id, message != null ? message : new TestMessage(phase, id, List.of(), null));
                return;
            }
            if (phase == Phase.PRE) {
                preOutcome = outcome;
            } else if (phase == Phase.TEST) {
                testOutcome = outcome;
            }
            if (message != null) {
                messages.put(phase, message);
            }
        }
    }

    /// Moves to a new state.
    ///
    /// Used by the engine; the listener is notified by the caller.
    ///
    /// @param next target state, not null
    /// @throws IllegalStateException if the transition is not allowed
    public void transition(TestState next) {
        Objects.requireNonNull(next, "next must not be null");
        synchronized (lock) {
            TestState current = state;
            boolean allowed =
                    current == null
                            ? next == TestState.RUNNING
                                    || next == TestState.DEPFAIL
                                    || next == TestState.SKIPPED
                            : current == TestState.RUNNING
                                    && next != TestState.RUNNING
                                    && next != TestState.DEPFAIL
                                    && next != TestState.SKIPPED;
            if (!allowed) {
                throw new IllegalStateException(
                        "Illegal transition for " + node.getKey() + ": " + current + " -> " + next);
            }
            if (next == TestState.RUNNING) {
                startedAt = Instant.now();
                startSequence = System.nanoTime();
            } else {
                finishedAt = Instant.now();
                finishSequence = System.nanoTime();
            }
            state = next;
        }
    }

    /// Forces the node into {@link TestState#ERROR} after an engine failure.
    ///
    /// Only applies while the node is untouched or running.
    ///
    /// @return true if the state changed, false if the node had already
    ///     reached a terminal state
    public boolean forceError() {
        synchronized (lock) {
            if (state != null && state != TestState.RUNNING) {
                return false;
            }
            finishedAt = Instant.now();
            finishSequence = System.nanoTime();
            state = TestState.ERROR;
            return true;
        }
    }

    /// Computes the terminal state from the recorded phase outcomes.
    ///
    /// A failed PRE phase decides the outcome on its own. Otherwise a
    /// multi-result node uses its policy's latest decision and a
    /// single-result node its TEST phase outcome. The expected-failure flag
    /// then maps pass to {@link TestState#UOK} and failure to
    /// {@link TestState#XFAIL}.
    ///
    /// @return terminal state, never null
    public TestState resolveState() {
        Outcome outcome;
        synchronized (lock) {
            if (preOutcome != null && preOutcome != Outcome.PASS) {
                outcome = preOutcome;
            } else if (node.isMultiResult()) {
                PolicyDecision current =
                        decision != null
                                ? decision
                                : node.getPolicy().evaluate(total, successes, failures, errors);
                outcome =
                        current.passed()
                                ? Outcome.PASS
                                : current.error() ? Outcome.ERROR : Outcome.FAIL;
            } else {
                outcome = testOutcome != null ? testOutcome : Outcome.PASS;
            }
        }
        return switch (outcome) {
            case PASS -> node.isExpectedFailure() ? TestState.UOK : TestState.OK;
            case FAIL -> node.isExpectedFailure() ? TestState.XFAIL : TestState.FAIL;
            case ERROR -> TestState.ERROR;
        };
    }

    /// Returns whether the PRE phase ran and did not pass.
    ///
    /// @return true if PRE decides the node's outcome
    public boolean isPreFailed() {
        synchronized (lock) {
            return preOutcome != null && preOutcome != Outcome.PASS;
        }
    }

    /// Returns the message recorded for a phase.
    ///
    /// For multi-result nodes the TEST slot is empty; use
    /// {@link #getSubInvocations()} instead.
    ///
    /// @param phase the phase, not null
    /// @return message, or null if the phase produced nothing to report
    public TestMessage getMessage(Phase phase) {
        synchronized (lock) {
            return messages.get(phase);
        }
    }

    /// Returns the phase messages in PRE, TEST, POST order.
    ///
    /// @return unmodifiable list, never null
    public List<TestMessage> getMessages() {
        synchronized (lock) {
            return List.copyOf(messages.values());
        }
    }

    /// Returns the per-invocation messages of a multi-result node.
    ///
    /// @return unmodifiable map from sub-invocation id to message, in
    ///     reservation order, never null
    public Map<String, TestMessage> getSubInvocations() {
        synchronized (lock) {
            Map<String, TestMessage> ordered = new LinkedHashMap<>();
            for (String id : subInvocationIds) {
                TestMessage message = subInvocations.get(id);
                if (message != null) {
                    ordered.put(id, message);
                }
            }
            return Collections.unmodifiableMap(ordered);
        }
    }

    public int getTotal() {
        synchronized (lock) {
            return total;
        }
    }

    public int getSuccessCount() {
        synchronized (lock) {
            return successes;
        }
    }

    public int getFailureCount() {
        synchronized (lock) {
            return failures;
        }
    }

    public int getErrorCount() {
        synchronized (lock) {
            return errors;
        }
    }

    /// Returns when the node started running.
    ///
    /// @return start time, or null if the node never ran
    public Instant getStartedAt() {
        synchronized (lock) {
            return startedAt;
        }
    }

    /// Returns when the node reached its terminal state.
    ///
    /// @return finish time, or null if not finished
    public Instant getFinishedAt() {
        synchronized (lock) {
            return finishedAt;
        }
    }

    /// Returns the monotonic `System.nanoTime()` reading taken on start.
    ///
    /// Only comparable with other readings from the same JVM.
    ///
    /// @return nano time, or 0 if the node never ran
    public long getStartSequence() {
        synchronized (lock) {
            return startSequence;
        }
    }

    /// Returns the monotonic `System.nanoTime()` reading taken on finish.
    ///
    /// @return nano time, or 0 if not finished
    public long getFinishSequence() {
        synchronized (lock) {
            return finishSequence;
        }
    }

    @Override
    public String toString() {
        return "TestResult{node=" + node.getKey() + ", state=" + state + "}";
    }
}
