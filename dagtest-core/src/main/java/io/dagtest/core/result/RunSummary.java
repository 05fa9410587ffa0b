package io.dagtest.core.result;

import io.dagtest.core.resource.ResourceReleaseError;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Aggregate outcome of one scheduling run.
///
/// Counts only cover tests; fixtures are reported through
/// {@link #getResults()} but never counted.
///
/// ### Counting
/// - passes: {@link TestState#OK}, {@link TestState#UOK} and {@link TestState#XFAIL}
/// - failures: {@link TestState#FAIL}, {@link TestState#ERROR} and {@link TestState#DEPFAIL}
/// - a run is successful when it has no failures, no framework errors and
///   no test left without a terminal state
public final class RunSummary {

    private final Map<String, TestResult> results;
    private final Map<TestState, Integer> counts;
    private final int totalTests;
    private final int maxConcurrent;
    private final List<FrameworkError> frameworkErrors;
    private final List<ResourceReleaseError> resourceErrors;
    private final Duration duration;

    private RunSummary(Builder builder) {
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(builder.results));
        this.frameworkErrors = List.copyOf(builder.frameworkErrors);
        this.resourceErrors = List.copyOf(builder.resourceErrors);
        this.maxConcurrent = builder.maxConcurrent;
        this.duration = Objects.requireNonNull(builder.duration, "duration must not be null");

        Map<TestState, Integer> tally = new EnumMap<>(TestState.class);
        int tests = 0;
        for (TestResult result : results.values()) {
            if (!result.getNode().isTest()) {
                continue;
            }
            tests++;
            TestState state = result.getState();
            if (state != null) {
                tally.merge(state, 1, Integer::sum);
            }
        }
        this.counts = Collections.unmodifiableMap(tally);
        this.totalTests = tests;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns every node's result, tests and fixtures alike.
    ///
    /// @return unmodifiable map from node key to result, in registration order
    public Map<String, TestResult> getResults() {
        return results;
    }

    public Optional<TestResult> getResult(String key) {
        return Optional.ofNullable(results.get(key));
    }

    /// Returns how many tests ended in a state.
    ///
    /// @param state the state, not null
    /// @return test count, 0 if none
    public int getCount(TestState state) {
        return counts.getOrDefault(state, 0);
    }

    /// @return unmodifiable map of state to test count, states without tests omitted
    public Map<TestState, Integer> getCounts() {
        return counts;
    }

    public int getTotalTests() {
        return totalTests;
    }

    public int getPassCount() {
        return getCount(TestState.OK) + getCount(TestState.UOK) + getCount(TestState.XFAIL);
    }

    public int getFailureCount() {
        return getCount(TestState.FAIL) + getCount(TestState.ERROR) + getCount(TestState.DEPFAIL);
    }

    public int getSkippedCount() {
        return getCount(TestState.SKIPPED);
    }

    /// Returns the highest number of nodes executing at the same time.
    ///
    /// Counts launched nodes, including ones blocked on the thread budget,
    /// so it may exceed a configured thread limit.
    ///
    /// @return high-water mark of executing nodes
    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public List<FrameworkError> getFrameworkErrors() {
        return frameworkErrors;
    }

    /// Returns failures raised while tearing down resources.
    ///
    /// These do not change any test state.
    ///
    /// @return unmodifiable list, never null
    public List<ResourceReleaseError> getResourceErrors() {
        return resourceErrors;
    }

    public Duration getDuration() {
        return duration;
    }

    /// Returns whether the run passed as a whole.
    ///
    /// @return true if no test failed and the engine reported no error
    public boolean isSuccessful() {
        if (getFailureCount() > 0 || !frameworkErrors.isEmpty()) {
            return false;
        }
        int resolved = 0;
        for (int count : counts.values()) {
            resolved += count;
        }
        return resolved - getCount(TestState.RUNNING) == totalTests;
    }

    @Override
    public String toString() {
        return "RunSummary{total="
                + totalTests
                + ", counts="
                + counts
                + ", maxConcurrent="
                + maxConcurrent
                + ", frameworkErrors="
                + frameworkErrors.size()
                + "}";
    }

    /// Builder for {@link RunSummary}.
    public static final class Builder {
        private final Map<String, TestResult> results = new LinkedHashMap<>();
        private List<FrameworkError> frameworkErrors = List.of();
        private List<ResourceReleaseError> resourceErrors = List.of();
        private int maxConcurrent;
        private Duration duration = Duration.ZERO;

        private Builder() {}

        public Builder result(TestResult result) {
            Objects.requireNonNull(result, "result must not be null");
            results.put(result.getNode().getKey(), result);
            return this;
        }

        public Builder frameworkErrors(List<FrameworkError> frameworkErrors) {
            this.frameworkErrors = Objects.requireNonNull(frameworkErrors);
            return this;
        }

        public Builder resourceErrors(List<ResourceReleaseError> resourceErrors) {
            this.resourceErrors = Objects.requireNonNull(resourceErrors);
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public RunSummary build() {
            return new RunSummary(this);
        }
    }
}
