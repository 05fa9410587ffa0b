package io.dagtest.core.policy;

/// Passes when the share of successful sub-invocations reaches a threshold.
///
/// Any error makes the node an error. When nothing failed the threshold is
/// not consulted, so a node with no recorded sub-invocations passes.
///
/// ### Example
/// With a threshold of 80, a node repeated ten times passes with two
/// failures and fails with three.
public final class ThresholdPolicy implements ResultPolicy {

    private final double threshold;

    /// Creates a policy with the given pass threshold.
    ///
    /// @param threshold minimum percentage of successes, between 0 and 100 inclusive
    /// @throws IllegalArgumentException if the threshold is out of range
    public ThresholdPolicy(double threshold) {
        if (threshold < 0.0 || threshold > 100.0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException(
                    "threshold must be between 0 and 100, got " + threshold);
        }
        this.threshold = threshold;
    }

    /// Returns the configured pass threshold.
    ///
    /// @return percentage between 0 and 100
    public double getThreshold() {
        return threshold;
    }

    @Override
    public PolicyDecision evaluate(int total, int success, int failure, int error) {
        if (error > 0) {
            return PolicyDecision.ERROR;
        }
        if (failure == 0) {
            return PolicyDecision.PASS;
        }
        double percent = (success * 100.0) / total;
        return percent >= threshold ? PolicyDecision.PASS : PolicyDecision.FAIL;
    }

    @Override
    public String toString() {
        return "ThresholdPolicy(" + threshold + "%)";
    }
}
