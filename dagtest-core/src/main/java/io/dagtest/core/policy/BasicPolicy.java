package io.dagtest.core.policy;

/// Every sub-invocation must pass; any error makes the whole node an error.
public final class BasicPolicy implements ResultPolicy {

    /// Shared instance; the policy is stateless.
    public static final BasicPolicy INSTANCE = new BasicPolicy();

    @Override
    public PolicyDecision evaluate(int total, int success, int failure, int error) {
        if (error > 0) {
            return PolicyDecision.ERROR;
        }
        return failure == 0 ? PolicyDecision.PASS : PolicyDecision.FAIL;
    }

    @Override
    public String toString() {
        return "BasicPolicy";
    }
}
