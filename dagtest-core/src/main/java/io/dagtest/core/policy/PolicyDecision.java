package io.dagtest.core.policy;

/// Overall verdict of a {@link ResultPolicy}.
///
/// @param passed whether the node as a whole passed
/// @param error whether the node as a whole is an error; only allowed when
///     `passed` is false
public record PolicyDecision(boolean passed, boolean error) {

    public static final PolicyDecision PASS = new PolicyDecision(true, false);
    public static final PolicyDecision FAIL = new PolicyDecision(false, false);
    public static final PolicyDecision ERROR = new PolicyDecision(false, true);

    public PolicyDecision {
        if (passed && error) {
            throw new IllegalArgumentException("A passing decision cannot be an error");
        }
    }
}
