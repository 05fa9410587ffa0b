package io.dagtest.core.policy;

/// Turns running counts of sub-invocation outcomes into an overall verdict.
///
/// Only consulted for multi-result nodes, i.e. nodes repeated more than once
/// or whose body generates sub-tests. The policy is re-evaluated after every
/// sub-invocation, so it must be a pure function of its arguments.
///
/// ### Contracts
/// - **Precondition**: `success + failure + error == total`
/// - **Postcondition**: never returns null
///
/// @see BasicPolicy
/// @see ThresholdPolicy
@FunctionalInterface
public interface ResultPolicy {

    /// Computes the overall verdict.
    ///
    /// @param total number of sub-invocations recorded so far
    /// @param success number that passed
    /// @param failure number that failed an assertion
    /// @param error number that raised an unexpected exception
    /// @return the verdict, never null
    PolicyDecision evaluate(int total, int success, int failure, int error);
}
