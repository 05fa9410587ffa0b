package io.dagtest.core.node;

import io.dagtest.core.execution.RunListener;
import io.dagtest.core.result.TestState;
import java.util.Objects;

/// Set-up or tear-down fixture.
///
/// Fixtures are not counted as tests. A fixture runs once every dependency
/// has finished, whatever its outcome, so a tear-down still cleans up after
/// failed tests. A tear-down may be paired with the set-up it undoes; it
/// then depends on that partner and only runs if the partner passed.
///
/// ### Skipping
/// - a fixture honors its own skip only when every dependency other than
///   its partner is skipped too
/// - a fixture whose dependents are all skipped skips itself
public final class FixtureNode extends TestNode {

    private final FixtureRole role;
    private volatile FixtureNode partner;

    private FixtureNode(Builder builder) {
        super(builder);
        this.role = Objects.requireNonNull(builder.role, "role must not be null");
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FIXTURE;
    }

    public FixtureRole getRole() {
        return role;
    }

    /// Returns the set-up this tear-down is paired with.
    ///
    /// @return partner, or null if unpaired
    public FixtureNode getPartner() {
        return partner;
    }

    /// Pairs this fixture with the set-up it undoes.
    ///
    /// Also adds the partner as a dependency. A null partner is ignored.
    ///
    /// @param setUp the partner, may be null
    public void setPartner(FixtureNode setUp) {
        if (setUp == null) {
            return;
        }
        addDependency(setUp);
        this.partner = setUp;
    }

    @Override
    public boolean checkReady(RunListener listener) {
        FixtureNode paired = partner;
        if (paired != null) {
            TestState partnerState = paired.getState();
            if (partnerState != null && partnerState.isFailing()) {
                transition(TestState.DEPFAIL, listener);
                return false;
            }
            if (partnerState == TestState.SKIPPED) {
                transition(TestState.SKIPPED, listener);
                return false;
            }
        }
        for (TestNode dependency : getDependencies()) {
            if (TestState.isPending(dependency.getState())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void markSkipped(RunListener listener) {
        for (TestNode dependency : getDependencies()) {
            if (!dependency.equals(partner) && dependency.getState() != TestState.SKIPPED) {
                return;
            }
        }
        super.markSkipped(listener);
    }

    @Override
    protected void dependentSkipped(RunListener listener) {
        for (TestNode dependent : getDependents()) {
            if (dependent.getState() != TestState.SKIPPED) {
                return;
            }
        }
        super.markSkipped(listener);
    }

    /// Builder for {@link FixtureNode}.
    public static final class Builder extends TestNode.Builder<FixtureNode, Builder> {

        private final FixtureRole role;

        Builder(String key, FixtureRole role) {
            super(key);
            this.role = role;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected Class<FixtureNode> nodeType() {
            return FixtureNode.class;
        }

        @Override
        public FixtureNode build() {
            return new FixtureNode(this);
        }
    }
}
