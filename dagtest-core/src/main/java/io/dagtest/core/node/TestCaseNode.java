package io.dagtest.core.node;

import io.dagtest.core.execution.RunListener;
import io.dagtest.core.result.TestState;

/// Regular test, counted in run summaries.
///
/// Runs only once every dependency passed ({@link TestState#OK} or
/// {@link TestState#UOK}). A failing dependency short-circuits it to
/// {@link TestState#DEPFAIL}, a skipped one to {@link TestState#SKIPPED}.
public final class TestCaseNode extends TestNode {

    private TestCaseNode(Builder builder) {
        super(builder);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TEST;
    }

    @Override
    public boolean checkReady(RunListener listener) {
        for (TestNode dependency : getDependencies()) {
            TestState state = dependency.getState();
            if (state != null && state.isFailing()) {
                transition(TestState.DEPFAIL, listener);
                return false;
            }
            if (state == TestState.SKIPPED) {
                transition(TestState.SKIPPED, listener);
                return false;
            }
            if (state == null || !state.isResolvedPositive()) {
                return false;
            }
        }
        return true;
    }

    /// Builder for {@link TestCaseNode}.
    public static final class Builder extends TestNode.Builder<TestCaseNode, Builder> {

        Builder(String key) {
            super(key);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected Class<TestCaseNode> nodeType() {
            return TestCaseNode.class;
        }

        @Override
        public TestCaseNode build() {
            return new TestCaseNode(this);
        }
    }
}
