package io.dagtest.core.node;

/// Distinguishes tests, which are counted in summaries, from fixtures.
public enum NodeKind {
    TEST,
    FIXTURE
}
