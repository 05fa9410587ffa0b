package io.dagtest.core.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dagtest.core.exception.DependencyCycleException;
import io.dagtest.core.node.TestCaseNode;
import io.dagtest.core.node.TestNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class CycleDetectorTest {

    private static TestCaseNode node(String key) {
        return TestNode.test(key).body(ctx -> {}).build();
    }

    @Test
    void shouldOrderDependenciesFirst() throws DependencyCycleException {
        TestCaseNode a = node("a");
        TestCaseNode b = node("b");
        TestCaseNode c = node("c");
        c.addDependency(b);
        b.addDependency(a);

        List<TestNode> order = CycleDetector.topologicalOrder(List.of(c, b, a));

        assertThat(order).containsExactly(a, b, c);
    }

    @Test
    void shouldReportCyclePath() {
        // Given: a -> b -> c -> a, plus an unrelated node
        TestCaseNode a = node("a");
        TestCaseNode b = node("b");
        TestCaseNode c = node("c");
        TestCaseNode free = node("free");
        a.addDependency(b);
        b.addDependency(c);
        c.addDependency(a);

        // When / Then
        assertThatThrownBy(() -> CycleDetector.check(List.of(free, a, b, c)))
                .isInstanceOf(DependencyCycleException.class)
                .hasMessage("Dependency cycle detected: a -> b -> c -> a")
                .satisfies(
                        e ->
                                assertThat(((DependencyCycleException) e).getCycle())
                                        .containsExactly("a", "b", "c", "a"));
    }

    @Test
    void shouldIgnoreDependenciesOutsideCollection() {
        TestCaseNode outside = node("outside");
        TestCaseNode a = node("a");
        a.addDependency(outside);

        assertThat(CycleDetector.findCycle(List.of(a))).isEmpty();
    }
}
