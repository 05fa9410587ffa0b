package io.dagtest.core.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScopeTest {

    private NodeRegistry registry;
    private Scope root;

    @BeforeEach
    void setUp() {
        registry = new NodeRegistry();
        root = Scope.root(registry, "suite");
    }

    @Test
    void shouldQualifyNamesWithEnclosingScopes() {
        Scope child = root.child("db");

        TestCaseNode test = child.test("insert", ctx -> {});

        assertThat(child.getName()).isEqualTo("suite.db");
        assertThat(test.getKey()).isEqualTo("suite.db.insert");
        assertThat(registry.contains("suite.db.insert")).isTrue();
        assertThat(child.getTests()).containsExactly(test);
    }

    @Test
    void shouldWireTestsBetweenFixtures() {
        // Given
        FixtureNode setUp = root.setUp(ctx -> {});
        FixtureNode tearDown = root.tearDown(ctx -> {});
        TestCaseNode a = root.test("a", ctx -> {});
        TestCaseNode b = root.test("b", ctx -> {});

        // When
        root.wire();

        // Then
        assertThat(setUp.getKey()).isEqualTo("suite.setUp");
        assertThat(tearDown.getKey()).isEqualTo("suite.tearDown");
        assertThat(a.getDependencies()).containsExactly(setUp);
        assertThat(b.getDependencies()).containsExactly(setUp);
        assertThat(tearDown.getDependencies()).containsExactlyInAnyOrder(setUp, a, b);
        assertThat(tearDown.getPartner()).isSameAs(setUp);
    }

    @Test
    void shouldNestChildFixturesInsideParentFixtures() {
        // Given
        FixtureNode outerSetUp = root.setUp(ctx -> {});
        FixtureNode outerTearDown = root.tearDown(ctx -> {});
        Scope child = root.child("inner");
        FixtureNode innerSetUp = child.setUp(ctx -> {});
        FixtureNode innerTearDown = child.tearDown(ctx -> {});
        TestCaseNode test = child.test("t", ctx -> {});

        // When
        root.wire();

        // Then
        assertThat(innerSetUp.getDependencies()).containsExactly(outerSetUp);
        assertThat(test.getDependencies()).containsExactly(innerSetUp);
        assertThat(innerTearDown.getDependencies()).contains(test, innerSetUp);
        assertThat(outerTearDown.getDependencies()).contains(innerTearDown, outerSetUp);
        assertThat(outerTearDown.getDependencies()).doesNotContain(test);
    }

    @Test
    void shouldAttachChildTestsToParentFixturesWhenChildHasNone() {
        FixtureNode setUp = root.setUp(ctx -> {});
        FixtureNode tearDown = root.tearDown(ctx -> {});
        TestCaseNode test = root.child("plain").test("t", ctx -> {});

        root.wire();

        assertThat(test.getDependencies()).containsExactly(setUp);
        assertThat(tearDown.getDependencies()).contains(test);
    }

    @Test
    void shouldApplyInheritedBeforeAndAfterEach() {
        TestBody before = ctx -> {};
        TestBody after = ctx -> {};
        root.beforeEach(before).afterEach(after);

        TestCaseNode test = root.child("inner").test("t", ctx -> {});

        assertThat(test.getPre()).isSameAs(before);
        assertThat(test.getPost()).isSameAs(after);
    }

    @Test
    void shouldLetCustomizerConfigureTest() {
        TestCaseNode test =
                root.configure(
                        "flaky", builder -> builder.body(ctx -> {}).repeat(5).expectedFailure(true));

        assertThat(test.getKey()).isEqualTo("suite.flaky");
        assertThat(test.getRepeat()).isEqualTo(5);
        assertThat(test.isExpectedFailure()).isTrue();
        assertThat(root.getTests()).containsExactly(test);
    }

    @Test
    void shouldLetCustomizerReplaceInheritedPre() {
        // Given
        TestBody inherited = ctx -> {};
        TestBody own = ctx -> {};
        root.beforeEach(inherited);

        // When
        TestCaseNode plain = root.test("plain", ctx -> {});
        TestCaseNode custom = root.configure("custom", builder -> builder.pre(own).body(ctx -> {}));

        // Then
        assertThat(plain.getPre()).isSameAs(inherited);
        assertThat(custom.getPre()).isSameAs(own);
    }

    @Test
    void shouldRejectSecondSetUp() {
        root.setUp(ctx -> {});

        assertThatThrownBy(() -> root.setUp(ctx -> {}))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already has a setUp");
    }
}
