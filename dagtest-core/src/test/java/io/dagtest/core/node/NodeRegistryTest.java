package io.dagtest.core.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dagtest.core.exception.NodeNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NodeRegistryTest {

    private NodeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new NodeRegistry();
    }

    @Test
    void shouldReturnExistingNodeForDuplicateKey() {
        TestCaseNode first = registry.register(TestNode.test("a").body(ctx -> {}));
        TestCaseNode second = registry.register(TestNode.test("a").body(ctx -> {}).repeat(3));

        assertThat(second).isSameAs(first);
        assertThat(second.getRepeat()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void shouldRejectDuplicateKeyOfOtherKind() {
        registry.register(TestNode.test("a").body(ctx -> {}));

        assertThatThrownBy(
                        () ->
                                registry.register(
                                        TestNode.fixture("a", FixtureRole.SETUP).body(ctx -> {})))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void shouldKeepRegistrationOrderAndSeparateTests() {
        FixtureNode setUp = registry.register(TestNode.fixture("s.setUp", FixtureRole.SETUP)
                .body(ctx -> {}));
        TestCaseNode b = registry.register(TestNode.test("b").body(ctx -> {}));
        TestCaseNode a = registry.register(TestNode.test("a").body(ctx -> {}));

        assertThat(registry.getNodes()).containsExactly(setUp, b, a);
        assertThat(registry.getTests()).containsExactly(b, a);
    }

    @Test
    void shouldLookUpNodesByKey() throws NodeNotFoundException {
        TestCaseNode a = registry.register(TestNode.test("a").body(ctx -> {}));

        assertThat(registry.getOrThrow("a")).isSameAs(a);
        assertThat(registry.find("missing")).isEmpty();
        assertThatThrownBy(() -> registry.getOrThrow("missing"))
                .isInstanceOf(NodeNotFoundException.class)
                .hasMessage("Node not found: missing");
    }

    @Test
    void shouldRegisterPrebuiltNodes() {
        TestCaseNode node = TestNode.test("a").body(ctx -> {}).build();

        assertThat(registry.register(node)).isSameAs(node);
        assertThat(registry.contains("a")).isTrue();
    }

    @Test
    void shouldReturnExistingNodeForPrebuiltDuplicate() {
        TestCaseNode first = registry.register(TestNode.test("a").body(ctx -> {}));
        TestCaseNode duplicate = TestNode.test("a").body(ctx -> {}).build();

        assertThat(registry.register(duplicate)).isSameAs(first);
    }

    @Test
    void shouldRejectPrebuiltNodeOfAnotherType() {
        registry.register(TestNode.test("a").body(ctx -> {}));
        FixtureNode fixture = TestNode.fixture("a", FixtureRole.SETUP).body(ctx -> {}).build();

        assertThatThrownBy(() -> registry.register(fixture))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Key a is already registered as TestCaseNode, cannot register FixtureNode");
    }
}
