package io.dagtest.core.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/// Group of tests sharing set-up and tear-down fixtures, such as a package,
/// a module or a class.
///
/// Scopes nest. {@link #wire()} connects the fixtures and tests of a scope
/// tree:
/// - a scope's set-up depends on the nearest enclosing set-up
/// - the nearest enclosing tear-down depends on a scope's tear-down
/// - every test depends on the innermost set-up above it
/// - the innermost tear-down above a test depends on that test
/// - a scope's tear-down is paired with the same scope's set-up
///
/// Per-test pre and post phases declared with {@link #beforeEach(TestBody)}
/// and {@link #afterEach(TestBody)} apply to tests registered afterwards in
/// this scope and its children, unless the test declares its own.
///
/// ### Example
/// {@snippet :
/// Scope pkg = Scope.root(registry, "db");
/// pkg.setUp(ctx -> startDatabase());
/// pkg.tearDown(ctx -> stopDatabase());
///
/// Scope queries = pkg.child("QueryTest");
/// queries.beforeEach(ctx -> ctx.put("tx", begin()));
/// queries.test("selectsRows", ctx -> assertRows(ctx.get("tx", Tx.class)));
/// pkg.wire();
/// }
public final class Scope {

    private final NodeRegistry registry;
    private final Scope parent;
    private final String name;
    private final List<Scope> children = new ArrayList<>();
    private final List<TestNode> tests = new ArrayList<>();

    private FixtureNode setUp;
    private FixtureNode tearDown;
    private TestBody beforeEach;
    private TestBody afterEach;

    private Scope(NodeRegistry registry, Scope parent, String name) {
        this.registry = registry;
        this.parent = parent;
        this.name = name;
    }

    /// Creates a top-level scope.
    ///
    /// @param registry registry receiving the scope's nodes, not null
    /// @param name scope name, used as the key prefix of its nodes, not null
    /// @return new scope, never null
    public static Scope root(NodeRegistry registry, String name) {
        Objects.requireNonNull(registry, "registry must not be null");
        return new Scope(registry, null, requireName(name));
    }

    /// Creates a nested scope.
    ///
    /// @param childName simple name, appended to this scope's name, not null
    /// @return new child scope, never null
    public Scope child(String childName) {
        Scope child = new Scope(registry, this, name + "." + requireName(childName));
        children.add(child);
        return child;
    }

    /// Returns the qualified name of the scope.
    ///
    /// @return dotted name, never null
    public String getName() {
        return name;
    }

    public Scope getParent() {
        return parent;
    }

    public List<Scope> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<TestNode> getTests() {
        return Collections.unmodifiableList(tests);
    }

    /// Declares the scope's set-up fixture, keyed `<scope>.setUp`.
    ///
    /// @param body fixture body, not null
    /// @return the registered fixture, never null
    /// @throws IllegalStateException if the scope already has a set-up
    public FixtureNode setUp(TestBody body) {
        if (setUp != null) {
            throw new IllegalStateException("Scope " + name + " already has a setUp fixture");
        }
        setUp =
                registry.register(
                        TestNode.fixture(name + ".setUp", FixtureRole.SETUP)
                                .body(Objects.requireNonNull(body, "body must not be null")));
        return setUp;
    }

    /// Declares the scope's tear-down fixture, keyed `<scope>.tearDown`.
    ///
    /// @param body fixture body, not null
    /// @return the registered fixture, never null
    /// @throws IllegalStateException if the scope already has a tear-down
    public FixtureNode tearDown(TestBody body) {
        if (tearDown != null) {
            throw new IllegalStateException("Scope " + name + " already has a tearDown fixture");
        }
        tearDown =
                registry.register(
                        TestNode.fixture(name + ".tearDown", FixtureRole.TEARDOWN)
                                .body(Objects.requireNonNull(body, "body must not be null")));
        return tearDown;
    }

    public FixtureNode getSetUp() {
        return setUp;
    }

    public FixtureNode getTearDown() {
        return tearDown;
    }

    /// Sets the pre phase given to tests registered from now on.
    ///
    /// @param pre pre phase, or null to inherit from the enclosing scope again
    /// @return this scope for chaining
    public Scope beforeEach(TestBody pre) {
        this.beforeEach = pre;
        return this;
    }

    /// Sets the post phase given to tests registered from now on.
    ///
    /// @param post post phase, or null to inherit from the enclosing scope again
    /// @return this scope for chaining
    public Scope afterEach(TestBody post) {
        this.afterEach = post;
        return this;
    }

    /// Registers a test with a plain body.
    ///
    /// @param testName simple name, not null
    /// @param body test body, not null
    /// @return the registered test, never null
    public TestCaseNode test(String testName, TestBody body) {
        Objects.requireNonNull(body, "body must not be null");
        return configure(testName, builder -> builder.body(body));
    }

    /// Registers a test configured by a customizer.
    ///
    /// The builder is keyed `<scope>.<testName>` and carries the inherited
    /// pre and post phases before the customizer runs, so the customizer may
    /// replace them.
    ///
    /// @param testName simple name, not null
    /// @param customizer configures the builder, not null
    /// @return the registered test, never null
    public TestCaseNode configure(String testName, Consumer<TestCaseNode.Builder> customizer) {
        Objects.requireNonNull(customizer, "customizer must not be null");
        TestCaseNode.Builder builder = TestNode.test(name + "." + requireName(testName));
        TestBody pre = effectiveBeforeEach();
        TestBody post = effectiveAfterEach();
        if (pre != null) {
            builder.pre(pre);
        }
        if (post != null) {
            builder.post(post);
        }
        customizer.accept(builder);
        TestCaseNode node = registry.register(builder);
        if (!tests.contains(node)) {
            tests.add(node);
        }
        return node;
    }

    /// Adds fixture edges for this scope and every scope below it.
    ///
    /// Safe to call more than once; existing edges are not duplicated.
    public void wire() {
        wire(new ArrayList<>(), new ArrayList<>());
    }

    private void wire(List<FixtureNode> setUps, List<FixtureNode> tearDowns) {
        List<FixtureNode> scopeSetUps = new ArrayList<>(setUps);
        List<FixtureNode> scopeTearDowns = new ArrayList<>(tearDowns);
        if (setUp != null) {
            if (!scopeSetUps.isEmpty()) {
                setUp.addDependency(scopeSetUps.get(scopeSetUps.size() - 1));
            }
            scopeSetUps.add(setUp);
        }
        if (tearDown != null) {
            if (!scopeTearDowns.isEmpty()) {
                scopeTearDowns.get(scopeTearDowns.size() - 1).addDependency(tearDown);
            }
            tearDown.setPartner(setUp);
            scopeTearDowns.add(tearDown);
        }
        for (TestNode test : tests) {
            if (!scopeSetUps.isEmpty()) {
                test.addDependency(scopeSetUps.get(scopeSetUps.size() - 1));
            }
            if (!scopeTearDowns.isEmpty()) {
                scopeTearDowns.get(scopeTearDowns.size() - 1).addDependency(test);
            }
        }
        for (Scope child : children) {
            child.wire(scopeSetUps, scopeTearDowns);
        }
    }

    private TestBody effectiveBeforeEach() {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.beforeEach != null) {
                return scope.beforeEach;
            }
        }
        return null;
    }

    private TestBody effectiveAfterEach() {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.afterEach != null) {
                return scope.afterEach;
            }
        }
        return null;
    }

    private static String requireName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        return name;
    }

    @Override
    public String toString() {
        return "Scope{" + name + "}";
    }
}
