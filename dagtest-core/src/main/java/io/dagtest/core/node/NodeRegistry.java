package io.dagtest.core.node;

import io.dagtest.core.exception.NodeNotFoundException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Collection of every node taking part in a run, keyed by qualified name.
///
/// Discovery registers nodes here instead of in process-wide state, so
/// several independent graphs can coexist. Registering a key twice returns
/// the node already registered, which lets discovery code visit the same
/// declaration more than once.
///
/// @implNote Thread-safe. All methods synchronize on the registry; iteration
/// order is registration order.
///
/// @see Scope for wiring fixtures around groups of tests
public class NodeRegistry {

    private static final Logger logger = Logger.getLogger(NodeRegistry.class.getName());

    private final Map<String, TestNode> nodes = new LinkedHashMap<>();

    /// Builds and registers a node unless its key is already taken.
    ///
    /// @param builder builder of the node, not null
    /// @param <N> node type
    /// @return the registered node with the builder's key, never null
    /// @throws IllegalStateException if the key is taken by a node of another type
    public synchronized <N extends TestNode> N register(TestNode.Builder<N, ?> builder) {
        Objects.requireNonNull(builder, "builder must not be null");
        TestNode existing = nodes.get(builder.getKey());
        if (existing != null) {
            return castExisting(existing, builder.nodeType());
        }
        N node = builder.build();
        nodes.put(node.getKey(), node);
        logger.fine("Registered " + node.getKind() + " " + node.getKey());
        return node;
    }

    /// Registers an already built node unless its key is already taken.
    ///
    /// @param node the node, not null
    /// @return the registered node with that key, of the same class as
    ///     `node`, never null
    /// @throws IllegalStateException if the key is taken by a node of another type
    public synchronized TestNode register(TestNode node) {
        Objects.requireNonNull(node, "node must not be null");
        TestNode existing = nodes.get(node.getKey());
        if (existing != null) {
            return castExisting(existing, node.getClass());
        }
        nodes.put(node.getKey(), node);
        logger.fine("Registered " + node.getKind() + " " + node.getKey());
        return node;
    }

    public synchronized Optional<TestNode> find(String key) {
        return Optional.ofNullable(nodes.get(key));
    }

    /// Returns the node registered under a key.
    ///
    /// @param key qualified name, not null
    /// @return the node, never null
    /// @throws NodeNotFoundException if no node has that key
    public synchronized TestNode getOrThrow(String key) throws NodeNotFoundException {
        TestNode node = nodes.get(key);
        if (node == null) {
            throw new NodeNotFoundException("Node not found: " + key);
        }
        return node;
    }

    public synchronized boolean contains(String key) {
        return nodes.containsKey(key);
    }

    /// Returns every registered node.
    ///
    /// @return snapshot in registration order, never null
    public synchronized List<TestNode> getNodes() {
        return List.copyOf(nodes.values());
    }

    /// Returns the registered tests, fixtures excluded.
    ///
    /// @return snapshot in registration order, never null
    public synchronized List<TestNode> getTests() {
        List<TestNode> tests = new ArrayList<>();
        for (TestNode node : nodes.values()) {
            if (node.isTest()) {
                tests.add(node);
            }
        }
        return tests;
    }

    public synchronized int size() {
        return nodes.size();
    }

    private static <N extends TestNode> N castExisting(TestNode existing, Class<N> type) {
        if (!type.isInstance(existing)) {
            throw new IllegalStateException(
                    "Key "
                            + existing.getKey()
                            + " is already registered as "
                            + existing.getClass().getSimpleName()
                            + ", cannot register "
                            + type.getSimpleName());
        }
        return type.cast(existing);
    }
}
