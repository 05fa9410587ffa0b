package io.dagtest.core.graph;

import io.dagtest.core.exception.DependencyCycleException;
import io.dagtest.core.node.TestNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Finds dependency cycles before a run starts.
///
/// Uses Kahn's algorithm: nodes are peeled off in dependency order, and
/// whatever cannot be peeled off lies on, or depends on, a cycle. One
/// concrete cycle is then extracted from the remainder for the error
/// message.
public final class CycleDetector {

    private CycleDetector() {}

    /// Returns a dependency order of the nodes.
    ///
    /// Dependencies outside the collection are ignored.
    ///
    /// @param nodes nodes to order, not null
    /// @return every node after all of its dependencies, never null
    /// @throws DependencyCycleException if the nodes contain a cycle
    public static List<TestNode> topologicalOrder(Collection<? extends TestNode> nodes)
            throws DependencyCycleException {
        Set<TestNode> members = new LinkedHashSet<>(nodes);
        Map<TestNode, Integer> pending = new HashMap<>();
        Deque<TestNode> ready = new ArrayDeque<>();
        for (TestNode node : members) {
            int count = 0;
            for (TestNode dependency : node.getDependencies()) {
                if (members.contains(dependency)) {
                    count++;
                }
            }
            pending.put(node, count);
            if (count == 0) {
                ready.add(node);
            }
        }

        List<TestNode> order = new ArrayList<>(members.size());
        while (!ready.isEmpty()) {
            TestNode node = ready.poll();
            order.add(node);
            for (TestNode dependent : node.getDependents()) {
                Integer count = pending.get(dependent);
                if (count == null) {
                    continue;
                }
                pending.put(dependent, count - 1);
                if (count == 1) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < members.size()) {
            Set<TestNode> remaining = new LinkedHashSet<>(members);
            order.forEach(remaining::remove);
            throw new DependencyCycleException(extractCycle(remaining));
        }
        return order;
    }

    /// Returns one cycle among the nodes, if any.
    ///
    /// @param nodes nodes to inspect, not null
    /// @return keys on the cycle with the first repeated at the end, or empty
    public static Optional<List<String>> findCycle(Collection<? extends TestNode> nodes) {
        try {
            topologicalOrder(nodes);
            return Optional.empty();
        } catch (DependencyCycleException e) {
            return Optional.of(e.getCycle());
        }
    }

    /// Fails if the nodes contain a cycle.
    ///
    /// @param nodes nodes to inspect, not null
    /// @throws DependencyCycleException naming one cycle
    public static void check(Collection<? extends TestNode> nodes)
            throws DependencyCycleException {
        topologicalOrder(nodes);
    }

    // Every remaining node has a remaining dependency, so walking dependencies
    // must revisit a node.
    private static List<String> extractCycle(Set<TestNode> remaining) {
        List<TestNode> path = new ArrayList<>();
        Set<TestNode> onPath = new HashSet<>();
        TestNode current = remaining.iterator().next();
        while (onPath.add(current)) {
            path.add(current);
            TestNode next = null;
            for (TestNode dependency : current.getDependencies()) {
                if (remaining.contains(dependency)) {
                    next = dependency;
                    break;
                }
            }
            current = next;
        }
        List<String> cycle = new ArrayList<>();
        for (TestNode node : path.subList(path.indexOf(current), path.size())) {
            cycle.add(node.getKey());
        }
        cycle.add(current.getKey());
        return cycle;
    }
}
