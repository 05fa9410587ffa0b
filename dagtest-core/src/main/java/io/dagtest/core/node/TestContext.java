package io.dagtest.core.node;

import io.dagtest.core.resource.ResourceHandle;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/// Everything a body can see while its node executes.
///
/// One context is created per node execution and shared by the pre, body
/// and post phases, so a pre phase can leave state for the body through
/// {@link #put(String, Object)}. Sub-invocations get a view of the same
/// context carrying their own arguments.
public final class TestContext {

    private final TestNode node;
    private final Map<String, ResourceHandle<?>> resources;
    private final Map<String, Object> values;
    private final List<Object> args;
    private final Map<String, Object> kwargs;

    /// Creates the context for one execution of a node.
    ///
    /// @param node executing node, not null
    /// @param resources acquired resources by requirement name, not null
    public TestContext(TestNode node, Map<String, ResourceHandle<?>> resources) {
        this(
                Objects.requireNonNull(node, "node must not be null"),
                Map.copyOf(Objects.requireNonNull(resources, "resources must not be null")),
                new ConcurrentHashMap<>(),
                List.of(),
                Map.of());
    }

    private TestContext(
            TestNode node,
            Map<String, ResourceHandle<?>> resources,
            Map<String, Object> values,
            List<Object> args,
            Map<String, Object> kwargs) {
        this.node = node;
        this.resources = resources;
        this.values = values;
        this.args = args;
        this.kwargs = kwargs;
    }

    /// Returns a view of this context carrying sub-test arguments.
    ///
    /// @param args positional arguments, not null
    /// @param kwargs named arguments, not null
    /// @return context sharing resources and values with this one
    public TestContext withArguments(List<Object> args, Map<String, Object> kwargs) {
        return new TestContext(node, resources, values, List.copyOf(args), Map.copyOf(kwargs));
    }

    public TestNode getNode() {
        return node;
    }

    public NodeAttributes getAttributes() {
        return node.getAttributes();
    }

    public List<Object> getArgs() {
        return args;
    }

    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    /// Returns the handle acquired for a named resource requirement.
    ///
    /// @param name requirement name, not null
    /// @return the handle, never null
    /// @throws NoSuchElementException if the node does not require `name`
    public ResourceHandle<?> resource(String name) {
        ResourceHandle<?> handle = resources.get(name);
        if (handle == null) {
            throw new NoSuchElementException(
                    "Node " + node.getKey() + " does not require resource: " + name);
        }
        return handle;
    }

    /// Returns the handle for a named resource, checked against a type.
    ///
    /// @param name requirement name, not null
    /// @param type expected object type, not null
    /// @param <T> object type
    /// @return the handle, never null
    /// @throws NoSuchElementException if the node does not require `name`
    /// @throws ClassCastException if the object is not a `type`
    public <T> ResourceHandle<T> resource(String name, Class<T> type) {
        ResourceHandle<?> handle = resource(name);
        type.cast(handle.get());
        return (ResourceHandle<T>) handle;
    }

    /// Stores a value shared by the phases of this execution.
    ///
    /// @param key value key, not null
    /// @param value the value, not null
    public void put(String key, Object value) {
        values.put(key, value);
    }

    /// Returns a value stored by an earlier phase.
    ///
    /// @param key value key, not null
    /// @param type expected type, not null
    /// @param <T> value type
    /// @return the value, or null if absent
    public <T> T get(String key, Class<T> type) {
        return type.cast(values.get(key));
    }
}
