package io.dagtest.core.resource;

import io.dagtest.core.result.TestState;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// Describes an object a test needs, such as a temporary directory or a
/// client for a server.
///
/// Subclasses implement {@link #setUp()} and, when the object holds
/// anything that must be released, {@link #tearDown(Object, TestState)}.
/// Objects that were not modified by a test are pooled by the
/// {@link ResourceManager} and handed to later tests requiring a resource
/// with the same key.
///
/// ### Keys
/// The key combines the concrete class name with the constructor arguments,
/// so two resources of the same class built from equal arguments share one
/// pool.
///
/// ### Example
/// {@snippet :
/// public final class TempDirResource extends Resource<Path> {
///     public TempDirResource(String prefix) {
///         super(prefix);
///     }
///
///     @Override
///     protected Path setUp() throws IOException {
///         return Files.createTempDirectory((String) getArgs().get(0));
///     }
/// }
/// }
///
/// @param <T> type of the object handed to tests
public abstract class Resource<T> {

    private final List<Object> args;
    private final String key;

    /// Creates a resource description.
    ///
    /// @param args arguments identifying this resource, made available to
    ///     {@link #setUp()} through {@link #getArgs()}
    protected Resource(Object... args) {
        this.args = List.copyOf(Arrays.asList(args));
        this.key =
                getClass().getName()
                        + this.args.stream()
                                .map(String::valueOf)
                                .collect(Collectors.joining(",", "(", ")"));
    }

    /// Creates the object handed to tests.
    ///
    /// @return the object, not null
    /// @throws Exception if the object cannot be created; the requiring
    ///     test is reported as an error
    protected abstract T setUp() throws Exception;

    /// Releases an object that will not be reused.
    ///
    /// @param object the object created by {@link #setUp()}, never null
    /// @param status state of the test that used it last, or null when the
    ///     pool is drained at the end of a run
    /// @throws Exception collected by the manager and reported with the run
    protected void tearDown(T object, TestState status) throws Exception {}

    /// Returns whether every object is discarded after a single use.
    ///
    /// @return false unless overridden
    public boolean isOneshot() {
        return false;
    }

    /// Returns the pool key.
    ///
    /// @return class name and arguments, never null
    public final String getKey() {
        return key;
    }

    /// Returns the constructor arguments.
    ///
    /// @return unmodifiable list, never null
    protected final List<Object> getArgs() {
        return args;
    }

    final ResourceHandle<T> acquire() throws Exception {
        T object = Objects.requireNonNull(setUp(), () -> getKey() + " set up a null object");
        return new ResourceHandle<>(this, object);
    }

    /// Releases a handle, tearing the object down unless it can be reused.
    ///
    /// @return true if the object may go back into the pool
    final boolean release(
            ResourceHandle<T> handle,
            List<ResourceReleaseError> errors,
            TestState status,
            boolean force) {
        if (force || isOneshot() || handle.isDirty()) {
            try {
                tearDown(handle.get(), status);
            } catch (Exception e) {
                errors.add(new ResourceReleaseError(getKey(), e));
            }
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return key;
    }
}
