package io.dagtest.core.resource;

import java.util.function.Consumer;
import java.util.function.Function;

/// Binding between a {@link Resource} and the object it created.
///
/// Tests read the object through {@link #get()} and change it through
/// {@link #mutate(Consumer)}, which marks the handle dirty so the object is
/// torn down instead of being pooled. Changes that leave the object
/// reusable go through {@link #cleanAccess(Consumer)}.
///
/// @implNote Handles are used by one test at a time; the flags are volatile
/// so a pooled handle is seen consistently by the next test's thread.
///
/// @param <T> type of the wrapped object
public final class ResourceHandle<T> {

    private final Resource<T> resource;
    private final T object;
    private volatile boolean dirty;
    private volatile boolean tracking = true;

    ResourceHandle(Resource<T> resource, T object) {
        this.resource = resource;
        this.object = object;
    }

    public Resource<T> getResource() {
        return resource;
    }

    /// Returns the wrapped object without affecting the dirty flag.
    ///
    /// @return the object, never null
    public T get() {
        return object;
    }

    /// Applies a change to the object and marks the handle dirty.
    ///
    /// @param change the change, not null
    public void mutate(Consumer<? super T> change) {
        markDirtyIfTracking();
        change.accept(object);
    }

    /// Applies a change returning a value and marks the handle dirty.
    ///
    /// @param change the change, not null
    /// @param <R> result type
    /// @return the change's result
    public <R> R mutateAndGet(Function<? super T, R> change) {
        markDirtyIfTracking();
        return change.apply(object);
    }

    /// Runs an action during which the mutating methods do not mark the handle dirty.
    ///
    /// @param action the action, not null
    public void cleanAccess(Consumer<? super T> action) {
        boolean previous = tracking;
        tracking = false;
        try {
            action.accept(object);
        } finally {
            tracking = previous;
        }
    }

    public void markDirty() {
        dirty = true;
    }

    public void markClean() {
        dirty = false;
    }

    public boolean isDirty() {
        return dirty;
    }

    private void markDirtyIfTracking() {
        if (tracking) {
            dirty = true;
        }
    }

    @Override
    public String toString() {
        return "ResourceHandle{" + resource.getKey() + (dirty ? ", dirty" : "") + "}";
    }
}
