package io.dagtest.core.resource;

import io.dagtest.core.result.TestState;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Pool of resource objects shared by the tests of a run.
///
/// Clean objects released by one test are handed, first in first out, to
/// the next test requiring a resource with the same key. Dirty and oneshot
/// objects are torn down on release. Tear-down failures never propagate;
/// they are collected and drained with {@link #drainErrors()}.
///
/// ### Typical Flow
/// {@snippet :
/// ResourceManager.Collected collected = manager.collect(node.getResources());
/// try {
///     runTest(collected.getHandles());
/// } finally {
///     collected.release(finalState);
/// }
/// }
///
/// @implNote **Thread-safe**. The pool and the error list are guarded by
/// one lock; `setUp()` and `tearDown()` run outside it.
public class ResourceManager {

    private static final Logger logger = Logger.getLogger(ResourceManager.class.getName());

    private final Object lock = new Object();
    private final Map<String, Deque<ResourceHandle<?>>> pool = new HashMap<>();
    private final List<ResourceReleaseError> errors = new ArrayList<>();

    /// Returns a pooled object for the resource, or sets up a new one.
    ///
    /// @param resource the resource, not null
    /// @param <T> object type
    /// @return handle to a clean object, never null
    /// @throws Exception if a new object had to be set up and that failed
    public <T> ResourceHandle<T> acquire(Resource<T> resource) throws Exception {
        Objects.requireNonNull(resource, "resource must not be null");
        synchronized (lock) {
            Deque<ResourceHandle<?>> pooled = pool.get(resource.getKey());
            if (pooled != null && !pooled.isEmpty()) {
                return (ResourceHandle<T>) pooled.pollFirst();
            }
        }
        logger.fine("Setting up resource " + resource.getKey());
        return resource.acquire();
    }

    /// Returns an object to the pool, or tears it down if it cannot be reused.
    ///
    /// @param handle handle returned by {@link #acquire(Resource)}, not null
    /// @param status state of the test that used the object
    /// @param <T> object type
    public <T> void release(ResourceHandle<T> handle, TestState status) {
        Objects.requireNonNull(handle, "handle must not be null");
        List<ResourceReleaseError> failures = new ArrayList<>();
        boolean reusable = handle.getResource().release(handle, failures, status, false);
        synchronized (lock) {
            errors.addAll(failures);
            if (reusable) {
                pool.computeIfAbsent(handle.getResource().getKey(), key -> new ArrayDeque<>())
                        .addLast(handle);
            }
        }
        failures.forEach(ResourceManager::logFailure);
    }

    /// Tears down every pooled object and empties the pool.
    ///
    /// Objects are torn down with a null status.
    public void releaseAll() {
        List<ResourceHandle<?>> drained = new ArrayList<>();
        synchronized (lock) {
            pool.values().forEach(drained::addAll);
            pool.clear();
        }
        List<ResourceReleaseError> failures = new ArrayList<>();
        for (ResourceHandle<?> handle : drained) {
            forceRelease(handle, failures);
        }
        synchronized (lock) {
            errors.addAll(failures);
        }
        failures.forEach(ResourceManager::logFailure);
    }

    /// Acquires one object per named resource.
    ///
    /// If any acquisition fails, the objects already acquired are released
    /// with {@link TestState#ERROR} before the failure propagates.
    ///
    /// @param resources name to resource, not null
    /// @return the acquired objects, never null
    /// @throws Exception if a resource could not be set up
    public Collected collect(Map<String, Resource<?>> resources) throws Exception {
        Objects.requireNonNull(resources, "resources must not be null");
        Map<String, ResourceHandle<?>> handles = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, Resource<?>> entry : resources.entrySet()) {
                handles.put(entry.getKey(), acquire(entry.getValue()));
            }
        } catch (Exception e) {
            new Collected(handles).release(TestState.ERROR);
            throw e;
        }
        return new Collected(handles);
    }

    /// Returns and clears the tear-down failures collected so far.
    ///
    /// @return failures in the order they occurred, never null
    public List<ResourceReleaseError> drainErrors() {
        synchronized (lock) {
            List<ResourceReleaseError> drained = List.copyOf(errors);
            errors.clear();
            return drained;
        }
    }

    /// Returns how many clean objects are pooled for a resource key.
    ///
    /// @param key resource key, not null
    /// @return pooled object count
    public int pooledCount(String key) {
        synchronized (lock) {
            Deque<ResourceHandle<?>> pooled = pool.get(key);
            return pooled != null ? pooled.size() : 0;
        }
    }

    private static <T> void forceRelease(
            ResourceHandle<T> handle, List<ResourceReleaseError> failures) {
        handle.getResource().release(handle, failures, null, true);
    }

    private static void logFailure(ResourceReleaseError failure) {
        logger.warning(
                "Tear down of resource "
                        + failure.resourceKey()
                        + " failed: "
                        + failure.error().getMessage());
    }

    /// Objects acquired for one test, released together.
    public final class Collected {

        private final Map<String, ResourceHandle<?>> handles;
        private boolean released;

        private Collected(Map<String, ResourceHandle<?>> handles) {
            this.handles = handles;
        }

        /// Returns the acquired objects by requirement name.
        ///
        /// @return unmodifiable map, never null
        public Map<String, ResourceHandle<?>> getHandles() {
            return Collections.unmodifiableMap(handles);
        }

        /// Releases every object with the test's final state.
        ///
        /// Subsequent calls do nothing.
        ///
        /// @param status the state passed to tear-down methods
        public void release(TestState status) {
            if (released) {
                return;
            }
            released = true;
            for (ResourceHandle<?> handle : handles.values()) {
                ResourceManager.this.release(handle, status);
            }
        }
    }
}
