package io.dagtest.core.resource;

import java.util.Objects;

/// Failure raised while tearing down a resource object.
///
/// @param resourceKey key of the resource being torn down, not null
/// @param error what the tear-down raised, not null
public record ResourceReleaseError(String resourceKey, Throwable error) {

    public ResourceReleaseError {
        Objects.requireNonNull(resourceKey, "resourceKey must not be null");
        Objects.requireNonNull(error, "error must not be null");
    }
}
