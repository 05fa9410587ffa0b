package io.dagtest.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;

/// Jackson mixin for `GraphDescription.NodeDescription`.
///
/// `isFixture()` is derived from the node kind, so it is left out of the
/// JSON form; the record's components are bound as usual.
///
/// @see io.dagtest.serialization.DagTestJacksonModule
public abstract class NodeDescriptionMixin {

    @JsonIgnore
    public abstract boolean isFixture();
}
