package io.dagtest.core.node;

/// Whether a fixture prepares state for tests or cleans it up afterwards.
public enum FixtureRole {
    SETUP,
    TEARDOWN
}
