package io.dagtest.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/// Configuration options for a {@link DagTestRunner}.
///
/// Use the {@link Builder} for fluent configuration, {@link #fromProperties}
/// to read a properties file, or construct directly and use setters.
///
/// ### Default Values
/// - `maxThreads`: `0` (no limit on concurrently running nodes)
/// - `detectCycles`: `true`
/// - `defaultTimeout`: none
/// - `threadNamePrefix`: `"dagtest-"`
/// - `skipRule`: none, nodes marked with `skip(true)` are skipped
/// - `noSkip`: `false`
///
/// ### Property Keys
/// | Key | Value |
/// |---|---|
/// | `dagtest.max-threads` | integer, `0` for unlimited |
/// | `dagtest.detect-cycles` | `true` or `false` |
/// | `dagtest.default-timeout-ms` | milliseconds, positive |
/// | `dagtest.thread-name-prefix` | text |
/// | `dagtest.skip` | `name` or `name=value` |
/// | `dagtest.no-skip` | `true` or `false` |
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link DagTestFactory}.
/// Do not modify after runner creation.
///
/// @see DagTestFactory#createRunner(DagTestConfig)
public class DagTestConfig {

    public static final String MAX_THREADS = "dagtest.max-threads";
    public static final String DETECT_CYCLES = "dagtest.detect-cycles";
    public static final String DEFAULT_TIMEOUT_MS = "dagtest.default-timeout-ms";
    public static final String THREAD_NAME_PREFIX = "dagtest.thread-name-prefix";
    public static final String SKIP = "dagtest.skip";
    public static final String NO_SKIP = "dagtest.no-skip";

    private int maxThreads;
    private boolean detectCycles = true;
    private Duration defaultTimeout;
    private String threadNamePrefix = "dagtest-";
    private String skipRule;
    private boolean noSkip;

    /// Creates a configuration with default values.
    public DagTestConfig() {}

    /// Reads a configuration from properties.
    ///
    /// Missing keys keep their default values.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static DagTestConfig fromProperties(Properties properties) {
        DagTestConfig config = new DagTestConfig();
        String maxThreads = properties.getProperty(MAX_THREADS);
        if (maxThreads != null) {
            config.setMaxThreads(parseInt(MAX_THREADS, maxThreads));
        }
        String detectCycles = properties.getProperty(DETECT_CYCLES);
        if (detectCycles != null) {
            config.setDetectCycles(parseBoolean(DETECT_CYCLES, detectCycles));
        }
        String timeout = properties.getProperty(DEFAULT_TIMEOUT_MS);
        if (timeout != null) {
            config.setDefaultTimeout(Duration.ofMillis(parseInt(DEFAULT_TIMEOUT_MS, timeout)));
        }
        String prefix = properties.getProperty(THREAD_NAME_PREFIX);
        if (prefix != null) {
            config.setThreadNamePrefix(prefix);
        }
        String skip = properties.getProperty(SKIP);
        if (skip != null && !skip.isBlank()) {
            config.setSkipRule(skip.trim());
        }
        String noSkip = properties.getProperty(NO_SKIP);
        if (noSkip != null) {
            config.setNoSkip(parseBoolean(NO_SKIP, noSkip));
        }
        return config;
    }

    /// Returns the maximum number of node bodies running at once.
    ///
    /// @return thread budget, `0` for unlimited
    public int getMaxThreads() {
        return maxThreads;
    }

    /// Sets the maximum number of node bodies running at once.
    ///
    /// @param maxThreads thread budget, `0` for unlimited, never negative
    /// @throws IllegalArgumentException if negative
    public void setMaxThreads(int maxThreads) {
        if (maxThreads < 0) {
            throw new IllegalArgumentException("maxThreads must not be negative, got " + maxThreads);
        }
        this.maxThreads = maxThreads;
    }

    /// Returns whether the graph is checked for cycles before running.
    ///
    /// @return `true` to refuse graphs with cycles up front
    public boolean isDetectCycles() {
        return detectCycles;
    }

    public void setDetectCycles(boolean detectCycles) {
        this.detectCycles = detectCycles;
    }

    /// Returns the per-phase time limit for nodes that declare none.
    ///
    /// @return timeout, or null for no limit
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /// Sets the per-phase time limit for nodes that declare none.
    ///
    /// @param defaultTimeout positive duration, or null for no limit
    /// @throws IllegalArgumentException if zero or negative
    public void setDefaultTimeout(Duration defaultTimeout) {
        if (defaultTimeout != null && (defaultTimeout.isZero() || defaultTimeout.isNegative())) {
            throw new IllegalArgumentException(
                    "defaultTimeout must be positive, got " + defaultTimeout);
        }
        this.defaultTimeout = defaultTimeout;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix =
                Objects.requireNonNull(threadNamePrefix, "threadNamePrefix must not be null");
    }

    /// Returns the textual skip rule.
    ///
    /// @return `name` or `name=value`, or null to skip nodes by their flag
    /// @see io.dagtest.core.execution.SkipRule#parse(String)
    public String getSkipRule() {
        return skipRule;
    }

    public void setSkipRule(String skipRule) {
        this.skipRule = skipRule;
    }

    /// Returns whether skip flags and rules are ignored.
    ///
    /// @return `true` to run every node; overrides {@link #getSkipRule()}
    public boolean isNoSkip() {
        return noSkip;
    }

    public void setNoSkip(boolean noSkip) {
        this.noSkip = noSkip;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.trim();
        if ("true".equalsIgnoreCase(normalized)) {
            return true;
        }
        if ("false".equalsIgnoreCase(normalized)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": '" + value + "'");
    }

    /// Fluent builder for constructing {@link DagTestConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final DagTestConfig config = new DagTestConfig();

        public Builder maxThreads(int maxThreads) {
            config.setMaxThreads(maxThreads);
            return this;
        }

        public Builder detectCycles(boolean detectCycles) {
            config.setDetectCycles(detectCycles);
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            config.setDefaultTimeout(defaultTimeout);
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            config.setThreadNamePrefix(threadNamePrefix);
            return this;
        }

        public Builder skipRule(String skipRule) {
            config.setSkipRule(skipRule);
            return this;
        }

        public Builder noSkip(boolean noSkip) {
            config.setNoSkip(noSkip);
            return this;
        }

        /// Builds and returns the configured {@link DagTestConfig} instance.
        ///
        /// @return the configured instance, never null
        public DagTestConfig build() {
            return config;
        }
    }
}
