package io.dagtest.core.execution;

import io.dagtest.core.node.TestNode;
import java.util.Objects;

/// Decides, at the start of a run, which nodes are skipped.
///
/// ### Rule Syntax
/// {@link #parse(String)} accepts the forms used on command lines and in
/// configuration:
/// - `name` - skip nodes carrying the attribute `name`
/// - `name=value` - skip nodes whose attribute `name` has the text form `value`
@FunctionalInterface
public interface SkipRule {

    /// Returns whether a node is skipped in this run.
    ///
    /// @param node the node, not null
    /// @return true to skip
    boolean shouldSkip(TestNode node);

    /// Skips nodes built with `skip(true)`. The default rule.
    ///
    /// @return the rule, never null
    static SkipRule byFlag() {
        return TestNode::isSkip;
    }

    /// Runs everything, ignoring skip flags.
    ///
    /// @return the rule, never null
    static SkipRule none() {
        return node -> false;
    }

    static SkipRule hasAttribute(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return node -> node.getAttributes().contains(name);
    }

    static SkipRule attributeEquals(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        return node -> node.getAttributes().getText(name).map(value::equals).orElse(false);
    }

    /// Parses a textual rule.
    ///
    /// @param rule `name` or `name=value`, not null or blank
    /// @return the rule, never null
    /// @throws IllegalArgumentException if the rule is blank or has an empty name
    static SkipRule parse(String rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        int separator = rule.indexOf('=');
        String name = (separator < 0 ? rule : rule.substring(0, separator)).trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Skip rule needs an attribute name: '" + rule + "'");
        }
        return separator < 0
                ? hasAttribute(name)
                : attributeEquals(name, rule.substring(separator + 1));
    }

    /// Combines two rules; a node is skipped if either matches.
    ///
    /// @param other the other rule, not null
    /// @return combined rule, never null
    default SkipRule or(SkipRule other) {
        Objects.requireNonNull(other, "other must not be null");
        return node -> shouldSkip(node) || other.shouldSkip(node);
    }
}
