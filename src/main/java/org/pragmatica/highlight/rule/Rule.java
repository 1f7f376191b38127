package org.pragmatica.highlight.rule;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A highlight rule: an ancestor chain, outermost first and triggering node last, plus the label
 * applied to the triggering node.
 */
public record Rule(List<NodeDescriptor> descriptors, String label) {

    public Rule {
        descriptors = ImmutableList.copyOf(descriptors);
        Objects.requireNonNull(label, "label");
    }

    public static Rule of(String label, NodeDescriptor... descriptors) {
        return new Rule(List.of(descriptors), label);
    }

    /**
     * Create a rule from dotted path notation, e.g. {@code "function_definition.name:identifier"}.
     *
     * @throws org.pragmatica.highlight.error.RuleCompilationException if the path is malformed
     * @see RulePath
     */
    public static Rule parse(String path, String label) {
        return new Rule(RulePath.parse(path), label);
    }

    public int size() {
        return descriptors.size();
    }

    public boolean isEmpty() {
        return descriptors.isEmpty();
    }

    /**
     * Descriptors innermost first, the order in which they are entered into a match tree.
     */
    public List<NodeDescriptor> reversed() {
        return ImmutableList.copyOf(descriptors).reverse();
    }

    /**
     * The rule's chain in dotted path notation.
     */
    public String path() {
        return descriptors.stream()
                          .map(NodeDescriptor::toString)
                          .collect(Collectors.joining("."));
    }

    @Override
    public String toString() {
        return path() + " -> " + label;
    }
}
