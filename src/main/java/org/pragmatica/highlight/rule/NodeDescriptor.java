package org.pragmatica.highlight.rule;

import java.util.Objects;
import java.util.Optional;

/**
 * One element of a rule's ancestor chain.
 *
 * @param name       parser node type
 * @param field      field the node must occupy in its parent, if any
 * @param repeatable whether one or more consecutive ancestors of this shape are consumed
 */
public record NodeDescriptor(String name, Optional<String> field, boolean repeatable) {

    public NodeDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(field, "field");
    }

    public static NodeDescriptor of(String name) {
        return new NodeDescriptor(name, Optional.empty(), false);
    }

    public static NodeDescriptor of(String field, String name) {
        return new NodeDescriptor(name, Optional.of(field), false);
    }

    public NodeDescriptor repeated() {
        return new NodeDescriptor(name, field, true);
    }

    public ChoiceKey key() {
        return ChoiceKey.of(field, name);
    }

    @Override
    public String toString() {
        return key() + (repeatable ? "+" : "");
    }
}
