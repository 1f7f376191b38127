package org.pragmatica.highlight.rule;

import java.util.Objects;
import java.util.Optional;

/**
 * Lookup key of a match-tree branch: a node name, optionally qualified by the field it occupies.
 *
 * <p>A qualified key never equals a plain one, even for the same name.
 */
public record ChoiceKey(Optional<String> field, String name) {

    public ChoiceKey {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(name, "name");
    }

    public static ChoiceKey plain(String name) {
        return new ChoiceKey(Optional.empty(), name);
    }

    public static ChoiceKey qualified(String field, String name) {
        return new ChoiceKey(Optional.of(field), name);
    }

    public static ChoiceKey of(Optional<String> field, String name) {
        return new ChoiceKey(field, name);
    }

    @Override
    public String toString() {
        return field.map(f -> f + ":" + name).orElse(name);
    }
}
