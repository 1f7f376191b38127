package org.pragmatica.highlight.match;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.highlight.rule.ChoiceKey;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable match tree node.
 *
 * <p>Children are keyed by the shape of the next enclosing syntax node. A node created for a
 * repeatable descriptor also has a loop key: looking that key up returns the node itself, so any
 * number of consecutive ancestors of that shape are consumed without leaving the node.
 */
public final class MatchNode {
    private final Optional<String> label;
    private final ImmutableMap<ChoiceKey, MatchNode> choices;
    private final Optional<ChoiceKey> loopKey;

    MatchNode(Optional<String> label, ImmutableMap<ChoiceKey, MatchNode> choices, Optional<ChoiceKey> loopKey) {
        this.label = label;
        this.choices = choices;
        this.loopKey = loopKey;
    }

    /**
     * Label applied when matching ends at or beyond this node, if a rule terminates here.
     */
    public Optional<String> label() {
        return label;
    }

    public Map<ChoiceKey, MatchNode> choices() {
        return choices;
    }

    public Optional<ChoiceKey> loopKey() {
        return loopKey;
    }

    /**
     * Next node for an enclosing syntax node with the given key.
     */
    public Optional<MatchNode> choice(ChoiceKey key) {
        if (loopKey.isPresent() && loopKey.get().equals(key)) {
            return Optional.of(this);
        }
        return Optional.ofNullable(choices.get(key));
    }

    public boolean isLeaf() {
        return choices.isEmpty();
    }
}
