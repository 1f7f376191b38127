package org.pragmatica.highlight.match;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.highlight.rule.ChoiceKey;
import org.pragmatica.highlight.tree.SyntaxNode;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates a {@link MatchTree} against a syntax tree.
 *
 * <p>Every node is visited in pre-order. A node enters the match tree through the root entry for
 * its own shape, then its ancestors are climbed for as long as the match tree has a branch for
 * each of them. The last label seen on the way up wins, so the rule consuming the most ancestors
 * takes precedence. At every step the field-qualified key is tried before the plain one, and only
 * the first that exists is followed.
 *
 * <p>The emitted span is always the triggering node's own span.
 */
public final class HighlightMatcher {
    private static final Logger logger = LogManager.getLogger(HighlightMatcher.class);

    private final HighlighterConfig config;

    private HighlightMatcher(HighlighterConfig config) {
        this.config = config;
    }

    public static HighlightMatcher create() {
        return create(HighlighterConfig.DEFAULT);
    }

    public static HighlightMatcher create(HighlighterConfig config) {
        return new HighlightMatcher(Objects.requireNonNull(config, "config"));
    }

    /**
     * Produce highlight instructions for the whole tree, in pre-order of the matched nodes.
     */
    public List<HighlightInstruction> highlight(SyntaxNode tree, MatchTree matchTree) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(matchTree, "matchTree");

        var startTime = System.nanoTime();
        var instructions = ImmutableList.<HighlightInstruction>builder();
        var pending = new ArrayDeque<SyntaxNode>();
        var visited = 0;

        pending.push(tree);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            visited++;
            match(node, matchTree.root())
                .ifPresent(label -> instructions.add(new HighlightInstruction(node.span(), label)));

            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }

        var result = instructions.build();
        if (config.logStatistics()) {
            logger.debug("Visited {} nodes, produced {} instructions in {} ms",
                         visited, result.size(), (System.nanoTime() - startTime) / 1_000_000.0);
        }
        return result;
    }

    /**
     * Label for a single node, if any rule applies to it.
     */
    public static Optional<String> match(SyntaxNode node, MatchNode root) {
        var entry = step(root, node);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        var current = entry.get();
        var best = current.label();

        var cursor = node.parent();
        while (cursor.isPresent()) {
            var next = step(current, cursor.get());
            if (next.isEmpty()) {
                break;
            }
            current = next.get();
            if (current.label().isPresent()) {
                best = current.label();
            }
            cursor = cursor.get().parent();
        }
        return best;
    }

    private static Optional<MatchNode> step(MatchNode from, SyntaxNode node) {
        if (node.field().isPresent()) {
            var qualified = from.choice(ChoiceKey.qualified(node.field().get(), node.name()));
            if (qualified.isPresent()) {
                return qualified;
            }
        }
        return from.choice(ChoiceKey.plain(node.name()));
    }
}
