package org.pragmatica.highlight;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.highlight.error.RuleCompilationException;
import org.pragmatica.highlight.match.HighlightInstruction;
import org.pragmatica.highlight.match.HighlightMatcher;
import org.pragmatica.highlight.match.HighlighterConfig;
import org.pragmatica.highlight.match.MatchTree;
import org.pragmatica.highlight.match.MatchTreeBuilder;
import org.pragmatica.highlight.rule.Rule;
import org.pragmatica.highlight.tree.SyntaxNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds the active match tree of each language.
 *
 * <p>Installing rules compiles a complete new tree and only then publishes it, replacing the
 * previous tree for that language in one step. A highlight run uses the tree that was current when
 * it started. When compilation fails the previous tree stays active.
 */
public final class HighlightEngine {
    private static final Logger logger = LogManager.getLogger(HighlightEngine.class);

    private final ConcurrentMap<String, MatchTree> trees = new ConcurrentHashMap<>();
    private final MatchTreeBuilder builder;
    private final HighlightMatcher matcher;

    HighlightEngine(HighlighterConfig config) {
        Objects.requireNonNull(config, "config");
        this.builder = MatchTreeBuilder.create(config);
        this.matcher = HighlightMatcher.create(config);
    }

    /**
     * Compile rules and make them the active rules of the language.
     *
     * @throws RuleCompilationException if the rules are invalid; the previous tree stays active
     */
    public MatchTree install(String language, List<Rule> rules) {
        Objects.requireNonNull(language, "language");
        var tree = builder.build(rules);
        var previous = trees.put(language, tree);
        logger.info("Installed {} rules for '{}' ({} match nodes){}",
                    tree.ruleCount(), language, tree.nodeCount(), previous == null ? "" : ", replacing previous rules");
        return tree;
    }

    /**
     * Same as {@link #install(String, List)}, but a compilation failure is logged and reported
     * as {@code false} instead of being thrown.
     */
    public boolean tryInstall(String language, List<Rule> rules) {
        try {
            install(language, rules);
            return true;
        } catch (RuleCompilationException e) {
            logger.warn("Rules for '{}' rejected, keeping previous rules: {}", language, e.getMessage());
            return false;
        }
    }

    public boolean remove(String language) {
        return trees.remove(language) != null;
    }

    public Optional<MatchTree> matchTree(String language) {
        return Optional.ofNullable(trees.get(language));
    }

    public Set<String> languages() {
        return Set.copyOf(trees.keySet());
    }

    /**
     * Highlight a syntax tree with the language's active rules.
     * Returns an empty list when no rules are installed for the language.
     */
    public List<HighlightInstruction> highlight(String language, SyntaxNode tree) {
        var matchTree = trees.get(language);
        if (matchTree == null) {
            logger.debug("No rules installed for '{}'", language);
            return List.of();
        }
        return matcher.highlight(tree, matchTree);
    }
}
