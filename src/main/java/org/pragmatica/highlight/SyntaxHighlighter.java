package org.pragmatica.highlight;

import org.pragmatica.highlight.match.HighlightInstruction;
import org.pragmatica.highlight.match.HighlightMatcher;
import org.pragmatica.highlight.match.HighlighterConfig;
import org.pragmatica.highlight.match.MatchTree;
import org.pragmatica.highlight.match.MatchTreeBuilder;
import org.pragmatica.highlight.rule.Rule;
import org.pragmatica.highlight.tree.SyntaxNode;

import java.util.List;

/**
 * Entry point for compiling highlight rules and applying them to syntax trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var matchTree = SyntaxHighlighter.compile(List.of(
 *     Rule.parse("string", "String"),
 *     Rule.parse("module.expression_statement.string", "DocString")));
 *
 * var instructions = SyntaxHighlighter.highlight(tree, matchTree);
 * }</pre>
 */
public final class SyntaxHighlighter {
    private SyntaxHighlighter() {}

    /**
     * Compile rules into a match tree.
     *
     * @throws org.pragmatica.highlight.error.RuleCompilationException if any rule is invalid
     */
    public static MatchTree compile(List<Rule> rules) {
        return compile(rules, HighlighterConfig.DEFAULT);
    }

    /**
     * Compile rules into a match tree with custom configuration.
     *
     * @throws org.pragmatica.highlight.error.RuleCompilationException if any rule is invalid
     */
    public static MatchTree compile(List<Rule> rules, HighlighterConfig config) {
        return MatchTreeBuilder.create(config)
                               .build(rules);
    }

    /**
     * Highlight a syntax tree with a compiled match tree.
     */
    public static List<HighlightInstruction> highlight(SyntaxNode tree, MatchTree matchTree) {
        return HighlightMatcher.create()
                               .highlight(tree, matchTree);
    }

    /**
     * Create an engine holding per-language match trees.
     */
    public static HighlightEngine engine() {
        return engine(HighlighterConfig.DEFAULT);
    }

    public static HighlightEngine engine(HighlighterConfig config) {
        return new HighlightEngine(config);
    }

    /**
     * Create a builder for engine configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean allowRepeat = true;
        private boolean logStatistics = false;

        private Builder() {}

        public Builder repeat(boolean allowed) {
            this.allowRepeat = allowed;
            return this;
        }

        public Builder statistics(boolean enabled) {
            this.logStatistics = enabled;
            return this;
        }

        public HighlighterConfig config() {
            return new HighlighterConfig(allowRepeat, logStatistics);
        }

        public HighlightEngine build() {
            return engine(config());
        }
    }
}
