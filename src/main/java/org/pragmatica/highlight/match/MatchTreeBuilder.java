package org.pragmatica.highlight.match;

import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.highlight.error.RuleCompilationException;
import org.pragmatica.highlight.error.RuleError;
import org.pragmatica.highlight.rule.ChoiceKey;
import org.pragmatica.highlight.rule.Rule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiles rules into a {@link MatchTree}.
 *
 * <p>Each rule is entered innermost descriptor first, so the root is keyed by triggering node shapes
 * and deeper levels by successively outer ancestors. The label goes on the node reached by the
 * outermost descriptor. A rule whose reversed chain equals an earlier one replaces that rule's
 * label; rules sharing only a prefix of the reversed chain share those nodes and branch after it.
 */
public final class MatchTreeBuilder {
    private static final Logger logger = LogManager.getLogger(MatchTreeBuilder.class);

    private final HighlighterConfig config;

    private MatchTreeBuilder(HighlighterConfig config) {
        this.config = config;
    }

    public static MatchTreeBuilder create() {
        return create(HighlighterConfig.DEFAULT);
    }

    public static MatchTreeBuilder create(HighlighterConfig config) {
        return new MatchTreeBuilder(Objects.requireNonNull(config, "config"));
    }

    /**
     * Build a match tree from the given rules.
     *
     * @throws RuleCompilationException if any rule is invalid; no tree is produced in that case
     */
    public MatchTree build(List<Rule> rules) {
        validate(rules);

        var root = new Draft();
        for (int i = 0; i < rules.size(); i++) {
            var rule = rules.get(i);
            var node = root;
            for (var descriptor : rule.reversed()) {
                var key = descriptor.key();
                if (!key.equals(node.loopKey)) {
                    node = node.choices.computeIfAbsent(key, k -> new Draft());
                }
                if (descriptor.repeatable()) {
                    node.loop(key);
                }
            }
            if (node.label != null && !node.label.equals(rule.label())) {
                logger.trace("Rule {} overrides label '{}'", rule, node.label);
            }
            node.label = rule.label();
            node.labelIndex = i;
        }

        var tree = new MatchTree(root.freeze(), rules.size());
        logger.debug("Compiled {} rules into {} match nodes", rules.size(), tree.nodeCount());
        return tree;
    }

    private void validate(List<Rule> rules) {
        for (int i = 0; i < rules.size(); i++) {
            var rule = rules.get(i);
            if (rule.isEmpty()) {
                throw new RuleCompilationException(new RuleError.EmptyRule(i));
            }
            if (rule.label().isBlank()) {
                throw new RuleCompilationException(new RuleError.BlankLabel(i, rule.path()));
            }
            if (!config.allowRepeat()) {
                for (var descriptor : rule.descriptors()) {
                    if (descriptor.repeatable()) {
                        throw new RuleCompilationException(new RuleError.RepeatNotAllowed(i, descriptor.toString()));
                    }
                }
            }
        }
    }

    /**
     * Mutable node used while rules are being entered.
     *
     * <p>A loop key makes any child under the same key unreachable, so setting one folds that child
     * into the looping node. The result does not depend on whether the loop or the branch was
     * entered first.
     */
    private static final class Draft {
        private final Map<ChoiceKey, Draft> choices = new LinkedHashMap<>();
        private String label;
        private int labelIndex = -1;
        private ChoiceKey loopKey;

        // A draft only ever loops on the key it is stored under, so loop keys never conflict.
        void loop(ChoiceKey key) {
            loopKey = key;
            var shadowed = choices.remove(key);
            if (shadowed != null) {
                logger.trace("Folding branch '{}' into its repeating node", key);
                absorb(shadowed);
            }
        }

        // Labels keep the later rule, as they would had both rules walked onto the same node.
        private void absorb(Draft other) {
            if (other.label != null && other.labelIndex > labelIndex) {
                label = other.label;
                labelIndex = other.labelIndex;
            }
            if (other.loopKey != null && loopKey == null) {
                loop(other.loopKey);
            }
            other.choices.forEach((key, child) -> {
                if (key.equals(loopKey)) {
                    absorb(child);
                    return;
                }
                var existing = choices.get(key);
                if (existing == null) {
                    choices.put(key, child);
                } else {
                    existing.absorb(child);
                }
            });
        }

        MatchNode freeze() {
            var frozen = ImmutableMap.<ChoiceKey, MatchNode>builderWithExpectedSize(choices.size());
            choices.forEach((key, child) -> frozen.put(key, child.freeze()));
            return new MatchNode(Optional.ofNullable(label), frozen.build(), Optional.ofNullable(loopKey));
        }
    }
}
