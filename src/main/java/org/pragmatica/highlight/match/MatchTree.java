package org.pragmatica.highlight.match;

/**
 * Compiled form of a rule list: a trie entered by the triggering node's shape and descended by
 * climbing the syntax tree towards its root.
 *
 * <p>Instances are immutable and may be shared between concurrent highlight runs. Rule changes
 * are applied by building a new tree.
 */
public final class MatchTree {
    private final MatchNode root;
    private final int ruleCount;
    private final int nodeCount;

    MatchTree(MatchNode root, int ruleCount) {
        this.root = root;
        this.ruleCount = ruleCount;
        this.nodeCount = count(root);
    }

    private static int count(MatchNode node) {
        var total = 1;
        for (var child : node.choices().values()) {
            total += count(child);
        }
        return total;
    }

    public MatchNode root() {
        return root;
    }

    /**
     * Number of rules the tree was compiled from, overridden ones included.
     */
    public int ruleCount() {
        return ruleCount;
    }

    /**
     * Number of match nodes, root included.
     */
    public int nodeCount() {
        return nodeCount;
    }

    public boolean isEmpty() {
        return root.isLeaf();
    }

    /**
     * Render the tree, one node per line, children indented under their parent.
     * Loop keys are shown as a child marked {@code ...}.
     */
    public String dump() {
        var sb = new StringBuilder("<root>\n");
        dump(root, 1, sb);
        return sb.toString();
    }

    private static void dump(MatchNode node, int depth, StringBuilder sb) {
        var pad = "    ".repeat(depth);
        node.loopKey()
            .ifPresent(key -> sb.append(pad).append(key).append(" ...\n"));
        for (var entry : node.choices().entrySet()) {
            var child = entry.getValue();
            sb.append(pad).append(entry.getKey());
            child.label()
                 .ifPresent(label -> sb.append(" -> ").append(label));
            sb.append('\n');
            dump(child, depth + 1, sb);
        }
    }

    @Override
    public String toString() {
        return "MatchTree[rules=" + ruleCount + ", nodes=" + nodeCount + "]";
    }
}
