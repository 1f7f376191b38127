package org.pragmatica.highlight.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory {@link SyntaxNode}. Children are attached to their parent when the parent is created,
 * so trees are assembled bottom-up and are read-only once the root exists.
 */
public final class TreeNode implements SyntaxNode {
    private final String name;
    private final Optional<String> field;
    private final SourceSpan span;
    private final ImmutableList<SyntaxNode> children;
    private TreeNode parent;

    private TreeNode(String name, Optional<String> field, SourceSpan span, List<TreeNode> children) {
        this.name = Objects.requireNonNull(name, "name");
        this.field = Objects.requireNonNull(field, "field");
        this.span = Objects.requireNonNull(span, "span");
        this.children = ImmutableList.copyOf(children);
        for (var child : children) {
            if (child.parent != null) {
                throw new IllegalStateException("Node " + child + " already belongs to " + child.parent);
            }
        }
        for (var child : children) {
            child.parent = this;
        }
    }

    public static TreeNode node(String name, SourceSpan span, TreeNode... children) {
        return new TreeNode(name, Optional.empty(), span, List.of(children));
    }

    public static TreeNode node(String name, SourceSpan span, List<TreeNode> children) {
        return new TreeNode(name, Optional.empty(), span, children);
    }

    /**
     * A node that appears under the given field of its parent.
     */
    public static TreeNode field(String field, String name, SourceSpan span, TreeNode... children) {
        return new TreeNode(name, Optional.of(field), span, List.of(children));
    }

    public static TreeNode field(String field, String name, SourceSpan span, List<TreeNode> children) {
        return new TreeNode(name, Optional.of(field), span, children);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<String> field() {
        return field;
    }

    @Override
    public List<SyntaxNode> children() {
        return children;
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public SourceSpan span() {
        return span;
    }

    @Override
    public String toString() {
        return field.map(f -> f + ":" + name).orElse(name) + "@" + span;
    }
}
