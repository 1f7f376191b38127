package org.pragmatica.highlight.tree;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of a concrete syntax tree produced by an external parser.
 *
 * <p>Implementations adapt a parser's own node type. The matcher only reads through this
 * interface and never mutates the tree.
 */
public interface SyntaxNode {
    /**
     * The parser's node type, e.g. {@code "class_definition"} or {@code "("}.
     */
    String name();

    /**
     * The field under which this node appears in its parent, e.g. {@code "name"} or {@code "body"}.
     */
    Optional<String> field();

    /**
     * Child nodes in source order.
     */
    List<SyntaxNode> children();

    /**
     * The enclosing node, empty for the tree root.
     */
    Optional<SyntaxNode> parent();

    /**
     * The source span covered by this node.
     */
    SourceSpan span();
}
