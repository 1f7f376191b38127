package org.pragmatica.highlight.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.highlight.tree.TreeNode.field;
import static org.pragmatica.highlight.tree.TreeNode.node;

class TreeNodeTest {

    private static final SourceText TEXT = SourceText.of("def f(): pass");

    @Test
    void create_linksChildrenToParent() {
        var name = field("name", "identifier", TEXT.span(4, 5));
        var keyword = node("def", TEXT.spanOf("def"));
        var definition = node("function_definition", TEXT.span(0, 13), keyword, name);

        assertSame(definition, keyword.parent().orElseThrow());
        assertSame(definition, name.parent().orElseThrow());
        assertTrue(definition.parent().isEmpty());
        assertEquals(2, definition.children().size());
        assertSame(keyword, definition.children().get(0));
    }

    @Test
    void field_isRecordedOnChild() {
        var name = field("name", "identifier", TEXT.span(4, 5));

        assertEquals("name", name.field().orElseThrow());
        assertEquals("identifier", name.name());
        assertTrue(node("def", TEXT.spanOf("def")).field().isEmpty());
    }

    @Test
    void create_childWithParent_isRejected() {
        var keyword = node("def", TEXT.spanOf("def"));
        node("function_definition", TEXT.span(0, 13), keyword);

        assertThrows(IllegalStateException.class, () -> node("other", TEXT.span(0, 13), keyword));
    }

    @Test
    void create_laterChildWithParent_leavesEarlierChildrenUnlinked() {
        var keyword = node("def", TEXT.spanOf("def"));
        var name = field("name", "identifier", TEXT.span(4, 5));
        node("function_definition", TEXT.span(0, 13), name);

        assertThrows(IllegalStateException.class, () -> node("other", TEXT.span(0, 13), keyword, name));
        assertTrue(keyword.parent().isEmpty());
    }

    @Test
    void children_areUnmodifiable() {
        var definition = node("function_definition", TEXT.span(0, 13), node("def", TEXT.spanOf("def")));

        assertThrows(UnsupportedOperationException.class, () -> definition.children().clear());
    }

    @Test
    void toString_showsFieldNameAndSpan() {
        assertEquals("name:identifier@1:5-1:6", field("name", "identifier", TEXT.span(4, 5)).toString());
        assertEquals("def@1:1-1:4", node("def", TEXT.spanOf("def")).toString());
    }
}
