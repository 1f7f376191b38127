package org.pragmatica.highlight;

import org.junit.jupiter.api.Test;
import org.pragmatica.highlight.error.RuleCompilationException;
import org.pragmatica.highlight.error.RuleError;
import org.pragmatica.highlight.match.HighlightInstruction;
import org.pragmatica.highlight.rule.NodeDescriptor;
import org.pragmatica.highlight.rule.Rule;
import org.pragmatica.highlight.tree.SourceText;
import org.pragmatica.highlight.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.highlight.tree.TreeNode.node;

class HighlightEngineTest {

    private static final SourceText TEXT = SourceText.of("x = 'a'");
    private static final List<Rule> STRING_RULES = List.of(Rule.parse("string", "String"));
    private static final List<Rule> DOC_RULES = List.of(
        Rule.parse("string", "String"),
        Rule.parse("module.expression_statement.string", "DocString"));

    @Test
    void highlight_installedLanguage_usesItsRules() {
        var engine = SyntaxHighlighter.engine();
        engine.install("python", DOC_RULES);

        assertEquals(List.of("DocString"), labels(engine.highlight("python", documentTree())));
    }

    @Test
    void highlight_unknownLanguage_returnsEmpty() {
        var engine = SyntaxHighlighter.engine();
        engine.install("python", DOC_RULES);

        assertTrue(engine.highlight("rust", documentTree()).isEmpty());
    }

    @Test
    void install_replacesPreviousRules() {
        var engine = SyntaxHighlighter.engine();
        engine.install("python", DOC_RULES);
        engine.install("python", STRING_RULES);

        assertEquals(List.of("String"), labels(engine.highlight("python", documentTree())));
        assertEquals(1, engine.matchTree("python").orElseThrow().ruleCount());
    }

    @Test
    void install_invalidRules_keepsPreviousTree() {
        var engine = SyntaxHighlighter.engine();
        var previous = engine.install("python", DOC_RULES);
        var broken = List.of(Rule.parse("comment", "Comment"), new Rule(List.of(), "Broken"));

        var error = assertThrows(RuleCompilationException.class, () -> engine.install("python", broken));

        assertEquals(new RuleError.EmptyRule(1), error.error());
        assertSame(previous, engine.matchTree("python").orElseThrow());
        assertEquals(List.of("DocString"), labels(engine.highlight("python", documentTree())));
    }

    @Test
    void tryInstall_invalidRules_reportsFalse() {
        var engine = SyntaxHighlighter.engine();

        assertTrue(engine.tryInstall("python", STRING_RULES));
        assertFalse(engine.tryInstall("python", List.of(Rule.of("", NodeDescriptor.of("string")))));
        assertEquals(List.of("String"), labels(engine.highlight("python", documentTree())));
    }

    @Test
    void tryInstall_firstInstallFails_leavesLanguageAbsent() {
        var engine = SyntaxHighlighter.engine();

        assertFalse(engine.tryInstall("python", List.of(new Rule(List.of(), "Broken"))));
        assertTrue(engine.matchTree("python").isEmpty());
    }

    @Test
    void languages_areIndependent() {
        var engine = SyntaxHighlighter.engine();
        engine.install("python", DOC_RULES);
        engine.install("plain", STRING_RULES);

        assertEquals(Set.of("python", "plain"), engine.languages());
        assertEquals(List.of("DocString"), labels(engine.highlight("python", documentTree())));
        assertEquals(List.of("String"), labels(engine.highlight("plain", documentTree())));

        assertTrue(engine.remove("plain"));
        assertFalse(engine.remove("plain"));
        assertEquals(Set.of("python"), engine.languages());
    }

    @Test
    void builder_repeatDisabled_rejectsRepeatableRules() {
        var engine = SyntaxHighlighter.builder()
                                      .repeat(false)
                                      .statistics(true)
                                      .build();

        var error = assertThrows(RuleCompilationException.class,
                                 () -> engine.install("python", List.of(Rule.parse("call.attribute+.identifier", "CalledMethod"))));

        assertInstanceOf(RuleError.RepeatNotAllowed.class, error.error());
    }

    @Test
    void highlight_concurrentWithReinstall_seesCompleteTrees() throws Exception {
        var engine = SyntaxHighlighter.engine();
        engine.install("python", DOC_RULES);
        var tree = documentTree();
        var executor = Executors.newFixedThreadPool(4);
        try {
            var tasks = new ArrayList<Callable<List<String>>>();
            for (int i = 0; i < 400; i++) {
                tasks.add(() -> labels(engine.highlight("python", tree)));
            }
            var futures = new ArrayList<Future<List<String>>>();
            for (var task : tasks) {
                futures.add(executor.submit(task));
                engine.install("python", futures.size() % 2 == 0 ? DOC_RULES : STRING_RULES);
            }
            for (var future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS)).isIn(List.of("DocString"), List.of("String"));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void facade_compileAndHighlight_matchesEngine() {
        var matchTree = SyntaxHighlighter.compile(DOC_RULES);

        assertEquals(List.of("DocString"), labels(SyntaxHighlighter.highlight(documentTree(), matchTree)));
    }

    private static TreeNode documentTree() {
        return node("module", TEXT.span(0, 7),
                    node("expression_statement", TEXT.span(4, 7),
                         node("string", TEXT.spanOf("'a'"))));
    }

    private static List<String> labels(List<HighlightInstruction> instructions) {
        return instructions.stream()
                           .map(HighlightInstruction::label)
                           .toList();
    }
}
