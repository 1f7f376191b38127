package org.pragmatica.highlight.match;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import org.pragmatica.highlight.tree.SourceSpan;

import java.util.List;
import java.util.Objects;

/**
 * Highlight category for the span of one matched syntax node.
 */
public record HighlightInstruction(SourceSpan span, String label) {

    public HighlightInstruction {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(label, "label");
    }

    /**
     * Group spans by label. Labels keep the order of their first instruction, spans keep
     * instruction order within a label.
     */
    public static ListMultimap<String, SourceSpan> byLabel(List<HighlightInstruction> instructions) {
        var grouped = ImmutableListMultimap.<String, SourceSpan>builder();
        for (var instruction : instructions) {
            grouped.put(instruction.label(), instruction.span());
        }
        return grouped.build();
    }

    @Override
    public String toString() {
        return label + "@" + span;
    }
}
