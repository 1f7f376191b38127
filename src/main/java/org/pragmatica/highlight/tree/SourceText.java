package org.pragmatica.highlight.tree;

import java.util.Arrays;
import java.util.Objects;

/**
 * Document text with a line index, used to turn parser positions into {@link SourceLocation}s.
 *
 * <p>Parsers report positions either as character offsets or as 0-based (row, column) points.
 * Both forms are converted to the 1-based line/column locations carried by {@link SourceSpan}.
 */
public final class SourceText {
    private final String text;
    private final int[] lineStarts;

    private SourceText(String text, int[] lineStarts) {
        this.text = text;
        this.lineStarts = lineStarts;
    }

    public static SourceText of(String text) {
        Objects.requireNonNull(text, "text");
        var starts = new int[16];
        var count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new SourceText(text, Arrays.copyOf(starts, count));
    }

    public String text() {
        return text;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Location of a character offset. The offset may equal the text length (end of input).
     */
    public SourceLocation location(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0, " + text.length() + "]");
        }
        var index = Arrays.binarySearch(lineStarts, offset);
        var lineIndex = index >= 0 ? index : -index - 2;
        return SourceLocation.at(lineIndex + 1, offset - lineStarts[lineIndex] + 1, offset);
    }

    /**
     * Location of a 0-based (row, column) point.
     */
    public SourceLocation point(int row, int column) {
        if (row < 0 || row >= lineStarts.length) {
            throw new IndexOutOfBoundsException("Row " + row + " outside [0, " + lineStarts.length + ")");
        }
        var rowEnd = row + 1 < lineStarts.length ? lineStarts[row + 1] - 1 : text.length();
        var offset = lineStarts[row] + column;
        if (column < 0 || offset > rowEnd) {
            throw new IndexOutOfBoundsException("Column " + column + " outside row " + row
                                                + " of length " + (rowEnd - lineStarts[row]));
        }
        return SourceLocation.at(row + 1, column + 1, offset);
    }

    public SourceSpan span(int startOffset, int endOffset) {
        return SourceSpan.of(location(startOffset), location(endOffset));
    }

    /**
     * Span of the first occurrence of {@code fragment} at or after {@code fromOffset}.
     */
    public SourceSpan spanOf(String fragment, int fromOffset) {
        var start = text.indexOf(fragment, fromOffset);
        if (start < 0) {
            throw new IllegalArgumentException("'" + fragment + "' not found after offset " + fromOffset);
        }
        return span(start, start + fragment.length());
    }

    public SourceSpan spanOf(String fragment) {
        return spanOf(fragment, 0);
    }
}
