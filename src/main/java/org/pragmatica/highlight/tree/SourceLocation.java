package org.pragmatica.highlight.tree;

/**
 * A position in source text (line and column 1-based, offset 0-based).
 */
public record SourceLocation(int line, int column, int offset) {
    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public boolean isBefore(SourceLocation other) {
        return offset < other.offset;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
