package org.pragmatica.highlight.tree;

import java.util.Objects;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public SourceSpan {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Span end " + end + " precedes start " + start);
        }
    }

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public boolean contains(int offset) {
        return offset >= start.offset() && offset < end.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
