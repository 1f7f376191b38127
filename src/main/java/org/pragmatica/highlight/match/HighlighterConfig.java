package org.pragmatica.highlight.match;

/**
 * Match tree compilation and matching options.
 *
 * @param allowRepeat   accept repeatable descriptors ({@code name+}) in rules
 * @param logStatistics log node and instruction counts with timing after each highlight run
 */
public record HighlighterConfig(
    boolean allowRepeat,
    boolean logStatistics
) {
    public static final HighlighterConfig DEFAULT = new HighlighterConfig(
        true,
        false
    );
}
