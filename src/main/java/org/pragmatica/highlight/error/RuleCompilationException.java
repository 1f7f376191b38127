package org.pragmatica.highlight.error;

/**
 * Thrown when rules cannot be compiled into a match tree.
 */
public final class RuleCompilationException extends RuntimeException {
    private final RuleError error;

    public RuleCompilationException(RuleError error) {
        super(error.message());
        this.error = error;
    }

    public RuleError error() {
        return error;
    }
}
