package org.pragmatica.highlight.error;

/**
 * Rule compilation error with enough context to locate the offending rule.
 */
public sealed interface RuleError {
    String message();

    /**
     * Rule with no node descriptors.
     */
    record EmptyRule(int index) implements RuleError {
        @Override
        public String message() {
            return "Rule #" + index + " has no node descriptors";
        }
    }

    /**
     * Rule whose label is blank.
     */
    record BlankLabel(int index, String path) implements RuleError {
        @Override
        public String message() {
            return "Rule #" + index + " (" + path + ") has a blank label";
        }
    }

    /**
     * Rule path text that cannot be split into descriptors.
     */
    record MalformedPath(String path, String reason) implements RuleError {
        @Override
        public String message() {
            return "Malformed rule path '" + path + "': " + reason;
        }
    }

    /**
     * Repeatable descriptor used while repetition is disabled.
     */
    record RepeatNotAllowed(int index, String descriptor) implements RuleError {
        @Override
        public String message() {
            return "Rule #" + index + " uses repeatable descriptor '" + descriptor + "' but repetition is disabled";
        }
    }
}
