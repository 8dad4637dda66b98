package io.github.reugn.route4j.processor;

/**
 * Signals that annotation arguments do not fit a rule table.
 */
final class ArgumentMatchException extends Exception {

    enum Kind {
        /**
         * A required rule found no argument with its label at the cursor.
         */
        NOT_MATCH,
        /**
         * Arguments were left over after every rule was processed.
         */
        EXTRA_ARGUMENTS
    }

    private final Kind kind;
    private final int ruleIndex;
    private final int argumentIndex;

    private ArgumentMatchException(Kind kind, int ruleIndex, int argumentIndex, String message) {
        super(message);
        this.kind = kind;
        this.ruleIndex = ruleIndex;
        this.argumentIndex = argumentIndex;
    }

    static ArgumentMatchException notMatch(int ruleIndex, ParsingRule rule, int argumentIndex) {
        return new ArgumentMatchException(Kind.NOT_MATCH, ruleIndex, argumentIndex,
                "Missing or mismatched argument for rule #" + ruleIndex + " (" + rule + ") at argument #"
                        + argumentIndex + ".");
    }

    static ArgumentMatchException extraArguments(int argumentIndex, Argument<?> argument) {
        String label = argument.label() == null ? "unlabeled" : "'" + argument.label() + "'";
        return new ArgumentMatchException(Kind.EXTRA_ARGUMENTS, -1, argumentIndex,
                "Unexpected extra argument #" + argumentIndex + " (" + label + ").");
    }

    Kind kind() {
        return kind;
    }

    /**
     * Returns the index of the rule that failed to match.
     *
     * @return the rule index, or {@code -1} for extra arguments
     */
    int ruleIndex() {
        return ruleIndex;
    }

    int argumentIndex() {
        return argumentIndex;
    }
}
