package io.github.reugn.route4j.processor;

import java.util.Objects;

/**
 * One expected argument slot of a route annotation.
 *
 * <p>Rule tables are declared once per annotation kind, in the order the annotation declares
 * its elements. An unlabeled rule matches Java's implicit {@code value} element.
 *
 * @param label     the expected label, or {@code null} for an unlabeled argument
 * @param variadic  whether the rule also takes the unlabeled arguments that follow a match
 * @param skippable whether the rule may match nothing
 * @see ArgumentMatcher
 */
record ParsingRule(String label, boolean variadic, boolean skippable) {

    static ParsingRule labeled(String label) {
        return new ParsingRule(Objects.requireNonNull(label, "label"), false, false);
    }

    static ParsingRule labeledVarArg(String label) {
        return new ParsingRule(Objects.requireNonNull(label, "label"), true, false);
    }

    static ParsingRule unlabeled() {
        return new ParsingRule(null, false, false);
    }

    static ParsingRule unlabeledVarArg() {
        return new ParsingRule(null, true, false);
    }

    /**
     * Returns a copy of this rule that may be absent from the call.
     *
     * @return the skippable rule
     */
    ParsingRule optional() {
        return new ParsingRule(label, variadic, true);
    }

    boolean accepts(Argument<?> argument) {
        return Objects.equals(label, argument.label());
    }

    @Override
    public String toString() {
        String name = label == null ? "<unlabeled>" : label;
        return name + (variadic ? "..." : "") + (skippable ? "?" : "");
    }
}
