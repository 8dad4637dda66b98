package io.github.reugn.route4j.processor;

/**
 * Whether a route builder receives the controller's globally grouped routes.
 *
 * <p>A flag is either known while generating ({@code true}/{@code false}) or deferred to a
 * boolean expression evaluated by the generated {@code boot} method.
 *
 * @param value      the known value; meaningless when deferred
 * @param expression the deferred expression, or {@code null} when known
 */
record GroupingFlag(boolean value, String expression) {

    static GroupingFlag known(boolean value) {
        return new GroupingFlag(value, null);
    }

    static GroupingFlag deferred(String expression) {
        return new GroupingFlag(false, expression);
    }

    boolean isDeferred() {
        return expression != null;
    }

    @Override
    public String toString() {
        return isDeferred() ? "Deferred(" + expression + ")" : "Known(" + value + ")";
    }
}
