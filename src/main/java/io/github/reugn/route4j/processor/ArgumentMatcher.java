package io.github.reugn.route4j.processor;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups annotation call arguments by rule.
 *
 * <p><b>Algorithm:</b>
 * <p>Rules are walked in order with a single cursor over the arguments. A rule whose label
 * equals the label at the cursor consumes that argument; a variadic rule then also consumes
 * every following unlabeled argument. A rule that does not match is skipped if it is
 * skippable and fails the match otherwise. Arguments left after the last rule fail the
 * match.
 *
 * <p>There is no backtracking, so rule tables must be unambiguous: a variadic rule may
 * only be followed by a labeled rule or nothing.
 *
 * <p><b>Example:</b>
 * <pre>
 * rules:     [&lt;unlabeled&gt;...?, middleware...?]
 * arguments: ("a"), ("b"), (middleware: M1), (M2)
 * buckets:   [("a"), ("b")], [(middleware: M1), (M2)]
 * </pre>
 */
final class ArgumentMatcher {

    private ArgumentMatcher() {
    }

    /**
     * Matches arguments against rules.
     *
     * @param rules     the rule table
     * @param arguments the call arguments in written order
     * @param <V>       the argument value type
     * @return one bucket per rule, in rule order; concatenated, the buckets equal {@code arguments}
     * @throws ArgumentMatchException if a required rule is unmatched or arguments are left over
     */
    static <V> List<List<Argument<V>>> match(List<ParsingRule> rules, List<Argument<V>> arguments)
            throws ArgumentMatchException {
        List<List<Argument<V>>> buckets = new ArrayList<>(rules.size());
        int cursor = 0;

        for (int ruleIndex = 0; ruleIndex < rules.size(); ruleIndex++) {
            ParsingRule rule = rules.get(ruleIndex);
            List<Argument<V>> bucket = new ArrayList<>();

            if (cursor >= arguments.size() || !rule.accepts(arguments.get(cursor))) {
                if (!rule.skippable()) {
                    throw ArgumentMatchException.notMatch(ruleIndex, rule, cursor);
                }
                buckets.add(List.of());
                continue;
            }

            bucket.add(arguments.get(cursor++));
            if (rule.variadic()) {
                while (cursor < arguments.size() && arguments.get(cursor).label() == null) {
                    bucket.add(arguments.get(cursor++));
                }
            }
            buckets.add(List.copyOf(bucket));
        }

        if (cursor < arguments.size()) {
            throw ArgumentMatchException.extraArguments(cursor, arguments.get(cursor));
        }
        return buckets;
    }
}
