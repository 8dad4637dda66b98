package io.github.reugn.route4j.processor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.github.reugn.route4j.processor.Argument.labeled;
import static io.github.reugn.route4j.processor.Argument.unlabeled;
import static io.github.reugn.route4j.processor.ParsingRule.labeledVarArg;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for grouping annotation arguments by rule.
 * <p>
 * Covers:
 * <ul>
 *   <li>Variadic rules consuming following unlabeled arguments</li>
 *   <li>Skippable rules producing empty buckets</li>
 *   <li>Missing required arguments and leftover arguments</li>
 *   <li>Buckets concatenating back to the original arguments</li>
 * </ul>
 */
@DisplayName("Argument Matcher")
class ArgumentMatcherTest {

    private static List<String> values(List<Argument<String>> bucket) {
        return bucket.stream().map(Argument::value).toList();
    }

    @Nested
    @DisplayName("Successful Matches")
    class SuccessfulMatches {

        @Test
        @DisplayName("Shorthand rules split path segments from middleware")
        void shorthandRules() throws ArgumentMatchException {
            List<Argument<String>> arguments = List.of(
                    unlabeled("books"), unlabeled(":id"), labeled("middleware", "Auth"), unlabeled("Log"));

            List<List<Argument<String>>> buckets =
                    ArgumentMatcher.match(EndpointKind.METHOD_SHORTHAND.rules(), arguments);

            assertThat(buckets).hasSize(2);
            assertThat(values(buckets.get(0))).containsExactly("books", ":id");
            assertThat(values(buckets.get(1))).containsExactly("Auth", "Log");
        }

        @Test
        @DisplayName("Skipped rules produce empty buckets")
        void skippedRules() throws ArgumentMatchException {
            List<Argument<String>> arguments = List.of(labeled("path", "books"), labeled("body", "STREAM"));

            List<List<Argument<String>>> buckets = ArgumentMatcher.match(EndpointKind.ENDPOINT.rules(), arguments);

            assertThat(buckets).hasSize(4);
            assertThat(buckets.get(EndpointKind.METHOD)).isEmpty();
            assertThat(values(buckets.get(EndpointKind.PATH))).containsExactly("books");
            assertThat(buckets.get(EndpointKind.MIDDLEWARE)).isEmpty();
            assertThat(values(buckets.get(EndpointKind.BODY))).containsExactly("STREAM");
        }

        @Test
        @DisplayName("Trailing skippable rules accept no arguments")
        void noArguments() throws ArgumentMatchException {
            List<List<Argument<String>>> buckets =
                    ArgumentMatcher.match(EndpointKind.CUSTOM_ROUTE_BUILDER.rules(), List.<Argument<String>>of());

            assertThat(buckets).containsExactly(List.of(), List.of());
        }

        @Test
        @DisplayName("Buckets concatenate back to the arguments in order")
        void bucketsReconstructArguments() throws ArgumentMatchException {
            List<Argument<String>> arguments = List.of(
                    labeled("method", "POST"), labeled("path", "a"), unlabeled("b"),
                    labeled("middleware", "M1"), unlabeled("M2"), labeled("body", "COLLECT"));

            List<List<Argument<String>>> buckets = ArgumentMatcher.match(EndpointKind.ENDPOINT.rules(), arguments);

            List<Argument<String>> concatenated = new ArrayList<>();
            buckets.forEach(concatenated::addAll);
            assertThat(concatenated).isEqualTo(arguments);
        }
    }

    @Nested
    @DisplayName("Failed Matches")
    class FailedMatches {

        @Test
        @DisplayName("Empty rule list rejects any argument")
        void emptyRulesRejectArguments() {
            assertThatThrownBy(() -> ArgumentMatcher.match(List.of(), List.of(unlabeled("x"))))
                    .isInstanceOf(ArgumentMatchException.class)
                    .hasMessageContaining("Unexpected extra argument #0")
                    .satisfies(e -> {
                        ArgumentMatchException failure = (ArgumentMatchException) e;
                        assertThat(failure.kind()).isEqualTo(ArgumentMatchException.Kind.EXTRA_ARGUMENTS);
                        assertThat(failure.ruleIndex()).isEqualTo(-1);
                    });
        }

        @Test
        @DisplayName("Required rule without argument names its index")
        void missingRequiredArgument() {
            List<ParsingRule> rules = List.of(labeledVarArg("path").optional(), ParsingRule.labeled("body"));

            assertThatThrownBy(() -> ArgumentMatcher.match(rules, List.of(labeled("path", "a"))))
                    .isInstanceOf(ArgumentMatchException.class)
                    .hasMessageContaining("rule #1 (body)")
                    .satisfies(e -> {
                        ArgumentMatchException failure = (ArgumentMatchException) e;
                        assertThat(failure.kind()).isEqualTo(ArgumentMatchException.Kind.NOT_MATCH);
                        assertThat(failure.ruleIndex()).isEqualTo(1);
                        assertThat(failure.argumentIndex()).isEqualTo(1);
                    });
        }

        @Test
        @DisplayName("Out-of-order labels are left over")
        void outOfOrderLabels() {
            List<Argument<String>> arguments = List.of(labeled("body", "STREAM"), labeled("method", "GET"));

            assertThatThrownBy(() -> ArgumentMatcher.match(EndpointKind.ENDPOINT.rules(), arguments))
                    .isInstanceOf(ArgumentMatchException.class)
                    .hasMessageContaining("Unexpected extra argument #1 ('method')");
        }

        @Test
        @DisplayName("Unlabeled argument after a non-variadic rule is left over")
        void unlabeledAfterLabeled() {
            List<Argument<String>> arguments = List.of(labeled("method", "GET"), unlabeled("stray"));

            assertThatThrownBy(() -> ArgumentMatcher.match(EndpointKind.ENDPOINT.rules(), arguments))
                    .isInstanceOf(ArgumentMatchException.class)
                    .hasMessageContaining("(unlabeled)");
        }
    }

    @Test
    @DisplayName("Rules render their label and flags")
    void ruleToString() {
        assertThat(ParsingRule.unlabeledVarArg().optional()).hasToString("<unlabeled>...?");
        assertThat(ParsingRule.labeled("method")).hasToString("method");
    }
}
