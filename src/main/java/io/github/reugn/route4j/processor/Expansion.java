package io.github.reugn.route4j.processor;

import java.util.List;

/**
 * The outcome of expanding one annotated declaration: a value, or the problems that
 * prevented it.
 *
 * <p>Each endpoint of a controller expands independently, so a failed expansion never
 * affects its siblings.
 *
 * @param value    the expanded value; {@code null} on failure
 * @param problems the problems found; empty on success
 * @param <T>      the expanded value type
 */
record Expansion<T>(T value, List<Problem> problems) {

    Expansion {
        problems = List.copyOf(problems);
    }

    static <T> Expansion<T> success(T value) {
        return new Expansion<>(value, List.of());
    }

    static <T> Expansion<T> failure(List<Problem> problems) {
        if (problems.isEmpty()) {
            throw new IllegalStateException("A failed expansion must carry at least one problem");
        }
        return new Expansion<>(null, problems);
    }

    static <T> Expansion<T> failure(Problem problem) {
        return failure(List.of(problem));
    }

    boolean isSuccess() {
        return problems.isEmpty();
    }
}
