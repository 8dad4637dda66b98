package io.github.reugn.route4j.runtime;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Helpers used by generated adapters for best-effort extraction.
 */
public final class Extraction {

    private Extraction() {
    }

    /**
     * Runs a fallible extraction and turns any runtime failure into absence.
     *
     * <p>Used for body and whole-query decoding of optional or defaulted parameters, where
     * a malformed payload must not fail the request.
     *
     * @param extraction the extraction to run
     * @param <T>        the extracted type
     * @return the extracted value, or empty if it was {@code null} or the extraction failed
     */
    public static <T> Optional<T> attempt(Supplier<T> extraction) {
        try {
            return Optional.ofNullable(extraction.get());
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }
}
