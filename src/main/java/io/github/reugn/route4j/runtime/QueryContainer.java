package io.github.reugn.route4j.runtime;

import java.util.Optional;

/**
 * The query string of a request, either as single keys or decoded as a whole.
 */
public interface QueryContainer {

    /**
     * Decodes the entire query string as the given type.
     *
     * @param type the target type
     * @param <T>  the target type
     * @return the decoded value
     * @throws Abort if the query cannot be decoded
     */
    <T> T decode(Class<T> type);

    /**
     * Looks up a single query key.
     *
     * @param key  the query key
     * @param type the target type
     * @param <T>  the target type
     * @return the converted value, or empty if the key is absent or not convertible
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Looks up a single query key that must be present.
     *
     * @param key  the query key
     * @param type the target type
     * @param <T>  the target type
     * @return the converted value
     * @throws Abort with status 400 if the key is absent or not convertible
     */
    <T> T require(String key, Class<T> type);
}
