package io.github.reugn.route4j.runtime;

import java.util.Optional;

/**
 * Typed access to the path parameters of a matched route.
 */
public interface Parameters {

    /**
     * Looks up a path parameter, converting it to the requested type.
     *
     * @param name the parameter name
     * @param type the target type
     * @param <T>  the target type
     * @return the converted value, or empty if the parameter is absent or not convertible
     */
    <T> Optional<T> get(String name, Class<T> type);

    /**
     * Looks up a path parameter that must be present.
     *
     * @param name the parameter name
     * @param type the target type
     * @param <T>  the target type
     * @return the converted value
     * @throws Abort with status 400 if the parameter is absent or not convertible
     */
    <T> T require(String name, Class<T> type);
}
