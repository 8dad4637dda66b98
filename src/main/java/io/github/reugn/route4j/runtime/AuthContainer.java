package io.github.reugn.route4j.runtime;

import java.util.Optional;

/**
 * Principals attached to a request by authentication middleware.
 */
public interface AuthContainer {

    <T> Optional<T> get(Class<T> type);

    /**
     * Returns the authenticated principal of the given type.
     *
     * @param type the principal type
     * @param <T>  the principal type
     * @return the principal
     * @throws Abort with status 401 if no such principal was authenticated
     */
    <T> T require(Class<T> type);
}
