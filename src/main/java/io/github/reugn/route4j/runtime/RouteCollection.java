package io.github.reugn.route4j.runtime;

/**
 * A set of routes that registers itself on a {@link RoutesBuilder}.
 *
 * <p>Every {@code @Controller} class gets a generated implementation named
 * {@code {ControllerName}Routes}.
 */
public interface RouteCollection {

    /**
     * Registers all routes of this collection.
     *
     * @param routes the surface to register on
     * @throws Exception if a custom route builder fails
     */
    void boot(RoutesBuilder routes) throws Exception;
}
