package io.github.reugn.route4j.runtime;

import java.util.List;

/**
 * A route registration surface.
 *
 * <p>Grouping returns a narrower surface: routes registered on the result carry the extra
 * path prefix or middleware in addition to those of this surface.
 */
public interface RoutesBuilder {

    /**
     * Registers a responder.
     *
     * @param method    the HTTP method
     * @param path      the path segments, relative to this surface
     * @param body      how the request body is handled before the responder runs
     * @param responder the responder
     */
    void on(HttpMethod method, List<String> path, BodyStreamStrategy body, Responder responder);

    /**
     * Derives a surface scoped under additional path segments.
     *
     * @param path the path prefix segments
     * @return the grouped surface
     */
    RoutesBuilder grouped(String... path);

    /**
     * Derives a surface whose routes run through additional middleware.
     *
     * @param middleware the middleware, outermost first
     * @return the grouped surface
     */
    RoutesBuilder grouped(Middleware... middleware);
}
