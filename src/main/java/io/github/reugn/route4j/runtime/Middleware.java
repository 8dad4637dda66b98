package io.github.reugn.route4j.runtime;

/**
 * Intercepts requests before they reach a route's responder.
 *
 * <p>Middleware referenced from route annotations is instantiated by generated code through
 * its public no-argument constructor.
 */
public interface Middleware {

    /**
     * Handles the request, usually by delegating to {@code next}.
     *
     * @param request the incoming request
     * @param next    the rest of the chain
     * @return the response
     * @throws Exception if the request fails
     */
    Object respond(Request request, Responder next) throws Exception;
}
