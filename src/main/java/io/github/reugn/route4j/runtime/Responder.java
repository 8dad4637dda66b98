package io.github.reugn.route4j.runtime;

/**
 * Produces a response for a request.
 *
 * <p>The returned object is handed to the host framework as is; a
 * {@link java.util.concurrent.CompletionStage} result denotes an asynchronous response.
 */
@FunctionalInterface
public interface Responder {

    Object respond(Request request) throws Exception;
}
