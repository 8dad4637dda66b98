package io.github.reugn.route4j.runtime;

/**
 * An incoming request as seen by generated route adapters.
 *
 * <p>The host framework supplies the implementation. Generated code reads values through
 * the containers below and through arbitrary accessor chains declared with
 * {@link io.github.reugn.route4j.annotation.RequestField} and
 * {@link io.github.reugn.route4j.annotation.Req}.
 */
public interface Request {

    /**
     * Returns the HTTP method the request was made with.
     *
     * @return the request method
     */
    HttpMethod method();

    /**
     * Returns the request target as received, including the query string.
     *
     * @return the raw request URL
     */
    String url();

    /**
     * Returns the path parameters captured by the matched route.
     *
     * @return the path parameter view
     */
    Parameters parameters();

    /**
     * Returns the decodable request body.
     *
     * @return the body view
     */
    ContentContainer content();

    /**
     * Returns the query string view.
     *
     * @return the query view
     */
    QueryContainer query();

    /**
     * Returns the store of principals authenticated by earlier middleware.
     *
     * @return the authentication view
     */
    AuthContainer auth();
}
