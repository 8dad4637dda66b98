package io.github.reugn.route4j.annotation;

import io.github.reugn.route4j.runtime.BodyStreamStrategy;
import io.github.reugn.route4j.runtime.Middleware;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a controller method as an endpoint.
 *
 * <p>Each parameter of the method is extracted from the request according to its source
 * annotation ({@link PathParam} when none is present) and the method is invoked through a
 * generated adapter.
 *
 * <p><b>Defaults:</b>
 * <table border="1">
 *   <caption>Element defaults</caption>
 *   <tr><th>Element</th><th>Default</th></tr>
 *   <tr><td>{@link #method()}</td><td>{@code "GET"}</td></tr>
 *   <tr><td>{@link #path()}</td><td>a single segment equal to the method name</td></tr>
 *   <tr><td>{@link #middleware()}</td><td>none</td></tr>
 *   <tr><td>{@link #body()}</td><td>{@link BodyStreamStrategy#COLLECT}</td></tr>
 * </table>
 *
 * <pre>
 * {@code
 * @EndPoint(method = "POST", path = {"books", ":id", "cover"}, body = BodyStreamStrategy.STREAM)
 * public String upload(String id, @ReqContent byte[] image) { ... }
 * }
 * </pre>
 *
 * @see GET
 * @see CustomEndPoint
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.SOURCE)
public @interface EndPoint {
    /**
     * The HTTP method; any RFC 9110 token, case-insensitive.
     *
     * @return the method name
     */
    String method() default "GET";

    /**
     * The path segments. An explicitly empty array registers the endpoint at the root of
     * the controller's surface.
     *
     * @return the path segments
     */
    String[] path() default {};

    /**
     * Middleware applied to this endpoint only, after the controller's global middleware.
     *
     * @return the middleware types
     */
    Class<? extends Middleware>[] middleware() default {};

    BodyStreamStrategy body() default BodyStreamStrategy.COLLECT;
}
