package io.github.reugn.route4j.annotation;

import io.github.reugn.route4j.runtime.Middleware;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class whose annotated methods form a set of routes.
 *
 * <p>The processor generates {@code {ClassName}Routes}, a
 * {@link io.github.reugn.route4j.runtime.RouteCollection} that registers every endpoint,
 * custom endpoint and custom route builder declared in the class.
 *
 * <p><b>Global Settings:</b>
 * <p>When {@link #path()} or {@link #middleware()} is non-empty, endpoints are registered on a
 * surface grouped by the path first and the middleware second:
 * <pre>
 * {@code
 * @Controller(path = "api", middleware = TokenAuth.class)
 * public class BookController {
 *     @GET("books")
 *     public List<Book> list() { ... }            // GET /api/books, through TokenAuth
 * }
 *
 * // Usage
 * new BookControllerRoutes(new BookController()).boot(app.routes());
 * }
 * </pre>
 *
 * @see EndPoint
 * @see CustomRouteBuilder
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface Controller {
    /**
     * Path segments prefixed to every endpoint of the controller.
     *
     * @return the global path segments
     */
    String[] path() default {};

    /**
     * Middleware applied to every endpoint of the controller, outermost first.
     *
     * @return the global middleware types
     */
    Class<? extends Middleware>[] middleware() default {};
}
