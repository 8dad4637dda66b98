package io.github.reugn.route4j.annotation;

import io.github.reugn.route4j.runtime.BodyStreamStrategy;
import io.github.reugn.route4j.runtime.Middleware;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares an endpoint that receives the raw request.
 *
 * <p>The method must take exactly one parameter of type
 * {@link io.github.reugn.route4j.runtime.Request}; it is registered directly, without an
 * extraction adapter. Elements and defaults are those of {@link EndPoint}.
 *
 * <pre>
 * {@code
 * @CustomEndPoint(method = "POST", path = "echo")
 * public String echo(Request request) {
 *     return request.content().decode(String.class);
 * }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.SOURCE)
public @interface CustomEndPoint {
    String method() default "GET";

    String[] path() default {};

    Class<? extends Middleware>[] middleware() default {};

    BodyStreamStrategy body() default BodyStreamStrategy.COLLECT;
}
