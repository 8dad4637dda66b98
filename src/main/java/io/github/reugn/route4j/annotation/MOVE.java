package io.github.reugn.route4j.annotation;

import io.github.reugn.route4j.runtime.Middleware;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Shorthand for {@code @EndPoint(method = "MOVE")}.
 *
 * @see EndPoint
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.SOURCE)
public @interface MOVE {
    /**
     * The path segments; defaults to the method name.
     *
     * @return the path segments
     */
    String[] value() default {};

    Class<? extends Middleware>[] middleware() default {};
}
