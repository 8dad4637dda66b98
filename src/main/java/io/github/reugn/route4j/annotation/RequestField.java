package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a handler parameter to a value projected off the request by a chain of no-argument
 * accessors.
 *
 * <p>The path {@code "method.name"} generates {@code request.method().name()}. The
 * projection always succeeds, so {@link DefaultValue} and {@link DefaultFactory} have no
 * effect here. An empty path yields the request itself.
 *
 * @see Req
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.SOURCE)
public @interface RequestField {
    /**
     * Dot-separated accessor names, starting from {@link io.github.reugn.route4j.runtime.Request}.
     *
     * @return the accessor path
     */
    String value() default "";
}
