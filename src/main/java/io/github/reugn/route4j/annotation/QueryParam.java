package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a handler parameter to a single query string key.
 *
 * <p>Required parameters fail the request with 400 when the key is missing or malformed;
 * {@code Optional} parameters become empty; defaulted parameters fall back to their default.
 *
 * @see QueryContent
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.SOURCE)
public @interface QueryParam {
    /**
     * The query key; defaults to the parameter name.
     *
     * @return the key
     */
    String value() default "";
}
