package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a handler parameter to the whole query string, decoded as the parameter type.
 *
 * <p>{@code Optional} and defaulted parameters never fail the request: decode errors
 * yield absence.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.SOURCE)
public @interface QueryContent {
}
