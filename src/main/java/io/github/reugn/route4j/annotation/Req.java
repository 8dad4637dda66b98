package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a handler parameter to the raw request, or to a part of it.
 *
 * <pre>
 * {@code
 * @GET("whoami")
 * public String whoami(@Req Request request, @Req("url") String url) { ... }
 * }
 * </pre>
 *
 * @see RequestField
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.SOURCE)
public @interface Req {
    String value() default "";
}
