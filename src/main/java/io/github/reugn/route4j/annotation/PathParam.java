package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a handler parameter to a path parameter of the matched route.
 *
 * <p>This is also the source of every parameter that carries no source annotation.
 *
 * <p><b>Extraction:</b>
 * <table border="1">
 *   <caption>Generated extraction by parameter shape</caption>
 *   <tr><th>Parameter</th><th>Missing or malformed value</th></tr>
 *   <tr><td>{@code T name}</td><td>request fails with 400</td></tr>
 *   <tr><td>{@code Optional<T> name}</td><td>empty</td></tr>
 *   <tr><td>{@code @DefaultValue("..") T name}</td><td>the default</td></tr>
 * </table>
 *
 * <pre>
 * {@code
 * @GET({"books", ":id"})
 * public Book find(@PathParam("id") long bookId) { ... }
 * }
 * </pre>
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.SOURCE)
public @interface PathParam {
    /**
     * The path parameter name; defaults to the parameter name.
     *
     * @return the key
     */
    String value() default "";
}
