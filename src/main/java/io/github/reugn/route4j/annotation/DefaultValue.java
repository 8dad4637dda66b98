package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Specifies the value a handler parameter takes when its request source yields nothing.
 * <p>
 * A defaulted parameter never fails the request: a missing path parameter, query key or
 * principal, or an undecodable body, falls back to the default instead.
 * <p>
 * The default can be either:
 * <ul>
 *   <li>A <b>string literal</b> via {@link #value()} - parsed according to the parameter type</li>
 *   <li>A <b>static field reference</b> via {@link #field()} - for constants and complex types</li>
 * </ul>
 *
 * <p><b>String Literal (value):</b>
 * <pre>
 * {@code
 * @GET("books")
 * public List<Book> list(
 *         @QueryParam @DefaultValue("1") int page,
 *         @QueryParam @DefaultValue("title") String sort) {
 *     // ...
 * }
 * }
 * </pre>
 * <p>
 * Supported types for string literals:
 * <ul>
 *   <li>Primitives: int, long, double, float, boolean, byte, short, char</li>
 *   <li>Wrapper types: Integer, Long, Double, Float, Boolean, Byte, Short, Character</li>
 *   <li>String</li>
 *   <li>null (use "null" as value for reference types)</li>
 * </ul>
 * For an {@code Optional<T>} parameter the literal is parsed as {@code T}.
 *
 * <p><b>Static Field Reference (field):</b>
 * <pre>
 * {@code
 * @Controller
 * public class SearchController {
 *     static final Filter DEFAULT_FILTER = Filter.all();
 *
 *     @GET("search")
 *     public Result search(@QueryContent @DefaultValue(field = "DEFAULT_FILTER") Filter filter) {
 *         // ...
 *     }
 * }
 * }
 * </pre>
 *
 * @see DefaultFactory
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.SOURCE)
public @interface DefaultValue {
    /**
     * The default value as a string literal.
     * <p>
     * Either {@code value} or {@link #field()} must be specified, but not both.
     *
     * @return the default value as a string, or empty if using {@link #field()}
     */
    String value() default "";

    /**
     * Reference to a static field (constant).
     * <p>
     * The field can be specified as:
     * <ul>
     *   <li>{@code "FIELD_NAME"} - for fields in the controller class</li>
     *   <li>{@code "ClassName.FIELD_NAME"} - for fields in another class (same package)</li>
     *   <li>{@code "com.example.ClassName.FIELD_NAME"} - fully qualified (required for other packages)</li>
     * </ul>
     * <p>
     * The field must be static, not {@code private}, and of a type assignable to the parameter.
     *
     * @return the static field reference, or empty if using {@link #value()}
     */
    String field() default "";
}
