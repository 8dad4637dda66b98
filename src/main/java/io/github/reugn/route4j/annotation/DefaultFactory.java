package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Specifies a static factory method producing the default of a handler parameter.
 * <p>
 * The factory is invoked only when the request source yields nothing, once per request:
 * <pre>
 * {@code
 * @Controller
 * public class EventController {
 *     static Instant now() {
 *         return Instant.now();
 *     }
 *
 *     @GET("events")
 *     public List<Event> since(@QueryParam @DefaultFactory("now") Instant since) {
 *         // ...
 *     }
 * }
 * }
 * </pre>
 *
 * <p><b>Method Reference Format:</b>
 * <ul>
 *   <li>{@code "methodName"} - method in the controller class</li>
 *   <li>{@code "ClassName.methodName"} - method in another class (same package)</li>
 *   <li>{@code "com.example.ClassName.methodName"} - fully qualified (required for other packages)</li>
 * </ul>
 * <p>
 * The method must be static, take no parameters, not be {@code private}, and return a
 * type assignable to the parameter.
 *
 * @see DefaultValue
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.SOURCE)
public @interface DefaultFactory {
    /**
     * Reference to a static factory method.
     *
     * @return the factory method reference
     */
    String value();
}
