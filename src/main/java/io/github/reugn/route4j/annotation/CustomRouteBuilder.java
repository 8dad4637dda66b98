package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a method that registers routes by hand.
 *
 * <p>The method must take exactly one parameter of type
 * {@link io.github.reugn.route4j.runtime.RoutesBuilder} and must not return a
 * {@link java.util.concurrent.CompletionStage}: route registration is synchronous. Route
 * builders run after all endpoints, in declaration order.
 *
 * <p><b>Global Settings:</b>
 * <p>By default a route builder receives the ungrouped surface. It receives the surface
 * grouped by the controller's path and middleware when either
 * <ul>
 *   <li>{@link #useControllerGlobalSetting()} is {@code true}, or</li>
 *   <li>{@link #globalSettingCondition()} evaluates to {@code true} when the routes are booted</li>
 * </ul>
 * <pre>
 * {@code
 * @Controller(path = "admin")
 * public class AdminController {
 *     boolean grouped;
 *
 *     @CustomRouteBuilder(globalSettingCondition = "controller.grouped")
 *     void legacy(RoutesBuilder routes) { ... }
 * }
 * }
 * </pre>
 * At most one of the two elements may be set.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.SOURCE)
public @interface CustomRouteBuilder {
    boolean useControllerGlobalSetting() default false;

    /**
     * A Java boolean expression evaluated inside the generated {@code boot} method, where the
     * controller instance is in scope as {@code controller}. The literals {@code "true"} and
     * {@code "false"} are resolved at compile time.
     *
     * @return the condition expression, or empty for none
     */
    String globalSettingCondition() default "";
}
