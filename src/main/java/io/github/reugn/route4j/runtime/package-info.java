/**
 * Host framework contract consumed by generated route registration code.
 * <p>
 * The host supplies implementations of {@link io.github.reugn.route4j.runtime.Request}
 * and {@link io.github.reugn.route4j.runtime.RoutesBuilder}; generated classes implement
 * {@link io.github.reugn.route4j.runtime.RouteCollection}.
 */
package io.github.reugn.route4j.runtime;
