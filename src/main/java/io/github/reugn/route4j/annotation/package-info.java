/**
 * Annotations describing routes in Java.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.route4j.annotation.Controller} - Marks a class whose methods form a route collection</li>
 *   <li>{@link io.github.reugn.route4j.annotation.EndPoint} and the method shorthands
 *       ({@code @GET}, {@code @POST}, ...) - Declare endpoints with extracted parameters</li>
 *   <li>{@link io.github.reugn.route4j.annotation.CustomEndPoint} - Declares an endpoint receiving the raw request</li>
 *   <li>{@link io.github.reugn.route4j.annotation.CustomRouteBuilder} - Declares a hand-written route registration</li>
 *   <li>Parameter sources: {@code @PathParam}, {@code @QueryParam}, {@code @QueryContent},
 *       {@code @ReqContent}, {@code @AuthContent}, {@code @RequestField}, {@code @Req}</li>
 *   <li>{@link io.github.reugn.route4j.annotation.DefaultValue} and
 *       {@link io.github.reugn.route4j.annotation.DefaultFactory} - Fallbacks for absent values</li>
 * </ul>
 * <p>
 * All annotations are processed by {@link io.github.reugn.route4j.processor.RouteControllerProcessor},
 * generating one {@code {ClassName}Routes} class per controller.
 *
 * @see io.github.reugn.route4j.processor.RouteControllerProcessor
 */
package io.github.reugn.route4j.annotation;
