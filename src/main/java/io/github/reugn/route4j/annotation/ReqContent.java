package io.github.reugn.route4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a handler parameter to the request body, decoded as the parameter type.
 *
 * <p>A required parameter fails the request when the body cannot be decoded. For
 * {@code Optional} and defaulted parameters any decode error is treated as an absent body:
 * <pre>
 * {@code
 * @POST("books")
 * public String create(@ReqContent Optional<Book> book) {
 *     return book.map(Book::title).orElse("no book");
 * }
 * }
 * </pre>
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.SOURCE)
public @interface ReqContent {
}
