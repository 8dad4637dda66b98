package io.github.reugn.route4j.processor;

import com.squareup.javapoet.TypeName;

import javax.lang.model.element.ExecutableElement;
import java.util.List;

/**
 * A validated {@code @CustomRouteBuilder} method.
 *
 * @param handler     the annotated method
 * @param grouping    whether it receives the globally grouped routes
 * @param thrownTypes the exceptions it declares; {@code boot} rethrows them
 */
record RouteBuilderSpec(ExecutableElement handler, GroupingFlag grouping, List<TypeName> thrownTypes) {

    RouteBuilderSpec {
        thrownTypes = List.copyOf(thrownTypes);
    }

    String methodName() {
        return handler.getSimpleName().toString();
    }
}
