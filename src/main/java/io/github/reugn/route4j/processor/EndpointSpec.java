package io.github.reugn.route4j.processor;

import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;
import io.github.reugn.route4j.runtime.BodyStreamStrategy;

import javax.lang.model.element.ExecutableElement;
import javax.lang.model.type.TypeKind;
import java.util.ArrayList;
import java.util.List;

/**
 * A fully resolved endpoint, ready for emission.
 *
 * @param handler    the annotated method
 * @param httpMethod the expression of the {@code HttpMethod} to register
 * @param methodName the upper-cased method name, for diagnostics
 * @param path       the path segments; empty for the surface root
 * @param middleware the endpoint's own middleware types, outermost first
 * @param body       the body handling strategy
 * @param plans      one plan per handler parameter; empty for custom endpoints
 * @param adapter    the generated adapter, or {@code null} for custom endpoints
 */
record EndpointSpec(ExecutableElement handler, CodeBlock httpMethod, String methodName, List<String> path,
                    List<TypeName> middleware, BodyStreamStrategy body, List<ParameterPlan> plans,
                    MethodSpec adapter) {

    EndpointSpec {
        path = List.copyOf(path);
        middleware = List.copyOf(middleware);
        plans = List.copyOf(plans);
    }

    /**
     * Returns whether the handler takes the request itself and is registered without an
     * adapter.
     *
     * @return {@code true} for {@code @CustomEndPoint} handlers
     */
    boolean isCustom() {
        return adapter == null;
    }

    boolean returnsVoid() {
        return handler.getReturnType().getKind() == TypeKind.VOID;
    }

    /**
     * Describes the registration for progress notes, e.g. {@code GET /api/greet -> greet()}.
     *
     * @param globalPath the controller's global path
     * @return the description
     */
    String describe(List<String> globalPath) {
        List<String> fullPath = new ArrayList<>(globalPath);
        fullPath.addAll(path);
        return methodName + " /" + String.join("/", fullPath) + " -> " + handler.getSimpleName() + "()";
    }
}
