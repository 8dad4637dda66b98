package io.github.reugn.route4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.TypeName;

import javax.lang.model.element.TypeElement;
import java.util.List;

/**
 * Everything the route collection of one controller is generated from.
 *
 * @param element          the controller type
 * @param controllerType   the controller class name
 * @param generatedType    the generated route collection class name
 * @param globalPath       path segments applied to every endpoint
 * @param globalMiddleware middleware applied to every endpoint, outermost first
 * @param endpoints        declared endpoints, then custom endpoints, each in declaration order
 * @param routeBuilders    route builders in declaration order
 */
record ControllerSpec(TypeElement element, ClassName controllerType, ClassName generatedType,
                      List<String> globalPath, List<TypeName> globalMiddleware,
                      List<EndpointSpec> endpoints, List<RouteBuilderSpec> routeBuilders) {

    ControllerSpec {
        globalPath = List.copyOf(globalPath);
        globalMiddleware = List.copyOf(globalMiddleware);
        endpoints = List.copyOf(endpoints);
        routeBuilders = List.copyOf(routeBuilders);
    }

    boolean hasGlobalGrouping() {
        return !globalPath.isEmpty() || !globalMiddleware.isEmpty();
    }
}
