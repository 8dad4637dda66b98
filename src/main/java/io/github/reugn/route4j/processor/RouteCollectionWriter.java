package io.github.reugn.route4j.processor;

import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import io.github.reugn.route4j.runtime.BodyStreamStrategy;
import io.github.reugn.route4j.runtime.RouteCollection;
import io.github.reugn.route4j.runtime.RoutesBuilder;

import javax.lang.model.element.Modifier;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Emits the route collection class of a controller.
 *
 * <p><b>Generated Class:</b>
 * <pre>
 * {@code // Source
 * @Controller(path = "api")
 * public class GreetController {
 *     @GET(value = "greet", middleware = Logging.class)
 *     public String greet(String name) { ... }
 * }
 *
 * // Generated: GreetControllerRoutes.java
 * public final class GreetControllerRoutes implements RouteCollection {
 *     private final GreetController controller;
 *
 *     public GreetControllerRoutes(GreetController controller) { ... }
 *
 *     @Override
 *     public void boot(RoutesBuilder routes) {
 *         RoutesBuilder routeWithGlobalSetting = routes.grouped("api");
 *         routeWithGlobalSetting.grouped(new Logging()).on(HttpMethod.GET, List.of("greet"),
 *                 BodyStreamStrategy.COLLECT, this::handleGreet);
 *     }
 *
 *     private String handleGreet(Request request) { ... }
 * }}
 * </pre>
 *
 * <p>Emission is a pure function of the {@link ControllerSpec}; writing the result is left to
 * the caller.
 */
final class RouteCollectionWriter {

    static final String BOOT_METHOD = "boot";

    private static final String ROUTES = "routes";
    private static final String GLOBAL_ROUTES = "routeWithGlobalSetting";
    private static final String FILE_COMMENT = "Generated by route4j annotation processor. Do not modify.";

    private RouteCollectionWriter() {
    }

    static JavaFile write(ControllerSpec spec) {
        String field = ExtractionSynthesizer.CONTROLLER_FIELD;

        TypeSpec.Builder type = TypeSpec.classBuilder(spec.generatedType())
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addSuperinterface(RouteCollection.class)
                .addAnnotation(CodeGenUtils.generatedAnnotation())
                .addJavadoc("Route collection of {@link $T}.\n", spec.controllerType())
                .addJavadoc("<p>Generated by route4j annotation processor.\n")
                .addField(FieldSpec.builder(spec.controllerType(), field, Modifier.PRIVATE, Modifier.FINAL).build())
                .addMethod(MethodSpec.constructorBuilder()
                        .addModifiers(Modifier.PUBLIC)
                        .addParameter(spec.controllerType(), field)
                        .addStatement("this.$N = $T.requireNonNull($N, $S)", field, Objects.class, field, field)
                        .build())
                .addMethod(boot(spec));

        for (EndpointSpec endpoint : spec.endpoints()) {
            if (!endpoint.isCustom()) {
                type.addMethod(endpoint.adapter());
            }
        }

        return JavaFile.builder(spec.generatedType().packageName(), type.build())
                .addFileComment(FILE_COMMENT)
                .build();
    }

    private static MethodSpec boot(ControllerSpec spec) {
        MethodSpec.Builder boot = MethodSpec.methodBuilder(BOOT_METHOD)
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC)
                .addParameter(RoutesBuilder.class, ROUTES);

        Set<TypeName> thrown = new LinkedHashSet<>();
        for (RouteBuilderSpec routeBuilder : spec.routeBuilders()) {
            thrown.addAll(routeBuilder.thrownTypes());
        }
        boot.addExceptions(thrown);

        String routes = ROUTES;
        if (spec.hasGlobalGrouping()) {
            CodeBlock.Builder grouped = CodeBlock.builder().add("$N", ROUTES);
            if (!spec.globalPath().isEmpty()) {
                grouped.add(".grouped($L)", strings(spec.globalPath()));
            }
            if (!spec.globalMiddleware().isEmpty()) {
                grouped.add(".grouped($L)", instances(spec.globalMiddleware()));
            }
            boot.addStatement("$T $N = $L", RoutesBuilder.class, GLOBAL_ROUTES, grouped.build());
            routes = GLOBAL_ROUTES;
        }

        for (EndpointSpec endpoint : spec.endpoints()) {
            boot.addStatement(registration(endpoint, routes));
        }

        for (RouteBuilderSpec routeBuilder : spec.routeBuilders()) {
            boot.addStatement("this.$N.$N($L)", ExtractionSynthesizer.CONTROLLER_FIELD, routeBuilder.methodName(),
                    routeBuilderArgument(spec, routeBuilder.grouping()));
        }
        return boot.build();
    }

    private static CodeBlock registration(EndpointSpec endpoint, String routes) {
        CodeBlock.Builder code = CodeBlock.builder().add("$N", routes);
        if (!endpoint.middleware().isEmpty()) {
            code.add(".grouped($L)", instances(endpoint.middleware()));
        }
        return code.add(".on($L, $T.of($L), $T.$N, $L)",
                        endpoint.httpMethod(), List.class, strings(endpoint.path()),
                        BodyStreamStrategy.class, endpoint.body().name(), responder(endpoint))
                .build();
    }

    private static CodeBlock responder(EndpointSpec endpoint) {
        String target = endpoint.isCustom()
                ? endpoint.handler().getSimpleName().toString()
                : endpoint.adapter().name;
        String receiver = endpoint.isCustom() ? "this." + ExtractionSynthesizer.CONTROLLER_FIELD : "this";
        if (endpoint.returnsVoid()) {
            return CodeBlock.of("request -> {\n$>$L.$N(request);\nreturn null;\n$<}", receiver, target);
        }
        return CodeBlock.of("$L::$N", receiver, target);
    }

    private static CodeBlock routeBuilderArgument(ControllerSpec spec, GroupingFlag grouping) {
        if (!spec.hasGlobalGrouping()) {
            return CodeBlock.of("$N", ROUTES);
        }
        if (grouping.isDeferred()) {
            return CodeBlock.of("($L) ? $N : $N", grouping.expression(), GLOBAL_ROUTES, ROUTES);
        }
        return CodeBlock.of("$N", grouping.value() ? GLOBAL_ROUTES : ROUTES);
    }

    private static CodeBlock strings(List<String> values) {
        CodeBlock.Builder code = CodeBlock.builder();
        for (int i = 0; i < values.size(); i++) {
            code.add(i == 0 ? "$S" : ", $S", values.get(i));
        }
        return code.build();
    }

    private static CodeBlock instances(List<TypeName> types) {
        CodeBlock.Builder code = CodeBlock.builder();
        for (int i = 0; i < types.size(); i++) {
            code.add(i == 0 ? "new $T()" : ", new $T()", types.get(i));
        }
        return code.build();
    }
}
