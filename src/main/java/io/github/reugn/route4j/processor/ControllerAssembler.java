package io.github.reugn.route4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.NameAllocator;
import com.squareup.javapoet.TypeName;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static io.github.reugn.route4j.processor.ParsingRule.labeledVarArg;

/**
 * Collects the endpoints and route builders of one {@code @Controller} type into a
 * {@link ControllerSpec}.
 *
 * <p><b>Assembly Steps:</b>
 * <ol>
 *   <li>Validate the controller type and its global path and middleware</li>
 *   <li>Scan its methods in declaration order and expand each route annotation on its own</li>
 *   <li>Report the problems of failed expansions; successful siblings are kept</li>
 * </ol>
 *
 * <p>A method may carry at most one route annotation. Unrelated annotations are ignored.
 */
final class ControllerAssembler {

    private static final List<ParsingRule> CONTROLLER_RULES = List.of(
            labeledVarArg("path").optional(),
            labeledVarArg("middleware").optional());

    private final ProcessingContext context;

    ControllerAssembler(ProcessingContext context) {
        this.context = context;
    }

    /**
     * Assembles the route collection spec of a controller.
     *
     * @param controller the type annotated with {@code @Controller}
     * @param mirror     the {@code @Controller} annotation
     * @return the controller spec, or {@code null} if the controller itself is invalid
     */
    ControllerSpec assemble(TypeElement controller, AnnotationMirror mirror) {
        ErrorReporter errorReporter = context.errorReporter();
        List<Problem> problems = ValidationUtils.validateController(controller, mirror);
        if (!problems.isEmpty()) {
            problems.forEach(errorReporter::error);
            return null;
        }

        List<List<Argument<AnnotationValue>>> buckets;
        try {
            buckets = ArgumentMatcher.match(CONTROLLER_RULES, AnnotationArguments.of(mirror));
        } catch (ArgumentMatchException e) {
            errorReporter.error(Problem.of(controller, mirror, "Invalid @Controller arguments: " + e.getMessage()));
            return null;
        }

        ClassName controllerType = ClassName.get(controller);
        String packageName = controllerType.packageName();
        List<String> globalPath = new ArrayList<>();
        for (AnnotationValue value : AnnotationArguments.values(buckets.get(0))) {
            globalPath.add((String) value.getValue());
        }
        boolean middlewareValid = true;
        List<TypeName> globalMiddleware = new ArrayList<>();
        for (AnnotationValue value : AnnotationArguments.values(buckets.get(1))) {
            TypeMirror type = (TypeMirror) value.getValue();
            if (ValidationUtils.validateMiddleware(type, controller, mirror, packageName,
                    context.elements(), errorReporter)) {
                globalMiddleware.add(TypeName.get(type));
            } else {
                middlewareValid = false;
            }
        }
        if (!middlewareValid) {
            return null;
        }

        NameAllocator adapterNames = new NameAllocator();
        adapterNames.newName(ExtractionSynthesizer.CONTROLLER_FIELD);
        adapterNames.newName(RouteCollectionWriter.BOOT_METHOD);

        List<EndpointSpec> endpoints = new ArrayList<>();
        List<EndpointSpec> customEndpoints = new ArrayList<>();
        List<RouteBuilderSpec> routeBuilders = new ArrayList<>();

        for (ExecutableElement method : ElementFilter.methodsIn(controller.getEnclosedElements())) {
            List<AnnotationMirror> mirrors = new ArrayList<>();
            List<RouteMarker> markers = new ArrayList<>();
            for (AnnotationMirror candidate : method.getAnnotationMirrors()) {
                RouteMarker marker = RouteMarker.forAnnotation(AnnotationArguments.qualifiedName(candidate));
                if (marker != null) {
                    mirrors.add(candidate);
                    markers.add(marker);
                }
            }
            if (markers.isEmpty()) {
                continue;
            }
            if (markers.size() > 1) {
                errorReporter.error(Problem.withFix(method, mirrors.get(1),
                        "Method '" + method.getSimpleName() + "' carries more than one route annotation: "
                                + markers.stream().map(RouteMarker::displayName).collect(Collectors.joining(", "))
                                + ".",
                        "keep exactly one route annotation per method"));
                continue;
            }

            RouteMarker marker = markers.get(0);
            EndpointSpecBuilder builder =
                    new EndpointSpecBuilder(context, controller, packageName, method, mirrors.get(0), marker);
            switch (marker.kind()) {
                case CUSTOM_ROUTE_BUILDER -> collect(builder, builder.buildRouteBuilder(), routeBuilders);
                case CUSTOM_ENDPOINT -> collect(builder, builder.buildEndpoint(adapterNames), customEndpoints);
                default -> collect(builder, builder.buildEndpoint(adapterNames), endpoints);
            }
        }

        endpoints.addAll(customEndpoints);

        if (globalPath.isEmpty() && globalMiddleware.isEmpty()) {
            for (RouteBuilderSpec routeBuilder : routeBuilders) {
                if (routeBuilder.grouping().isDeferred()) {
                    errorReporter.warning(routeBuilder.handler(), "globalSettingCondition '"
                            + routeBuilder.grouping().expression() + "' of route builder '" + routeBuilder.methodName()
                            + "' is ignored: controller '" + controller.getSimpleName()
                            + "' declares no path or middleware to group with.");
                }
            }
        }
        return new ControllerSpec(controller, controllerType,
                CodeGenUtils.generatedClassName(controller, context.options().classSuffix()),
                globalPath, globalMiddleware, endpoints, routeBuilders);
    }

    private <T> void collect(EndpointSpecBuilder builder, Expansion<T> expansion, List<T> target) {
        if (expansion.isSuccess()) {
            target.add(expansion.value());
            return;
        }
        expansion.problems().forEach(context.errorReporter()::error);
        if (context.options().verbose()) {
            context.errorReporter().note(builder.handler(), "Skipped '" + builder.handler().getSimpleName()
                    + "' after stage " + builder.lastCompletedStage() + ".");
        }
    }
}
