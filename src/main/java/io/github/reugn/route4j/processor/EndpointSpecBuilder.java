package io.github.reugn.route4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.NameAllocator;
import com.squareup.javapoet.TypeName;
import io.github.reugn.route4j.runtime.BodyStreamStrategy;
import io.github.reugn.route4j.runtime.HttpMethod;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.tools.Diagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Resolves one route annotation on one method into an {@link EndpointSpec} or a
 * {@link RouteBuilderSpec}.
 *
 * <p><b>Stages:</b>
 * <pre>
 * UNPARSED → RULES_MATCHED → PARAMETERS_CLASSIFIED → ADAPTER_SYNTHESIZED
 *     └──────────┴──────────────────┴──────────────────→ FAILED
 * </pre>
 *
 * <p>Every problem found on the way ends in {@link Stage#FAILED} and is returned in the
 * {@link Expansion}; nothing is reported directly, so the caller decides how a failure
 * affects the rest of the controller. Warnings and notes are forwarded as they occur.
 *
 * <p>A builder instance handles exactly one annotated method and is not reusable.
 */
final class EndpointSpecBuilder {

    /**
     * Progress of the resolution.
     */
    enum Stage {
        UNPARSED,
        RULES_MATCHED,
        PARAMETERS_CLASSIFIED,
        ADAPTER_SYNTHESIZED,
        FAILED
    }

    private static final Set<String> STANDARD_METHODS =
            Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS", "MOVE", "COPY");

    private final ProcessingContext context;
    private final TypeElement controller;
    private final ClassName controllerType;
    private final String packageName;
    private final ExecutableElement handler;
    private final AnnotationMirror mirror;
    private final RouteMarker marker;
    private final List<Problem> problems = new ArrayList<>();
    private final ErrorReporter collector;

    private Stage stage = Stage.UNPARSED;
    private Stage lastCompletedStage = Stage.UNPARSED;

    EndpointSpecBuilder(ProcessingContext context, TypeElement controller, String packageName,
                        ExecutableElement handler, AnnotationMirror mirror, RouteMarker marker) {
        this.context = context;
        this.controller = controller;
        this.controllerType = ClassName.get(controller);
        this.packageName = packageName;
        this.handler = handler;
        this.mirror = mirror;
        this.marker = marker;
        this.collector = (kind, element, annotation, message) -> {
            if (kind == Diagnostic.Kind.ERROR) {
                problems.add(Problem.of(element, annotation, message));
            } else {
                context.errorReporter().report(kind, element, annotation, message);
            }
        };
    }

    /**
     * Returns the last stage reached before a failure, or the current stage.
     *
     * @return the last completed stage
     */
    Stage lastCompletedStage() {
        return stage == Stage.FAILED ? lastCompletedStage : stage;
    }

    ExecutableElement handler() {
        return handler;
    }

    // ==================== ENDPOINTS ====================

    /**
     * Builds the endpoint of an {@code @EndPoint}, method shorthand or {@code @CustomEndPoint}
     * annotation.
     *
     * @param adapterNames allocator of adapter method names, shared by the whole controller
     * @return the endpoint, or the problems that prevented it
     */
    Expansion<EndpointSpec> buildEndpoint(NameAllocator adapterNames) {
        EndpointKind kind = marker.kind();
        if (kind == EndpointKind.CUSTOM_ROUTE_BUILDER) {
            throw new IllegalStateException(marker.displayName() + " does not produce an endpoint");
        }

        problems.addAll(ValidationUtils.validateHandler(handler, mirror, context.exceptionType(), context.types()));
        if (!problems.isEmpty()) {
            return fail();
        }

        List<List<Argument<AnnotationValue>>> buckets = matchRules(kind);
        if (buckets == null) {
            return fail();
        }
        stage = Stage.RULES_MATCHED;

        boolean shorthand = kind == EndpointKind.METHOD_SHORTHAND;
        String methodName = shorthand ? marker.impliedMethod() : resolveMethod(buckets.get(EndpointKind.METHOD));
        List<String> path = resolvePath(buckets.get(shorthand ? EndpointKind.SHORTHAND_PATH : EndpointKind.PATH));
        List<TypeName> middleware =
                resolveMiddleware(buckets.get(shorthand ? EndpointKind.SHORTHAND_MIDDLEWARE : EndpointKind.MIDDLEWARE));
        BodyStreamStrategy body = shorthand ? BodyStreamStrategy.COLLECT : resolveBody(buckets.get(EndpointKind.BODY));
        if (!problems.isEmpty()) {
            return fail();
        }
        CodeBlock httpMethod = STANDARD_METHODS.contains(methodName)
                ? CodeBlock.of("$T.$N", HttpMethod.class, methodName)
                : CodeBlock.of("$T.of($S)", HttpMethod.class, methodName);

        if (kind == EndpointKind.CUSTOM_ENDPOINT) {
            if (!takesSingle(context.requestType())) {
                problems.add(Problem.withFix(handler, mirror,
                        marker.displayName() + " method '" + handler.getSimpleName()
                                + "' must take exactly one parameter of type Request.",
                        "replace parameters with (Request request)"));
                return fail();
            }
            stage = Stage.PARAMETERS_CLASSIFIED;
            return Expansion.success(new EndpointSpec(handler, httpMethod, methodName, path, middleware, body,
                    List.of(), null));
        }

        List<ParameterPlan> plans = new ArrayList<>();
        for (VariableElement parameter : handler.getParameters()) {
            ParameterPlan plan = plan(parameter);
            if (plan != null) {
                plans.add(plan);
            }
        }
        if (!problems.isEmpty()) {
            return fail();
        }
        stage = Stage.PARAMETERS_CLASSIFIED;

        String adapterName = adapterNames.newName(CodeGenUtils.adapterBaseName(handler));
        MethodSpec adapter = new ExtractionSynthesizer(context.types()).adapter(adapterName, handler, plans);
        stage = Stage.ADAPTER_SYNTHESIZED;
        return Expansion.success(new EndpointSpec(handler, httpMethod, methodName, path, middleware, body,
                plans, adapter));
    }

    private String resolveMethod(List<Argument<AnnotationValue>> bucket) {
        if (bucket.isEmpty()) {
            return "GET";
        }
        String method = (String) bucket.get(0).value().getValue();
        if (!HttpMethod.isToken(method)) {
            problems.add(Problem.of(handler, mirror,
                    "Invalid HTTP method '" + method + "': a method name must be a non-empty token of "
                            + "letters, digits and !#$%&'*+-.^_`|~."));
            return "GET";
        }
        return method.toUpperCase(Locale.ROOT);
    }

    /**
     * Resolves the endpoint path. An absent path defaults to the method name; an explicitly
     * empty one is the surface root.
     */
    private List<String> resolvePath(List<Argument<AnnotationValue>> bucket) {
        if (bucket.isEmpty()) {
            return List.of(handler.getSimpleName().toString());
        }
        List<String> path = new ArrayList<>();
        for (AnnotationValue value : AnnotationArguments.values(bucket)) {
            path.add((String) value.getValue());
        }
        return path;
    }

    private List<TypeName> resolveMiddleware(List<Argument<AnnotationValue>> bucket) {
        List<TypeName> middleware = new ArrayList<>();
        for (AnnotationValue value : AnnotationArguments.values(bucket)) {
            TypeMirror type = (TypeMirror) value.getValue();
            if (ValidationUtils.validateMiddleware(type, handler, mirror, packageName,
                    context.elements(), collector)) {
                middleware.add(TypeName.get(type));
            }
        }
        return middleware;
    }

    private BodyStreamStrategy resolveBody(List<Argument<AnnotationValue>> bucket) {
        if (bucket.isEmpty()) {
            return BodyStreamStrategy.COLLECT;
        }
        VariableElement constant = (VariableElement) bucket.get(0).value().getValue();
        return BodyStreamStrategy.valueOf(constant.getSimpleName().toString());
    }

    // ==================== PARAMETERS ====================

    /**
     * Plans the extraction of one handler parameter.
     *
     * @return the plan, or {@code null} if problems were recorded
     */
    private ParameterPlan plan(VariableElement parameter) {
        Expansion<ParameterSource> classified = SourceClassifier.classify(parameter);
        if (!classified.isSuccess()) {
            problems.addAll(classified.problems());
            return null;
        }
        ParameterSource source = classified.value();
        TypeMirror declaredType = parameter.asType();
        String bindingName = parameter.getSimpleName().toString();

        if (source.kind().isProjection()) {
            if (ValidationUtils.hasDefault(parameter)) {
                context.errorReporter().warning(parameter, "Default of parameter '" + bindingName
                        + "' is ignored: " + source.kind().displayName() + " values are always present.");
            }
            if (!ValidationUtils.validateRequestPath(parameter, source.path(), context.requestType(),
                    collector, context.types(), context.elements())) {
                return null;
            }
            return new ParameterPlan(parameter, source, false, declaredType, declaredType, null, bindingName);
        }

        boolean optional = isOptional(declaredType);
        TypeMirror valueType = declaredType;
        if (optional) {
            List<? extends TypeMirror> arguments = ((DeclaredType) declaredType).getTypeArguments();
            if (arguments.isEmpty()) {
                problems.add(Problem.withFix(parameter, null,
                        "Parameter '" + bindingName + "' is declared as a raw Optional.",
                        "declare it as Optional<T>"));
                return null;
            }
            valueType = arguments.get(0);
            if (valueType.getKind() != TypeKind.DECLARED && valueType.getKind() != TypeKind.ARRAY) {
                problems.add(Problem.of(parameter, null,
                        "Parameter '" + bindingName + "' must declare a concrete Optional value type, not '"
                                + valueType + "'."));
                return null;
            }
        }

        if (!ValidationUtils.validateDefaults(parameter, valueType, controller, collector,
                context.types(), context.elements())) {
            return null;
        }
        ParameterPlan.Fallback fallback = CodeGenUtils.fallback(parameter, valueType, controllerType);
        return new ParameterPlan(parameter, source, optional, declaredType, valueType, fallback, bindingName);
    }

    private boolean isOptional(TypeMirror type) {
        if (type.getKind() != TypeKind.DECLARED) {
            return false;
        }
        TypeElement element = (TypeElement) ((DeclaredType) type).asElement();
        return element.getQualifiedName().contentEquals("java.util.Optional");
    }

    // ==================== ROUTE BUILDERS ====================

    /**
     * Builds the route builder of a {@code @CustomRouteBuilder} annotation.
     *
     * @return the route builder, or the problems that prevented it
     */
    Expansion<RouteBuilderSpec> buildRouteBuilder() {
        if (marker.kind() != EndpointKind.CUSTOM_ROUTE_BUILDER) {
            throw new IllegalStateException(marker.displayName() + " does not produce a route builder");
        }

        problems.addAll(ValidationUtils.validateHandler(handler, mirror, context.exceptionType(), context.types()));
        if (!problems.isEmpty()) {
            return fail();
        }

        List<List<Argument<AnnotationValue>>> buckets = matchRules(EndpointKind.CUSTOM_ROUTE_BUILDER);
        if (buckets == null) {
            return fail();
        }
        stage = Stage.RULES_MATCHED;

        List<Argument<AnnotationValue>> useGlobal = buckets.get(EndpointKind.USE_GLOBAL_SETTING);
        List<Argument<AnnotationValue>> condition = buckets.get(EndpointKind.GLOBAL_SETTING_CONDITION);
        GroupingFlag grouping = GroupingFlag.known(false);
        if (!useGlobal.isEmpty() && !condition.isEmpty()) {
            problems.add(Problem.withFix(handler, mirror,
                    "@CustomRouteBuilder cannot set both useControllerGlobalSetting and globalSettingCondition.",
                    "keep only one of them"));
        } else if (!useGlobal.isEmpty()) {
            grouping = GroupingFlag.known((Boolean) useGlobal.get(0).value().getValue());
        } else if (!condition.isEmpty()) {
            String expression = ((String) condition.get(0).value().getValue()).strip();
            if (expression.isEmpty()) {
                problems.add(Problem.of(handler, mirror,
                        "@CustomRouteBuilder globalSettingCondition must be a boolean expression, not blank."));
            } else if (expression.equals("true") || expression.equals("false")) {
                grouping = GroupingFlag.known(Boolean.parseBoolean(expression));
            } else {
                grouping = GroupingFlag.deferred(expression);
            }
        }

        if (!takesSingle(context.routesBuilderType())) {
            problems.add(Problem.withFix(handler, mirror,
                    "@CustomRouteBuilder method '" + handler.getSimpleName()
                            + "' must take exactly one parameter of type RoutesBuilder.",
                    "replace parameters with (RoutesBuilder routes)"));
        }
        if (context.isAsynchronous(handler.getReturnType())) {
            problems.add(Problem.withFix(handler, mirror,
                    "unexpected async: @CustomRouteBuilder method '" + handler.getSimpleName()
                            + "' returns " + handler.getReturnType()
                            + ", but a route builder cannot be asynchronous since "
                            + "RouteCollection.boot(RoutesBuilder) is synchronous.",
                    "return void"));
        }
        if (!problems.isEmpty()) {
            return fail();
        }
        stage = Stage.PARAMETERS_CLASSIFIED;
        return Expansion.success(new RouteBuilderSpec(handler, grouping, CodeGenUtils.thrownTypeNames(handler)));
    }

    // ==================== SHARED ====================

    private List<List<Argument<AnnotationValue>>> matchRules(EndpointKind kind) {
        try {
            return ArgumentMatcher.match(kind.rules(), AnnotationArguments.of(mirror));
        } catch (ArgumentMatchException e) {
            problems.add(Problem.of(handler, mirror,
                    "Invalid " + marker.displayName() + " arguments: " + e.getMessage()));
            return null;
        }
    }

    private boolean takesSingle(TypeMirror type) {
        List<? extends VariableElement> parameters = handler.getParameters();
        return parameters.size() == 1 && context.types().isSameType(parameters.get(0).asType(), type);
    }

    private <T> Expansion<T> fail() {
        lastCompletedStage = stage;
        stage = Stage.FAILED;
        return Expansion.failure(problems);
    }
}
