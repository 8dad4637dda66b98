package io.github.reugn.route4j.processor;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.NameAllocator;
import com.squareup.javapoet.TypeName;
import io.github.reugn.route4j.runtime.Extraction;
import io.github.reugn.route4j.runtime.Request;

import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Types;
import java.util.List;
import java.util.Optional;

/**
 * Emits the adapter method that extracts handler arguments from a request and calls the
 * handler.
 *
 * <p><b>Extraction Policy:</b>
 * <table border="1">
 *   <caption>Generated extraction per source and parameter shape</caption>
 *   <tr><th>Source</th><th>{@code T}</th><th>{@code Optional<T>}</th><th>with default</th></tr>
 *   <tr>
 *     <td>{@code @PathParam}</td>
 *     <td>{@code request.parameters().require(key, T.class)}</td>
 *     <td>{@code request.parameters().get(key, T.class)}</td>
 *     <td>{@code ...get(key, T.class).orElse(default)}</td>
 *   </tr>
 *   <tr>
 *     <td>{@code @ReqContent}</td>
 *     <td>{@code request.content().decode(T.class)}</td>
 *     <td>{@code Extraction.attempt(() -> request.content().decode(T.class))}</td>
 *     <td>{@code Extraction.attempt(...).orElse(default)}</td>
 *   </tr>
 *   <tr>
 *     <td>{@code @QueryParam}</td>
 *     <td>{@code request.query().require(key, T.class)}</td>
 *     <td>{@code request.query().get(key, T.class)}</td>
 *     <td>{@code ...get(key, T.class).orElse(default)}</td>
 *   </tr>
 *   <tr>
 *     <td>{@code @QueryContent}</td>
 *     <td>{@code request.query().decode(T.class)}</td>
 *     <td>{@code Extraction.attempt(() -> request.query().decode(T.class))}</td>
 *     <td>{@code Extraction.attempt(...).orElse(default)}</td>
 *   </tr>
 *   <tr>
 *     <td>{@code @AuthContent}</td>
 *     <td>{@code request.auth().require(T.class)}</td>
 *     <td>{@code request.auth().get(T.class)}</td>
 *     <td>{@code request.auth().get(T.class).orElse(default)}</td>
 *   </tr>
 *   <tr>
 *     <td>{@code @RequestField}, {@code @Req}</td>
 *     <td colspan="3">{@code request.a().b()}, always present</td>
 *   </tr>
 * </table>
 *
 * <p>Factory defaults use {@code orElseGet(() -> factory())} so that the factory only runs on
 * absence. A default on an {@code Optional<T>} parameter produces
 * {@code get(...).or(() -> Optional.ofNullable(default))}. Parameterized types are looked up
 * by their erasure and cast back, and the adapter suppresses the resulting unchecked warning.
 *
 * <p><b>Generated Adapter:</b>
 * <pre>
 * {@code // Source
 * @GET("greet")
 * public String greet(String name, @QueryParam @DefaultValue("1") int times) { ... }
 *
 * // Generated
 * private String handleGreet(Request request) {
 *     String name = request.parameters().require("name", String.class);
 *     int times = request.query().get("times", Integer.class).orElse(1);
 *     return this.controller.greet(name, times);
 * }}
 * </pre>
 *
 * <p>Arguments are extracted strictly in declaration order before the handler is called, and
 * the adapter mirrors the handler's return type and {@code throws} clause, so asynchronous
 * ({@link java.util.concurrent.CompletionStage}) and failing handlers keep their effects.
 */
final class ExtractionSynthesizer {

    static final String CONTROLLER_FIELD = "controller";

    private static final ClassName OPTIONAL = ClassName.get(Optional.class);
    private static final ClassName EXTRACTION = ClassName.get(Extraction.class);
    private static final String REQUEST_NAME = "request";
    private static final String LAMBDA_NAME = "value";

    private final Types typeUtils;

    ExtractionSynthesizer(Types typeUtils) {
        this.typeUtils = typeUtils;
    }

    /**
     * Emits the adapter method of a handler.
     *
     * @param adapterName the unique adapter method name
     * @param handler     the handler method
     * @param plans       one plan per handler parameter, in declaration order
     * @return the adapter method
     */
    MethodSpec adapter(String adapterName, ExecutableElement handler, List<ParameterPlan> plans) {
        NameAllocator names = new NameAllocator();
        for (ParameterPlan plan : plans) {
            names.newName(plan.bindingName(), plan);
        }
        String requestName = names.newName(REQUEST_NAME);
        String lambdaName = names.newName(LAMBDA_NAME);

        MethodSpec.Builder builder = MethodSpec.methodBuilder(adapterName)
                .addModifiers(Modifier.PRIVATE)
                .returns(TypeName.get(handler.getReturnType()))
                .addParameter(Request.class, requestName);
        CodeGenUtils.copyThrowsDeclarations(handler, builder);

        boolean unchecked = false;
        CodeBlock.Builder arguments = CodeBlock.builder();
        for (int i = 0; i < plans.size(); i++) {
            ParameterPlan plan = plans.get(i);
            builder.addStatement("$T $N = $L", TypeName.get(plan.declaredType()), names.get(plan),
                    extraction(plan, requestName, lambdaName));
            unchecked |= needsCast(plan);
            arguments.add(i == 0 ? "$N" : ", $N", names.get(plan));
        }

        if (unchecked) {
            builder.addAnnotation(AnnotationSpec.builder(SuppressWarnings.class)
                    .addMember("value", "$S", "unchecked")
                    .build());
        }

        String call = handler.getReturnType().getKind() == TypeKind.VOID ? "this.$N.$N($L)" : "return this.$N.$N($L)";
        builder.addStatement(call, CONTROLLER_FIELD, handler.getSimpleName().toString(), arguments.build());
        return builder.build();
    }

    /**
     * Emits the expression producing one handler argument.
     *
     * @param plan        the parameter plan
     * @param requestName the name of the request variable
     * @param lambdaName  a name free for lambda parameters
     * @return the extraction expression, of the parameter's declared type
     */
    CodeBlock extraction(ParameterPlan plan, String requestName, String lambdaName) {
        ParameterSource source = plan.source();
        if (source.kind().isProjection()) {
            CodeBlock.Builder projection = CodeBlock.builder().add("$N", requestName);
            for (String accessor : source.path()) {
                projection.add(".$N()", accessor);
            }
            return projection.build();
        }

        if (!plan.optional() && !plan.hasFallback()) {
            CodeBlock required = required(plan, requestName);
            return needsCast(plan) ? CodeBlock.of("($T) $L", TypeName.get(plan.valueType()), required) : required;
        }

        CodeBlock fetch = fetch(plan, requestName);
        if (needsCast(plan)) {
            fetch = CodeBlock.of("$L.map($N -> ($T) $N)", fetch, lambdaName, TypeName.get(plan.valueType()), lambdaName);
        }
        if (!plan.hasFallback()) {
            return fetch;
        }

        ParameterPlan.Fallback fallback = plan.fallback();
        if (plan.optional()) {
            return CodeBlock.of("$L.or(() -> $T.ofNullable($L))", fetch, OPTIONAL, fallback.expression());
        }
        if (fallback.lazy()) {
            return CodeBlock.of("$L.orElseGet(() -> $L)", fetch, fallback.expression());
        }
        return CodeBlock.of("$L.orElse($L)", fetch, fallback.expression());
    }

    // Fails the request when the value is missing or malformed
    private CodeBlock required(ParameterPlan plan, String requestName) {
        ParameterSource source = plan.source();
        TypeName type = classLiteralType(plan.valueType());
        return switch (source.kind()) {
            case PATH_PARAM -> CodeBlock.of("$N.parameters().require($S, $T.class)", requestName, source.key(), type);
            case QUERY_PARAM -> CodeBlock.of("$N.query().require($S, $T.class)", requestName, source.key(), type);
            case BODY -> CodeBlock.of("$N.content().decode($T.class)", requestName, type);
            case QUERY_CONTENT -> CodeBlock.of("$N.query().decode($T.class)", requestName, type);
            case AUTH_CONTENT -> CodeBlock.of("$N.auth().require($T.class)", requestName, type);
            case REQUEST_FIELD, RAW_REQUEST -> throw new IllegalStateException("Projections are always present");
        };
    }

    // Yields an Optional that is empty when the value is missing or malformed
    private CodeBlock fetch(ParameterPlan plan, String requestName) {
        ParameterSource source = plan.source();
        TypeName type = classLiteralType(plan.valueType());
        return switch (source.kind()) {
            case PATH_PARAM -> CodeBlock.of("$N.parameters().get($S, $T.class)", requestName, source.key(), type);
            case QUERY_PARAM -> CodeBlock.of("$N.query().get($S, $T.class)", requestName, source.key(), type);
            case BODY -> CodeBlock.of("$T.attempt(() -> $N.content().decode($T.class))", EXTRACTION, requestName, type);
            case QUERY_CONTENT -> CodeBlock.of("$T.attempt(() -> $N.query().decode($T.class))", EXTRACTION, requestName, type);
            case AUTH_CONTENT -> CodeBlock.of("$N.auth().get($T.class)", requestName, type);
            case REQUEST_FIELD, RAW_REQUEST -> throw new IllegalStateException("Projections are always present");
        };
    }

    /**
     * Returns the type usable in a class literal: primitives are boxed, parameterized types erased.
     */
    private TypeName classLiteralType(TypeMirror type) {
        return TypeName.get(typeUtils.erasure(type)).box();
    }

    static boolean needsCast(ParameterPlan plan) {
        TypeMirror type = plan.valueType();
        return !plan.source().kind().isProjection()
                && type.getKind() == TypeKind.DECLARED
                && !((DeclaredType) type).getTypeArguments().isEmpty();
    }
}
