package io.github.reugn.route4j.processor;

import io.github.reugn.route4j.runtime.Request;
import io.github.reugn.route4j.runtime.RoutesBuilder;

import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.concurrent.CompletionStage;

/**
 * Compiler facilities shared by all expansion steps of one processor instance.
 *
 * @param types         type utilities
 * @param elements      element utilities
 * @param errorReporter callback for reporting diagnostics
 * @param options       the processor options
 */
record ProcessingContext(Types types, Elements elements, ErrorReporter errorReporter, ProcessorOptions options) {

    TypeMirror requestType() {
        return typeOf(Request.class);
    }

    TypeMirror routesBuilderType() {
        return typeOf(RoutesBuilder.class);
    }

    /**
     * Returns the erased {@link CompletionStage} type; handlers returning a subtype of it
     * are asynchronous.
     *
     * @return the erased completion stage type
     */
    TypeMirror completionStageType() {
        return types.erasure(typeOf(CompletionStage.class));
    }

    TypeMirror exceptionType() {
        return typeOf(Exception.class);
    }

    boolean isAsynchronous(TypeMirror returnType) {
        return returnType.getKind() == TypeKind.DECLARED
                && types.isAssignable(types.erasure(returnType), completionStageType());
    }

    private TypeMirror typeOf(Class<?> type) {
        TypeElement element = elements.getTypeElement(type.getCanonicalName());
        if (element == null) {
            throw new IllegalStateException(type.getCanonicalName() + " is not on the compilation classpath");
        }
        return element.asType();
    }
}
