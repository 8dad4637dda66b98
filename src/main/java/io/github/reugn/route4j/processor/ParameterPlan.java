package io.github.reugn.route4j.processor;

import com.squareup.javapoet.CodeBlock;

import javax.lang.model.element.VariableElement;
import javax.lang.model.type.TypeMirror;

/**
 * Everything needed to extract one handler argument from a request.
 *
 * @param element      the handler parameter
 * @param source       the request value source
 * @param optional     whether the parameter is declared as {@code Optional<T>}
 * @param declaredType the declared parameter type
 * @param valueType    {@code T} for {@code Optional<T>} parameters, the declared type otherwise
 * @param fallback     the default used when the source yields nothing, or {@code null}
 * @param bindingName  the local variable the value is bound to in the adapter
 */
record ParameterPlan(VariableElement element, ParameterSource source, boolean optional,
                     TypeMirror declaredType, TypeMirror valueType, Fallback fallback,
                     String bindingName) {

    boolean hasFallback() {
        return fallback != null;
    }

    /**
     * A default value expression.
     *
     * @param expression the Java expression of the default
     * @param lazy       whether the expression must only be evaluated on absence (factory calls)
     */
    record Fallback(CodeBlock expression, boolean lazy) {
    }
}
