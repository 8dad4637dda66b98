package io.github.reugn.route4j.processor;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;
import io.github.reugn.route4j.annotation.DefaultFactory;
import io.github.reugn.route4j.annotation.DefaultValue;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import java.util.List;

/**
 * Shared utilities for code generation in route4j.
 *
 * <p><b>Responsibilities:</b>
 * <table border="1">
 *   <caption>CodeGenUtils method categories</caption>
 *   <tr><th>Category</th><th>Methods</th><th>Purpose</th></tr>
 *   <tr>
 *     <td>Naming</td>
 *     <td>{@link #generatedClassName}, {@link #adapterBaseName}</td>
 *     <td>Names of generated classes and adapter methods</td>
 *   </tr>
 *   <tr>
 *     <td>Default Expressions</td>
 *     <td>{@link #fallback}, {@link #convertDefaultValue}</td>
 *     <td>Convert {@code @DefaultValue}/{@code @DefaultFactory} to Java expressions</td>
 *   </tr>
 *   <tr>
 *     <td>Signatures</td>
 *     <td>{@link #copyThrowsDeclarations}, {@link #generatedAnnotation}</td>
 *     <td>Mirror handler effects on generated methods</td>
 *   </tr>
 *   <tr>
 *     <td>String Utilities</td>
 *     <td>{@link #escapeString}, {@link #capitalize}</td>
 *     <td>String manipulation for code generation</td>
 *   </tr>
 * </table>
 *
 * <p><b>Default Expression Examples:</b>
 * <ul>
 *   <li>{@code @DefaultValue("42") int} → {@code 42}</li>
 *   <li>{@code @DefaultValue("hello") String} → {@code "hello"}</li>
 *   <li>{@code @DefaultValue("100") long} → {@code 100L}</li>
 *   <li>{@code @DefaultValue("DESC") Order} → {@code Order.DESC} (enum constant)</li>
 *   <li>{@code @DefaultValue(field="LIMIT")} → {@code BookController.LIMIT}</li>
 *   <li>{@code @DefaultFactory("Clock.now")} → {@code Clock.now()}, evaluated lazily</li>
 * </ul>
 */
final class CodeGenUtils {

    /**
     * Prefix of generated adapter method names.
     */
    static final String ADAPTER_PREFIX = "handle";

    private CodeGenUtils() {
    }

    // ==================== NAMING ====================

    /**
     * Returns the name of the route collection generated for a controller.
     *
     * <p>Nested controllers join their enclosing type names with {@code _}:
     * {@code Api.Books} becomes {@code Api_BooksRoutes}.
     *
     * @param controller the controller type
     * @param suffix     the configured class suffix
     * @return the generated class name, in the controller's package
     */
    static ClassName generatedClassName(TypeElement controller, String suffix) {
        ClassName controllerName = ClassName.get(controller);
        return ClassName.get(controllerName.packageName(),
                String.join("_", controllerName.simpleNames()) + suffix);
    }

    static String adapterBaseName(ExecutableElement handler) {
        return ADAPTER_PREFIX + capitalize(handler.getSimpleName().toString());
    }

    static AnnotationSpec generatedAnnotation() {
        return AnnotationSpec.builder(ClassName.get("javax.annotation.processing", "Generated"))
                .addMember("value", "$S", RouteControllerProcessor.class.getCanonicalName())
                .build();
    }

    /**
     * Copies throws declarations from a handler to a generated method, so that checked
     * exceptions propagate unchanged.
     *
     * @param handler       the source method
     * @param methodBuilder the JavaPoet {@link MethodSpec.Builder} to add exceptions to
     */
    static void copyThrowsDeclarations(ExecutableElement handler, MethodSpec.Builder methodBuilder) {
        for (TypeMirror thrown : handler.getThrownTypes()) {
            methodBuilder.addException(TypeName.get(thrown));
        }
    }

    static List<TypeName> thrownTypeNames(ExecutableElement handler) {
        return handler.getThrownTypes().stream().map(TypeName::get).toList();
    }

    // ==================== DEFAULT EXPRESSIONS ====================

    /**
     * Builds the fallback expression of a parameter carrying {@code @DefaultValue} or
     * {@code @DefaultFactory}.
     *
     * <p>Simple reference names (without dots) are resolved against the controller class;
     * qualified names are used as-is.
     *
     * @param parameter  the handler parameter, already validated
     * @param valueType  the type the default must produce
     * @param controller the controller class name
     * @return the fallback, or {@code null} if the parameter declares no default
     */
    static ParameterPlan.Fallback fallback(VariableElement parameter, TypeMirror valueType, ClassName controller) {
        DefaultValue defaultValue = parameter.getAnnotation(DefaultValue.class);
        if (defaultValue != null) {
            if (!defaultValue.field().isEmpty()) {
                return new ParameterPlan.Fallback(
                        CodeBlock.of("$L", resolveReference(defaultValue.field(), controller)), false);
            }
            return new ParameterPlan.Fallback(literal(defaultValue.value(), valueType), false);
        }

        DefaultFactory defaultFactory = parameter.getAnnotation(DefaultFactory.class);
        if (defaultFactory != null) {
            return new ParameterPlan.Fallback(
                    CodeBlock.of("$L()", resolveReference(defaultFactory.value(), controller)), true);
        }
        return null;
    }

    private static CodeBlock literal(String value, TypeMirror valueType) {
        TypeElement enumType = enumType(valueType);
        if (enumType != null && !"null".equals(value)) {
            return CodeBlock.of("$T.$N", ClassName.get(enumType), value);
        }
        return CodeBlock.of("$L", convertDefaultValue(value, valueType));
    }

    /**
     * Returns the enum declaration of a type.
     *
     * @param type the type to inspect
     * @return the enum type element, or {@code null} if the type is not an enum
     */
    static TypeElement enumType(TypeMirror type) {
        if (type.getKind() != TypeKind.DECLARED) {
            return null;
        }
        Element element = ((DeclaredType) type).asElement();
        return element.getKind() == ElementKind.ENUM ? (TypeElement) element : null;
    }

    /**
     * Resolves a reference string to a qualified expression.
     * <p>
     * Handles:
     * <ul>
     *   <li>{@code "name"} → {@code controller.name}</li>
     *   <li>{@code "Class.name"} → {@code Class.name}</li>
     *   <li>{@code "com.example.Class.name"} → {@code com.example.Class.name}</li>
     * </ul>
     */
    static String resolveReference(String ref, ClassName controller) {
        if (ref.contains(".")) {
            return ref;
        }
        return controller.canonicalName() + "." + ref;
    }

    /**
     * Converts a string default value to the matching Java literal.
     * <p>
     * Handles type-specific formatting:
     * <ul>
     *   <li>{@code int/Integer}: used as-is (e.g., "42" → {@code 42})</li>
     *   <li>{@code long/Long}: appends L suffix (e.g., "100" → {@code 100L})</li>
     *   <li>{@code double/Double}: ensures a floating-point literal (e.g., "3" → {@code 3.0})</li>
     *   <li>{@code float/Float}: appends F suffix</li>
     *   <li>{@code byte/short}: adds cast (e.g., {@code (byte) 1})</li>
     *   <li>{@code char/Character}: wraps in single quotes</li>
     *   <li>{@code String}: wraps in double quotes with escaping</li>
     *   <li>{@code "null"}: returns literal {@code null}</li>
     * </ul>
     * Any other type receives the value verbatim as a Java expression.
     *
     * @param value the string value from {@code @DefaultValue}
     * @param type  the target type
     * @return a valid Java expression for the default value
     * @throws IllegalStateException if value is empty for non-String types
     */
    static String convertDefaultValue(String value, TypeMirror type) {
        String typeStr = type.toString();

        if (value.isEmpty()) {
            if (typeStr.equals("java.lang.String")) {
                return "\"\"";
            }
            throw new IllegalStateException("@DefaultValue with empty value is only valid for String type");
        }

        if ("null".equals(value)) {
            return "null";
        }

        return switch (typeStr) {
            case "int", "java.lang.Integer", "boolean", "java.lang.Boolean" -> value;
            case "long", "java.lang.Long" -> value.endsWith("L") || value.endsWith("l") ? value : value + "L";
            case "double", "java.lang.Double" -> {
                if (value.endsWith("D") || value.endsWith("d") || value.matches(".*[.eE].*")) {
                    yield value;
                }
                yield value + ".0";
            }
            case "float", "java.lang.Float" -> value.endsWith("F") || value.endsWith("f") ? value : value + "F";
            case "byte", "java.lang.Byte" -> "(byte) " + value;
            case "short", "java.lang.Short" -> "(short) " + value;
            case "char", "java.lang.Character" -> "'" + escapeChar(value.charAt(0)) + "'";
            case "java.lang.String" -> "\"" + escapeString(value) + "\"";
            default -> value;
        };
    }

    // ==================== STRING UTILITIES ====================

    static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (char c : s.toCharArray()) {
            sb.append(escapeChar(c));
        }
        return sb.toString();
    }

    /**
     * Escapes a single character for use in a Java literal.
     *
     * @param c the character to escape
     * @return the escaped representation (e.g., '\n' → "\\n")
     */
    static String escapeChar(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            case '\\' -> "\\\\";
            case '"' -> "\\\"";
            case '\'' -> "\\'";
            default -> String.valueOf(c);
        };
    }

    static String capitalize(String str) {
        if (str == null || str.isEmpty()) return str;
        return Character.toUpperCase(str.charAt(0)) + str.substring(1);
    }
}
