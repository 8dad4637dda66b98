package io.github.reugn.route4j.processor;

import io.github.reugn.route4j.annotation.DefaultFactory;
import io.github.reugn.route4j.annotation.DefaultValue;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.ExecutableType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import java.util.ArrayList;
import java.util.List;

/**
 * Compile-time validation utilities for route4j annotations.
 *
 * <p>Reports configuration errors during annotation processing with actionable messages,
 * rather than emitting generated code that fails to compile.
 *
 * <p><b>Architecture:</b>
 * <p>This class is the main entry point for validations, delegating to specialized validators:
 * <ul>
 *   <li>{@link LiteralValidator}: validates that literal defaults are parseable for their target types</li>
 *   <li>{@link ReferenceValidator}: validates field and factory references with typo suggestions</li>
 * </ul>
 *
 * <p><b>Validation Categories:</b>
 * <ul>
 *   <li><b>Controllers:</b> a class or record, not generic, not private</li>
 *   <li><b>Handlers:</b> instance methods, not private, without type parameters, declaring only
 *       {@link Exception} subtypes</li>
 *   <li><b>Middleware:</b> concrete classes instantiable with an accessible no-arg constructor</li>
 *   <li><b>Defaults:</b> {@code @DefaultValue}/{@code @DefaultFactory} consistency and type fit</li>
 *   <li><b>Request fields:</b> every accessor in a {@code @RequestField}/{@code @Req} path exists
 *       and the result is assignable to the parameter</li>
 * </ul>
 *
 * <p><b>Example Error Messages:</b>
 * <pre>
 * error: @DefaultValue cannot specify both 'value' and 'field'. Use one or the other.
 * error: 'abc' is not a valid int.
 * error: Middleware 'Auth' must have a no-argument constructor.
 * error: Request field path 'urll' of parameter 'target' is invalid: Request has no accessor 'urll'. Did you mean 'url'?
 * </pre>
 *
 * @see LiteralValidator
 * @see ReferenceValidator
 */
final class ValidationUtils {

    private ValidationUtils() {
    }

    // ==================== CONTROLLER VALIDATION ====================

    /**
     * Validates that a type can be a controller.
     *
     * @param controller the type annotated with {@code @Controller}
     * @param mirror     the {@code @Controller} annotation
     * @return the problems found; empty if the type is a valid controller
     */
    static List<Problem> validateController(TypeElement controller, AnnotationMirror mirror) {
        List<Problem> problems = new ArrayList<>();
        ElementKind kind = controller.getKind();
        if (kind != ElementKind.CLASS && kind != ElementKind.RECORD) {
            problems.add(Problem.of(controller, mirror,
                    "@Controller can only be applied to classes or records, not to "
                            + kind.name().toLowerCase().replace('_', ' ') + " '" + controller.getSimpleName() + "'."));
            return problems;
        }
        if (!controller.getTypeParameters().isEmpty()) {
            problems.add(Problem.of(controller, mirror,
                    "Controller '" + controller.getSimpleName() + "' must not declare type parameters."));
        }
        for (Element current = controller; current instanceof TypeElement;
             current = current.getEnclosingElement()) {
            if (current.getModifiers().contains(Modifier.PRIVATE)) {
                problems.add(Problem.of(controller, mirror,
                        "Controller '" + controller.getSimpleName() + "' is not accessible from its package. "
                                + "Generated route collections cannot access private types."));
                break;
            }
        }
        return problems;
    }

    // ==================== HANDLER VALIDATION ====================

    /**
     * Validates the declaration of a method carrying a route annotation.
     *
     * <p>Reports attachment errors (static methods) and signature errors (private visibility,
     * type parameters, throwables that are not exceptions).
     *
     * @param handler       the annotated method
     * @param mirror        the route annotation
     * @param exceptionType the {@link Exception} type
     * @param typeUtils     type utilities
     * @return the problems found; empty if the method can be a handler
     */
    static List<Problem> validateHandler(ExecutableElement handler, AnnotationMirror mirror,
                                         TypeMirror exceptionType, Types typeUtils) {
        List<Problem> problems = new ArrayList<>();
        String annotation = "@" + AnnotationArguments.simpleName(mirror);
        String name = handler.getSimpleName().toString();

        if (handler.getModifiers().contains(Modifier.STATIC)) {
            problems.add(Problem.withFix(handler, mirror,
                    annotation + " can only be attached to instance methods; '" + name + "' is static.",
                    "remove the static modifier"));
        }
        if (handler.getModifiers().contains(Modifier.PRIVATE)) {
            problems.add(Problem.of(handler, mirror,
                    "Method '" + name + "' is private. Generated route collections cannot access private "
                            + "elements. Use package-private, protected, or public visibility."));
        }
        if (!handler.getTypeParameters().isEmpty()) {
            problems.add(Problem.of(handler, mirror,
                    "Method '" + name + "' must not declare type parameters."));
        }
        for (TypeMirror thrown : handler.getThrownTypes()) {
            if (!typeUtils.isAssignable(thrown, exceptionType)) {
                problems.add(Problem.of(handler, mirror,
                        "Method '" + name + "' declares " + thrown + ", but handlers may only throw "
                                + "java.lang.Exception and its subtypes."));
            }
        }
        return problems;
    }

    // ==================== MIDDLEWARE VALIDATION ====================

    /**
     * Validates that a middleware type can be instantiated by generated code in a package.
     *
     * @param middleware    the middleware type from an annotation
     * @param element       the element to report against
     * @param mirror        the annotation referencing the middleware
     * @param packageName   the package of the generated route collection
     * @param elementUtils  element utilities
     * @param errorReporter callback for reporting errors
     * @return {@code true} if valid, {@code false} if an error was reported
     */
    static boolean validateMiddleware(TypeMirror middleware, Element element, AnnotationMirror mirror,
                                      String packageName, Elements elementUtils, ErrorReporter errorReporter) {
        if (middleware.getKind() != TypeKind.DECLARED) {
            errorReporter.report(Diagnostic.Kind.ERROR, element, mirror,
                    "Middleware '" + middleware + "' cannot be resolved.");
            return false;
        }
        TypeElement type = (TypeElement) ((DeclaredType) middleware).asElement();
        String name = type.getSimpleName().toString();
        String problem = null;

        boolean samePackage = elementUtils.getPackageOf(type).getQualifiedName().contentEquals(packageName);
        if (type.getKind() != ElementKind.CLASS || type.getModifiers().contains(Modifier.ABSTRACT)) {
            problem = "Middleware '" + name + "' must be a concrete class.";
        } else if (type.getNestingKind() == NestingKind.MEMBER && !type.getModifiers().contains(Modifier.STATIC)) {
            problem = "Middleware '" + name + "' must be a static nested class.";
        } else if (!isAccessible(type, samePackage)) {
            problem = "Middleware '" + name + "' is not accessible from package '" + packageName + "'.";
        } else {
            boolean hasConstructor = false;
            for (ExecutableElement constructor : ElementFilter.constructorsIn(type.getEnclosedElements())) {
                if (constructor.getParameters().isEmpty() && isAccessible(constructor, samePackage)) {
                    hasConstructor = true;
                    break;
                }
            }
            if (!hasConstructor) {
                problem = "Middleware '" + name + "' must have an accessible no-argument constructor.";
            }
        }

        if (problem != null) {
            errorReporter.report(Diagnostic.Kind.ERROR, element, mirror, problem);
            return false;
        }
        return true;
    }

    private static boolean isAccessible(Element element, boolean samePackage) {
        if (element.getModifiers().contains(Modifier.PRIVATE)) {
            return false;
        }
        if (!samePackage && !element.getModifiers().contains(Modifier.PUBLIC)) {
            return false;
        }
        Element enclosing = element.getEnclosingElement();
        return !(enclosing instanceof TypeElement) || isAccessible(enclosing, samePackage);
    }

    // ==================== DEFAULT VALIDATION ====================

    /**
     * Validates {@code @DefaultValue} and {@code @DefaultFactory} on a handler parameter.
     *
     * <p><b>{@code @DefaultValue} Validations:</b>
     * <ul>
     *   <li>Cannot be combined with {@code @DefaultFactory}</li>
     *   <li>Cannot specify both {@code value} and {@code field} attributes</li>
     *   <li>Empty value ({@code @DefaultValue("")}) is only valid for {@code String}</li>
     *   <li>Literal values must be parseable for the value type</li>
     *   <li>Field references must point to static fields with compatible types</li>
     * </ul>
     *
     * <p><b>{@code @DefaultFactory} Validations:</b>
     * <p>The referenced method must exist, be static, take no parameters and return a type
     * assignable to the value type.
     *
     * @param param         the handler parameter
     * @param valueType     the type the default must produce ({@code T} for {@code Optional<T>})
     * @param controller    the controller class (used for resolving references)
     * @param errorReporter callback for reporting errors
     * @param typeUtils     type utilities for assignability checks
     * @param elementUtils  element utilities for resolving external class references
     * @return {@code true} if the parameter's default annotations are valid
     */
    static boolean validateDefaults(VariableElement param, TypeMirror valueType, TypeElement controller,
                                    ErrorReporter errorReporter, Types typeUtils, Elements elementUtils) {
        DefaultValue defaultValue = param.getAnnotation(DefaultValue.class);
        DefaultFactory defaultFactory = param.getAnnotation(DefaultFactory.class);

        if (defaultValue != null && defaultFactory != null) {
            errorReporter.error(param,
                    "Parameter cannot have both @DefaultValue and @DefaultFactory. Use one or the other.");
            return false;
        }
        if (defaultFactory != null) {
            return ReferenceValidator.validateFactoryMethod(defaultFactory.value(), valueType,
                    controller, errorReporter, param, typeUtils, elementUtils);
        }
        if (defaultValue == null) {
            return true;
        }

        boolean hasField = !defaultValue.field().isEmpty();
        boolean hasValue = !defaultValue.value().isEmpty();

        if (hasValue && hasField) {
            errorReporter.error(param,
                    "@DefaultValue cannot specify both 'value' and 'field'. Use one or the other.");
            return false;
        }
        if (hasField) {
            return ReferenceValidator.validateFieldReference(defaultValue.field(), controller, param,
                    valueType, errorReporter, typeUtils, elementUtils);
        }
        if (!hasValue) {
            String typeStr = valueType.toString();
            if (!typeStr.equals("java.lang.String")) {
                errorReporter.error(param,
                        "@DefaultValue with empty value is only valid for String type, not "
                                + LiteralValidator.getSimpleTypeName(typeStr) + ".");
                return false;
            }
            return true;
        }
        return LiteralValidator.validateParseable(defaultValue.value(), valueType, param, errorReporter);
    }

    static boolean hasDefault(VariableElement param) {
        return param.getAnnotation(DefaultValue.class) != null || param.getAnnotation(DefaultFactory.class) != null;
    }

    // ==================== REQUEST FIELD VALIDATION ====================

    /**
     * Validates the accessor path of a {@code @RequestField} or {@code @Req} parameter.
     *
     * <p>Each segment must name a public no-argument instance method of the type reached so
     * far, starting at the request type, and the final type must be assignable to the
     * parameter.
     *
     * @param param         the handler parameter
     * @param path          the accessor path; empty for the request itself
     * @param requestType   the request type
     * @param errorReporter callback for reporting errors
     * @param typeUtils     type utilities
     * @param elementUtils  element utilities
     * @return {@code true} if the path is valid
     */
    static boolean validateRequestPath(VariableElement param, List<String> path, TypeMirror requestType,
                                       ErrorReporter errorReporter, Types typeUtils, Elements elementUtils) {
        String pathText = path.isEmpty() ? "<request>" : String.join(".", path);
        String prefix = "Request field path '" + pathText + "' of parameter '" + param.getSimpleName() + "' is invalid: ";
        TypeMirror current = requestType;

        for (String segment : path) {
            if (current.getKind() != TypeKind.DECLARED) {
                errorReporter.error(param, prefix + "cannot call '" + segment + "' on " + current + ".");
                return false;
            }
            DeclaredType owner = (DeclaredType) current;
            TypeElement ownerElement = (TypeElement) owner.asElement();
            ExecutableElement accessor = null;
            List<String> candidates = new ArrayList<>();
            for (ExecutableElement method : ElementFilter.methodsIn(elementUtils.getAllMembers(ownerElement))) {
                if (!method.getParameters().isEmpty()
                        || method.getModifiers().contains(Modifier.STATIC)
                        || !method.getModifiers().contains(Modifier.PUBLIC)
                        || method.getReturnType().getKind() == TypeKind.VOID) {
                    continue;
                }
                candidates.add(method.getSimpleName().toString());
                if (method.getSimpleName().contentEquals(segment)) {
                    accessor = method;
                }
            }
            if (accessor == null) {
                String suggestion = ReferenceValidator.findSimilar(segment, candidates);
                errorReporter.error(param, prefix + ownerElement.getSimpleName() + " has no accessor '" + segment + "'."
                        + (suggestion != null ? " Did you mean '" + suggestion + "'?" : ""));
                return false;
            }
            current = ((ExecutableType) typeUtils.asMemberOf(owner, accessor)).getReturnType();
        }

        if (!typeUtils.isAssignable(current, param.asType())) {
            errorReporter.error(param, prefix + "it yields " + current
                    + " which is not assignable to " + param.asType() + ".");
            return false;
        }
        return true;
    }
}
