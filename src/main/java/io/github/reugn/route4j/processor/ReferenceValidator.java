package io.github.reugn.route4j.processor;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates the field and factory references of {@code @DefaultValue(field=...)} and
 * {@code @DefaultFactory}.
 *
 * <p><b>Reference Formats:</b>
 * <ul>
 *   <li>{@code "NAME"} - a member of the controller class</li>
 *   <li>{@code "Defaults.NAME"} - a member of a class in the controller's package</li>
 *   <li>{@code "com.example.Defaults.NAME"} - a member of any class, fully qualified</li>
 * </ul>
 * Import statements are invisible to annotation processors, so classes of other packages
 * need their qualified name.
 *
 * <p>The referenced member must be static and not private, since the generated route
 * collection is a separate class. Unresolved names get a "Did you mean" suggestion based on
 * Levenshtein distance:
 * <pre>
 * Field 'DEFUALT_PAGE' not found in BookController. Did you mean 'DEFAULT_PAGE'?
 * </pre>
 *
 * @see ValidationUtils
 */
final class ReferenceValidator {

    private ReferenceValidator() {
    }

    // ==================== FIELD VALIDATION ====================

    /**
     * Validates a field reference.
     *
     * @param fieldRef         the reference
     * @param controller       the controller declaring the annotated parameter
     * @param annotatedElement the parameter to report errors against
     * @param expectedType     the type the field must be assignable to
     * @param errorReporter    callback for reporting errors
     * @param typeUtils        type utilities for assignability checks
     * @param elementUtils     element utilities for resolving classes
     * @return {@code true} if the reference is valid, {@code false} if an error was reported
     */
    static boolean validateFieldReference(String fieldRef, TypeElement controller,
                                          Element annotatedElement, TypeMirror expectedType,
                                          ErrorReporter errorReporter, Types typeUtils,
                                          Elements elementUtils) {
        TypeElement target = resolveTarget(fieldRef, "@DefaultValue(field=...)", "java.lang.Integer.MAX_VALUE",
                controller, annotatedElement, errorReporter, elementUtils);
        if (target == null) {
            return false;
        }
        String fieldName = memberName(fieldRef);

        List<String> candidates = new ArrayList<>();
        for (Element enclosed : target.getEnclosedElements()) {
            if (enclosed.getKind() != ElementKind.FIELD && enclosed.getKind() != ElementKind.ENUM_CONSTANT) {
                continue;
            }
            String name = enclosed.getSimpleName().toString();
            if (enclosed.getModifiers().contains(Modifier.STATIC)) {
                candidates.add(name);
            }
            if (!name.equals(fieldName)) {
                continue;
            }
            String where = "Field '" + fieldName + "' in " + target.getSimpleName();
            if (!enclosed.getModifiers().contains(Modifier.STATIC)) {
                errorReporter.error(annotatedElement, where + " must be static.");
                return false;
            }
            if (enclosed.getModifiers().contains(Modifier.PRIVATE)) {
                errorReporter.error(annotatedElement, where + " must not be private.");
                return false;
            }
            if (!typeUtils.isAssignable(enclosed.asType(), expectedType)) {
                errorReporter.error(annotatedElement, where + " has type " + enclosed.asType()
                        + " which is not assignable to " + expectedType + ".");
                return false;
            }
            return true;
        }

        reportNotFound("Field", fieldName, target, candidates, errorReporter, annotatedElement);
        return false;
    }

    // ==================== FACTORY METHOD VALIDATION ====================

    /**
     * Validates a factory method reference.
     *
     * @param methodRef        the reference
     * @param expectedType     the type the factory's return type must be assignable to
     * @param controller       the controller declaring the annotated parameter
     * @param errorReporter    callback for reporting errors
     * @param annotatedElement the parameter to report errors against
     * @param typeUtils        type utilities for assignability checks
     * @param elementUtils     element utilities for resolving classes
     * @return {@code true} if the reference is valid, {@code false} if an error was reported
     */
    static boolean validateFactoryMethod(String methodRef, TypeMirror expectedType,
                                         TypeElement controller, ErrorReporter errorReporter,
                                         Element annotatedElement, Types typeUtils,
                                         Elements elementUtils) {
        TypeElement target = resolveTarget(methodRef, "@DefaultFactory", "java.util.UUID.randomUUID",
                controller, annotatedElement, errorReporter, elementUtils);
        if (target == null) {
            return false;
        }
        String methodName = memberName(methodRef);

        List<String> candidates = new ArrayList<>();
        ExecutableElement found = null;
        for (Element enclosed : target.getEnclosedElements()) {
            if (enclosed.getKind() != ElementKind.METHOD) {
                continue;
            }
            ExecutableElement method = (ExecutableElement) enclosed;
            String name = method.getSimpleName().toString();
            if (method.getModifiers().contains(Modifier.STATIC) && method.getParameters().isEmpty()) {
                candidates.add(name);
            }
            // Prefer the no-arg overload when several share the name
            if (name.equals(methodName) && (found == null || method.getParameters().isEmpty())) {
                found = method;
            }
        }

        if (found == null) {
            reportNotFound("Factory method", methodName, target, candidates, errorReporter, annotatedElement);
            return false;
        }

        String where = "Factory method '" + methodName + "' in " + target.getSimpleName();
        if (!found.getModifiers().contains(Modifier.STATIC)) {
            errorReporter.error(annotatedElement, where + " must be static.");
            return false;
        }
        if (found.getModifiers().contains(Modifier.PRIVATE)) {
            errorReporter.error(annotatedElement, where + " must not be private.");
            return false;
        }
        if (!found.getParameters().isEmpty()) {
            errorReporter.error(annotatedElement, where + " must have no parameters.");
            return false;
        }
        TypeMirror returnType = found.getReturnType();
        if (returnType.getKind() == TypeKind.VOID) {
            errorReporter.error(annotatedElement, where + " cannot return void.");
            return false;
        }
        if (!typeUtils.isAssignable(returnType, expectedType)) {
            errorReporter.error(annotatedElement, where + " returns " + returnType
                    + " which is not assignable to " + expectedType + ".");
            return false;
        }
        return true;
    }

    // ==================== RESOLUTION ====================

    /**
     * Resolves the class a reference points into.
     *
     * @return the class, or {@code null} if an error was reported
     */
    private static TypeElement resolveTarget(String ref, String annotationName, String example,
                                             TypeElement controller, Element annotatedElement,
                                             ErrorReporter errorReporter, Elements elementUtils) {
        if (ref == null || ref.isEmpty()) {
            errorReporter.error(annotatedElement, annotationName + " requires a non-empty reference.");
            return null;
        }
        int lastDot = ref.lastIndexOf('.');
        if (lastDot == -1) {
            return controller;
        }
        if (lastDot == ref.length() - 1) {
            errorReporter.error(annotatedElement,
                    annotationName + " reference '" + ref + "' has an empty member name.");
            return null;
        }

        String className = ref.substring(0, lastDot);
        TypeElement target = elementUtils.getTypeElement(className);
        if (target == null) {
            String pkg = elementUtils.getPackageOf(controller).getQualifiedName().toString();
            if (!pkg.isEmpty()) {
                target = elementUtils.getTypeElement(pkg + "." + className);
            }
        }
        if (target == null) {
            errorReporter.error(annotatedElement,
                    "Class '" + className + "' not found for " + annotationName + " reference '" + ref + "'. "
                            + "Hint: Use the fully qualified class name (e.g., " + example + ").");
        }
        return target;
    }

    private static String memberName(String ref) {
        return ref.substring(ref.lastIndexOf('.') + 1);
    }

    private static void reportNotFound(String memberType, String memberName, TypeElement target,
                                       List<String> candidates, ErrorReporter errorReporter,
                                       Element annotatedElement) {
        boolean isMethod = memberType.contains("method");
        String call = isMethod ? "()" : "";
        StringBuilder message = new StringBuilder()
                .append(memberType).append(" '").append(memberName).append("' not found in ")
                .append(target.getSimpleName()).append(".");

        String suggestion = findSimilar(memberName, candidates);
        if (suggestion != null) {
            message.append(" Did you mean '").append(suggestion).append(call).append("'?");
        } else if (!candidates.isEmpty()) {
            message.append(isMethod ? " Available static no-arg methods: " : " Available static fields: ")
                    .append(String.join(", ", candidates.stream().map(c -> c + call).toList()))
                    .append(".");
        } else {
            message.append(isMethod
                    ? " Ensure the method exists and is static with no parameters."
                    : " Ensure the field exists and is static.");
        }
        errorReporter.error(annotatedElement, message.toString());
    }

    // ==================== TYPO DETECTION ====================

    /**
     * Finds the candidate closest to {@code target} by case-insensitive edit distance.
     *
     * <p>Candidates further than {@code max(2, target.length() / 3)} edits are ignored.
     *
     * @param target     the unresolved name
     * @param candidates the valid names
     * @return the closest candidate, or {@code null} if none is close enough
     */
    static String findSimilar(String target, List<String> candidates) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        int threshold = Math.max(2, target.length() / 3);

        for (String candidate : candidates) {
            int distance = levenshteinDistance(target.toLowerCase(), candidate.toLowerCase());
            if (distance < bestDistance && distance <= threshold) {
                bestDistance = distance;
                best = candidate;
            }
        }
        return best;
    }

    static int levenshteinDistance(String s1, String s2) {
        int[] prev = new int[s2.length() + 1];
        int[] curr = new int[s2.length() + 1];
        for (int j = 0; j <= s2.length(); j++) {
            prev[j] = j;
        }

        for (int i = 1; i <= s1.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] temp = prev;
            prev = curr;
            curr = temp;
        }
        return prev[s2.length()];
    }
}
