package io.github.reugn.route4j.processor;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.AnnotationValueVisitor;
import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.SimpleAnnotationValueVisitor14;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an annotation mirror as an ordered list of call arguments.
 *
 * <p><b>Conversion:</b>
 * <ul>
 *   <li>Only explicitly written elements become arguments; defaults are applied later</li>
 *   <li>Arguments follow the element declaration order of the annotation type</li>
 *   <li>The {@code value} element is unlabeled, every other element is labeled by its name</li>
 *   <li>A non-empty array becomes one argument per item; only the first item carries the
 *       label, which is the call shape a variadic rule consumes</li>
 *   <li>An explicitly empty array stays a single labeled argument holding the empty array</li>
 * </ul>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * @GET(value = {"books", ":id"}, middleware = Auth.class)
 * // → ("books"), (":id"), (middleware: Auth.class)
 * }</pre>
 */
final class AnnotationArguments {

    private static final String VALUE = "value";

    // Yields the items of an array value, null for any other value
    private static final AnnotationValueVisitor<List<? extends AnnotationValue>, Void> ARRAY_ITEMS =
            new SimpleAnnotationValueVisitor14<>() {
                @Override
                public List<? extends AnnotationValue> visitArray(List<? extends AnnotationValue> values, Void unused) {
                    return values;
                }
            };

    private AnnotationArguments() {
    }

    static List<Argument<AnnotationValue>> of(AnnotationMirror mirror) {
        Map<String, AnnotationValue> explicit = new HashMap<>();
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> entry
                : mirror.getElementValues().entrySet()) {
            explicit.put(entry.getKey().getSimpleName().toString(), entry.getValue());
        }

        List<Argument<AnnotationValue>> arguments = new ArrayList<>();
        Element annotationType = mirror.getAnnotationType().asElement();
        for (ExecutableElement element : ElementFilter.methodsIn(annotationType.getEnclosedElements())) {
            String name = element.getSimpleName().toString();
            AnnotationValue value = explicit.get(name);
            if (value == null) {
                continue;
            }
            String label = VALUE.equals(name) ? null : name;
            List<? extends AnnotationValue> items = arrayItems(value);
            if (items == null || items.isEmpty()) {
                arguments.add(new Argument<>(label, value));
            } else {
                for (int i = 0; i < items.size(); i++) {
                    arguments.add(new Argument<>(i == 0 ? label : null, items.get(i)));
                }
            }
        }
        return arguments;
    }

    /**
     * Flattens a matched bucket back into annotation values, expanding array arguments.
     *
     * @param bucket the bucket produced by {@link ArgumentMatcher}
     * @return the values in order; empty for an empty array
     */
    static List<AnnotationValue> values(List<Argument<AnnotationValue>> bucket) {
        List<AnnotationValue> values = new ArrayList<>();
        for (Argument<AnnotationValue> argument : bucket) {
            List<? extends AnnotationValue> items = arrayItems(argument.value());
            if (items != null) {
                values.addAll(items);
            } else {
                values.add(argument.value());
            }
        }
        return values;
    }

    /**
     * Finds the mirror of an annotation on an element by qualified name.
     *
     * @param element        the annotated element
     * @param annotationName the qualified annotation name
     * @return the mirror, or {@code null} if absent
     */
    static AnnotationMirror find(Element element, String annotationName) {
        for (AnnotationMirror mirror : element.getAnnotationMirrors()) {
            if (qualifiedName(mirror).equals(annotationName)) {
                return mirror;
            }
        }
        return null;
    }

    static String qualifiedName(AnnotationMirror mirror) {
        return ((TypeElement) mirror.getAnnotationType().asElement()).getQualifiedName().toString();
    }

    static String simpleName(AnnotationMirror mirror) {
        return mirror.getAnnotationType().asElement().getSimpleName().toString();
    }

    private static List<? extends AnnotationValue> arrayItems(AnnotationValue value) {
        return value.accept(ARRAY_ITEMS, null);
    }
}
