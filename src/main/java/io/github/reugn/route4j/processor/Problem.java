package io.github.reugn.route4j.processor;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;

/**
 * A compile error found while expanding one route annotation.
 *
 * @param element    the offending element
 * @param annotation the annotation to point at, or {@code null}
 * @param message    the error message
 * @param fix        a suggested rewrite, or {@code null}
 */
record Problem(Element element, AnnotationMirror annotation, String message, String fix) {

    static Problem of(Element element, AnnotationMirror annotation, String message) {
        return new Problem(element, annotation, message, null);
    }

    static Problem withFix(Element element, AnnotationMirror annotation, String message, String fix) {
        return new Problem(element, annotation, message, fix);
    }

    /**
     * Returns the message as shown to the user, including the suggested rewrite.
     *
     * @return the rendered message
     */
    String render() {
        return fix == null ? message : message + " Suggested fix: " + fix + ".";
    }
}
