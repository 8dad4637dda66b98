package io.github.reugn.route4j.processor;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;
import javax.tools.Diagnostic;

/**
 * Interface for reporting compilation diagnostics.
 */
@FunctionalInterface
interface ErrorReporter {
    /**
     * Reports a diagnostic.
     *
     * @param kind       the diagnostic kind
     * @param element    the element the diagnostic is attached to, or {@code null}
     * @param annotation the annotation on {@code element} to point at, or {@code null}
     * @param message    the message
     */
    void report(Diagnostic.Kind kind, Element element, AnnotationMirror annotation, String message);

    default void error(Element element, String message) {
        report(Diagnostic.Kind.ERROR, element, null, message);
    }

    default void error(Problem problem) {
        report(Diagnostic.Kind.ERROR, problem.element(), problem.annotation(), problem.render());
    }

    default void warning(Element element, String message) {
        report(Diagnostic.Kind.WARNING, element, null, message);
    }

    default void note(Element element, String message) {
        report(Diagnostic.Kind.NOTE, element, null, message);
    }
}
