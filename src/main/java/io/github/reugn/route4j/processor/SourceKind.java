package io.github.reugn.route4j.processor;

import io.github.reugn.route4j.annotation.AuthContent;
import io.github.reugn.route4j.annotation.PathParam;
import io.github.reugn.route4j.annotation.QueryContent;
import io.github.reugn.route4j.annotation.QueryParam;
import io.github.reugn.route4j.annotation.Req;
import io.github.reugn.route4j.annotation.ReqContent;
import io.github.reugn.route4j.annotation.RequestField;

import java.lang.annotation.Annotation;
import java.util.List;

import static io.github.reugn.route4j.processor.ParsingRule.unlabeled;

/**
 * The closed set of request value sources a handler parameter can bind to.
 */
enum SourceKind {
    PATH_PARAM(PathParam.class, Shape.KEYED),
    BODY(ReqContent.class, Shape.WHOLE),
    QUERY_PARAM(QueryParam.class, Shape.KEYED),
    QUERY_CONTENT(QueryContent.class, Shape.WHOLE),
    AUTH_CONTENT(AuthContent.class, Shape.WHOLE),
    REQUEST_FIELD(RequestField.class, Shape.PROJECTION),
    RAW_REQUEST(Req.class, Shape.PROJECTION);

    /**
     * What configuration a source annotation carries.
     */
    enum Shape {
        /**
         * A key, defaulting to the parameter name.
         */
        KEYED,
        /**
         * Nothing; the whole source is decoded as the parameter type.
         */
        WHOLE,
        /**
         * An accessor path, defaulting to the request itself.
         */
        PROJECTION
    }

    private final Class<? extends Annotation> annotation;
    private final Shape shape;

    SourceKind(Class<? extends Annotation> annotation, Shape shape) {
        this.annotation = annotation;
        this.shape = shape;
    }

    String annotationName() {
        return annotation.getCanonicalName();
    }

    String displayName() {
        return "@" + annotation.getSimpleName();
    }

    Shape shape() {
        return shape;
    }

    boolean isProjection() {
        return shape == Shape.PROJECTION;
    }

    /**
     * Returns the argument rules of the source annotation.
     *
     * @return a single optional unlabeled rule for keyed and projection sources, none otherwise
     */
    List<ParsingRule> rules() {
        return shape == Shape.WHOLE ? List.of() : List.of(unlabeled().optional());
    }

    /**
     * Looks up the source kind of an annotation.
     *
     * @param annotationName the qualified annotation name
     * @return the kind, or {@code null} if the annotation is not a source annotation
     */
    static SourceKind forAnnotation(String annotationName) {
        for (SourceKind kind : values()) {
            if (kind.annotationName().equals(annotationName)) {
                return kind;
            }
        }
        return null;
    }
}
