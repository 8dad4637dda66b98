package io.github.reugn.route4j.processor;

import io.github.reugn.route4j.annotation.COPY;
import io.github.reugn.route4j.annotation.CustomEndPoint;
import io.github.reugn.route4j.annotation.CustomRouteBuilder;
import io.github.reugn.route4j.annotation.DELETE;
import io.github.reugn.route4j.annotation.EndPoint;
import io.github.reugn.route4j.annotation.GET;
import io.github.reugn.route4j.annotation.HEAD;
import io.github.reugn.route4j.annotation.MOVE;
import io.github.reugn.route4j.annotation.OPTIONS;
import io.github.reugn.route4j.annotation.PATCH;
import io.github.reugn.route4j.annotation.POST;
import io.github.reugn.route4j.annotation.PUT;

import java.lang.annotation.Annotation;

/**
 * The closed set of route-producing method annotations.
 */
enum RouteMarker {
    END_POINT(EndPoint.class, EndpointKind.ENDPOINT, null),
    HTTP_GET(GET.class, EndpointKind.METHOD_SHORTHAND, "GET"),
    HTTP_POST(POST.class, EndpointKind.METHOD_SHORTHAND, "POST"),
    HTTP_PUT(PUT.class, EndpointKind.METHOD_SHORTHAND, "PUT"),
    HTTP_DELETE(DELETE.class, EndpointKind.METHOD_SHORTHAND, "DELETE"),
    HTTP_PATCH(PATCH.class, EndpointKind.METHOD_SHORTHAND, "PATCH"),
    HTTP_HEAD(HEAD.class, EndpointKind.METHOD_SHORTHAND, "HEAD"),
    HTTP_OPTIONS(OPTIONS.class, EndpointKind.METHOD_SHORTHAND, "OPTIONS"),
    HTTP_MOVE(MOVE.class, EndpointKind.METHOD_SHORTHAND, "MOVE"),
    HTTP_COPY(COPY.class, EndpointKind.METHOD_SHORTHAND, "COPY"),
    CUSTOM_END_POINT(CustomEndPoint.class, EndpointKind.CUSTOM_ENDPOINT, null),
    CUSTOM_ROUTE_BUILDER(CustomRouteBuilder.class, EndpointKind.CUSTOM_ROUTE_BUILDER, null);

    private final Class<? extends Annotation> annotation;
    private final EndpointKind kind;
    private final String impliedMethod;

    RouteMarker(Class<? extends Annotation> annotation, EndpointKind kind, String impliedMethod) {
        this.annotation = annotation;
        this.kind = kind;
        this.impliedMethod = impliedMethod;
    }

    String annotationName() {
        return annotation.getCanonicalName();
    }

    String displayName() {
        return "@" + annotation.getSimpleName();
    }

    EndpointKind kind() {
        return kind;
    }

    /**
     * Returns the HTTP method of a shorthand annotation.
     *
     * @return the method, or {@code null} if the annotation takes it as an argument
     */
    String impliedMethod() {
        return impliedMethod;
    }

    static RouteMarker forAnnotation(String annotationName) {
        for (RouteMarker marker : values()) {
            if (marker.annotationName().equals(annotationName)) {
                return marker;
            }
        }
        return null;
    }
}
